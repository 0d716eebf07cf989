package com.tunercloud.client;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Runs fire-and-forget tasks on a pool of background workers.
 * <p>
 * {@link #submit(Runnable)} never blocks and never reports a task's result. {@link #drain()} waits for
 * everything submitted so far, and leaves the dispatcher ready for more work on a fresh pool; the
 * retired pool is never used again.
 */
final class AsyncDispatcher implements Closeable {
  private static final Logger logger = LoggerFactory.getLogger(AsyncDispatcher.class);

  private final int workerThreads;
  private final ThreadFactory threadFactory;
  private final Object lock = new Object();
  private ExecutorService executor; // guarded by lock; null once closed

  AsyncDispatcher(int workerThreads) {
    checkArgument(workerThreads > 0, "workerThreads must be positive");
    this.workerThreads = workerThreads;
    this.threadFactory = new ThreadFactoryBuilder()
        .setDaemon(true)
        .setNameFormat("TunerCloud-Dispatcher-%d")
        .setPriority(Thread.MIN_PRIORITY)
        .build();
    this.executor = newPool();
  }

  /**
   * Queues a task and returns immediately. Anything the task throws is logged on the worker thread.
   *
   * @param task the work to run
   */
  void submit(final Runnable task) {
    Runnable guarded = () -> {
      try {
        task.run();
      } catch (Exception e) {
        logger.error("Unexpected error in background send: {}", e.toString());
        logger.debug(e.toString(), e);
      }
    };
    synchronized (lock) {
      if (executor == null) {
        logger.debug("Dispatcher has been closed; task dropped");
        return;
      }
      try {
        executor.execute(guarded);
      } catch (RejectedExecutionException e) {
        logger.warn("Background task could not be scheduled: {}", e.toString());
      }
    }
  }

  /**
   * Blocks until all previously submitted tasks have finished. New tasks submitted while this is
   * waiting go to a fresh pool and are not waited for.
   */
  void drain() {
    ExecutorService retired;
    synchronized (lock) {
      if (executor == null) {
        return;
      }
      retired = executor;
      executor = newPool();
    }
    awaitShutdown(retired);
  }

  /**
   * Waits for all submitted tasks, then stops accepting work permanently.
   */
  @Override
  public void close() {
    ExecutorService retired;
    synchronized (lock) {
      retired = executor;
      executor = null;
    }
    if (retired != null) {
      awaitShutdown(retired);
    }
  }

  int getWorkerThreads() {
    return workerThreads;
  }

  private ExecutorService newPool() {
    return Executors.newFixedThreadPool(workerThreads, threadFactory);
  }

  private static void awaitShutdown(ExecutorService pool) {
    pool.shutdown();
    boolean interrupted = false;
    while (true) {
      try {
        if (pool.awaitTermination(1, TimeUnit.SECONDS)) {
          break;
        }
      } catch (InterruptedException e) {
        interrupted = true;
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }
}
