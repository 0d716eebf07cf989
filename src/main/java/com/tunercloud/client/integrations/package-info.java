/**
 * Builders for configuring the reporting client's components.
 * <p>
 * The class in this package is obtained through {@link com.tunercloud.client.Components} and
 * passed to {@link com.tunercloud.client.ReportingConfig.Builder}.
 */
package com.tunercloud.client.integrations;
