/**
 * Interfaces that allow customization of the reporting client's components.
 * <p>
 * You will not need to refer to these types in your code unless you are replacing the HTTP
 * transport or the credential check, for instance in a test harness.
 */
package com.tunercloud.client.interfaces;
