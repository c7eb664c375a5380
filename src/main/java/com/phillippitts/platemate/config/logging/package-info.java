/**
 * Logging infrastructure: MDC population for HTTP requests.
 */
package com.phillippitts.platemate.config.logging;
