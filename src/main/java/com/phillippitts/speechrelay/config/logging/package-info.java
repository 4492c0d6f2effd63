/**
 * Logging support: MDC population for HTTP requests.
 */
package com.phillippitts.speechrelay.config.logging;
