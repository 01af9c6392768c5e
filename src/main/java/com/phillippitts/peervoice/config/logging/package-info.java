/**
 * Logging configuration: request-scoped MDC for Log4j2.
 */
package com.phillippitts.peervoice.config.logging;
