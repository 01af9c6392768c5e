/**
 * Spring configuration: typed properties, executors, bean wiring and startup validation.
 */
package com.phillippitts.peervoice.config;
