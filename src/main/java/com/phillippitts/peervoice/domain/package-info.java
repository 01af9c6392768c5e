/**
 * Immutable value types shared by the capture, batching and interaction layers.
 */
package com.phillippitts.peervoice.domain;
