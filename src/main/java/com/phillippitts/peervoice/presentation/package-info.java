/**
 * REST boundary: session control endpoints and error mapping.
 */
package com.phillippitts.peervoice.presentation;
