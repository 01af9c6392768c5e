/**
 * Speech recognizer seam and its whisper.cpp command-line adapter.
 */
package com.phillippitts.peervoice.service.stt;
