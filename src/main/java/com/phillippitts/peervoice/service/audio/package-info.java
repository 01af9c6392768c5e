/**
 * Audio format constants, PCM conversions, WAV output, capture and segment classification.
 */
package com.phillippitts.peervoice.service.audio;
