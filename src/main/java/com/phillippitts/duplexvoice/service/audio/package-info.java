/**
 * Audio boundary of the duplex controller.
 *
 * <p>Capture and playback hardware are external; the controller only sees
 * {@link com.phillippitts.duplexvoice.service.audio.AudioInputSource} and
 * {@link com.phillippitts.duplexvoice.service.audio.AudioOutputSink}. Chunks are raw PCM at the
 * sample rate configured in {@code DuplexConfig}.
 */
package com.phillippitts.duplexvoice.service.audio;
