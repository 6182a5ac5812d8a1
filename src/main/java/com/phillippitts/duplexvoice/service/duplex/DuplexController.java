package com.phillippitts.duplexvoice.service.duplex;

import com.phillippitts.duplexvoice.domain.DuplexConfig;
import com.phillippitts.duplexvoice.domain.DuplexEvent;
import com.phillippitts.duplexvoice.domain.DuplexState;
import com.phillippitts.duplexvoice.domain.TurnState;
import com.phillippitts.duplexvoice.service.audio.AudioInputSource;
import com.phillippitts.duplexvoice.service.audio.AudioOutputSink;
import com.phillippitts.duplexvoice.service.intent.IntentAnalyzer;
import com.phillippitts.duplexvoice.service.stt.SpeechRecognizer;
import com.phillippitts.duplexvoice.service.tts.SpeechSynthesizer;

import java.util.stream.Stream;

/**
 * Coordinates a full-duplex voice conversation: listening, responding, interruption and
 * backchannels run concurrently over one audio input and one audio output.
 *
 * <p><b>Session Lifecycle:</b>
 * <ol>
 *   <li>Attach collaborators with {@link #setComponents}</li>
 *   <li>Optionally register {@link #setCallbacks callbacks} and a {@link #setContext context}</li>
 *   <li>Call {@link #start} to launch the listen, process, speak and monitor loops</li>
 *   <li>Call {@link #stop} to cancel every loop and return to {@link DuplexState#IDLE}</li>
 * </ol>
 *
 * <p><b>Thread Safety:</b> all methods may be called from any thread except that {@link #stop()}
 * must not be called from a loop or callback of the session it stops. At most one session runs
 * per controller.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * controller.setComponents(recognizer, synthesizer, analyzer);
 * controller.start(microphone, speaker);
 * try (Stream<DuplexEvent> events = controller.getEvents()) {
 *     events.forEach(e -> LOG.info("{} {}", e.type(), e.data()));
 * }
 * }</pre>
 */
public interface DuplexController {

    /**
     * Attaches the external collaborators used by the next session.
     *
     * @throws com.phillippitts.duplexvoice.exception.ControllerConfigurationException
     *         if a session is running or any argument is null
     */
    void setComponents(SpeechRecognizer recognizer, SpeechSynthesizer synthesizer, IntentAnalyzer intentAnalyzer);

    /**
     * Replaces the registered callbacks. {@code null} clears them.
     */
    void setCallbacks(DuplexCallbacks callbacks);

    /**
     * Sets the conversation context passed to the intent analyzer. May be null.
     */
    void setContext(String context);

    /**
     * Starts a session. Returns once the loops are running.
     *
     * @param audioInput  microphone or other PCM source; closed by {@link #stop()}
     * @param audioOutput destination for synthesized audio
     * @throws com.phillippitts.duplexvoice.exception.ControllerConfigurationException
     *         if components are missing or a session is already running
     */
    void start(AudioInputSource audioInput, AudioOutputSink audioOutput);

    /**
     * Stops the current session and blocks until every loop has exited. Idempotent.
     */
    void stop();

    /**
     * Returns a new, independent stream of events produced from now on.
     *
     * <p>The stream blocks between events and ends when the controller stops. Close it to
     * unsubscribe early.
     */
    Stream<DuplexEvent> getEvents();

    DuplexState getState();

    TurnState getTurn();

    /**
     * @return {@code true} while a session is running, whatever the state
     */
    boolean isRunning();

    /**
     * @return {@code true} while user speech is being taken in as the turn (LISTENING or DUPLEX)
     */
    boolean isListening();

    /**
     * @return {@code true} while a response is playing (SPEAKING or DUPLEX)
     */
    boolean isSpeaking();

    /**
     * @return {@code true} once all three collaborators are attached
     */
    boolean hasComponents();

    DuplexConfig getConfig();
}
