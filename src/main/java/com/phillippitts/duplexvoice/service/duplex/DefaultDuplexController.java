package com.phillippitts.duplexvoice.service.duplex;

import com.phillippitts.duplexvoice.domain.DuplexConfig;
import com.phillippitts.duplexvoice.domain.DuplexEvent;
import com.phillippitts.duplexvoice.domain.DuplexState;
import com.phillippitts.duplexvoice.domain.Intent;
import com.phillippitts.duplexvoice.domain.Transcription;
import com.phillippitts.duplexvoice.domain.TurnState;
import com.phillippitts.duplexvoice.exception.ControllerConfigurationException;
import com.phillippitts.duplexvoice.exception.DuplexVoiceException;
import com.phillippitts.duplexvoice.exception.RecognitionException;
import com.phillippitts.duplexvoice.exception.SynthesisException;
import com.phillippitts.duplexvoice.service.audio.AudioInputSource;
import com.phillippitts.duplexvoice.service.audio.AudioOutputSink;
import com.phillippitts.duplexvoice.service.intent.IntentAnalyzer;
import com.phillippitts.duplexvoice.service.response.ResponseGenerator;
import com.phillippitts.duplexvoice.service.stt.RecognitionStream;
import com.phillippitts.duplexvoice.service.stt.SpeechRecognizer;
import com.phillippitts.duplexvoice.service.tts.SpeechSynthesizer;
import com.phillippitts.duplexvoice.util.LogSanitizer;
import com.phillippitts.duplexvoice.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Default {@link DuplexController} running four cooperating loops per session.
 *
 * <p><b>Loops:</b>
 * <ul>
 *   <li><b>listen</b>: pulls transcriptions from the recognizer, updates the turn state, queues
 *       them for processing and publishes transcription events</li>
 *   <li><b>process</b>: turns final transcriptions into response text via the intent analyzer and
 *       the response generator</li>
 *   <li><b>speak</b>: plays responses through the synthesizer, checking for interruption before
 *       each chunk is written</li>
 *   <li><b>monitor</b>: emits throttled backchannels while the user holds the turn</li>
 * </ul>
 *
 * <p>All loops share one {@link DuplexStateMachine} and one {@link SpeechTimingTracker}. Every
 * blocking call is bounded by {@code pollInterval}, so {@link #stop()} is observed within one
 * interval unless an external collaborator blocks longer.
 *
 * <p><b>Error Handling:</b> a failure inside one loop iteration is logged, counted and skipped;
 * it never terminates another loop. Only {@link #stop()} ends a session.
 *
 * @see DuplexControllerBuilder
 */
public class DefaultDuplexController implements DuplexController {

    private static final Logger LOG = LogManager.getLogger(DefaultDuplexController.class);

    static final String SESSION_KEY = "sessionId";

    private final DuplexConfig config;
    private final Executor loopExecutor;
    private final Executor backchannelExecutor;
    private final ResponseGenerator responseGenerator;
    private final DuplexMetricsPublisher metrics;
    private final DuplexStateMachine stateMachine;
    private final SpeechTimingTracker timing;
    private final InterruptionDetector interruptionDetector;
    private final BackchannelPolicy backchannelPolicy;
    private final DuplexEventBus events;
    private final long pollMillis;

    private final ReentrantLock lifecycleLock = new ReentrantLock();

    private volatile SpeechRecognizer recognizer;
    private volatile SpeechSynthesizer synthesizer;
    private volatile IntentAnalyzer intentAnalyzer;
    private volatile DuplexCallbacks callbacks = DuplexCallbacks.NONE;
    private volatile String context;
    private volatile Session session;

    /**
     * Constructs a controller. Prefer {@link DuplexControllerBuilder}.
     *
     * @throws NullPointerException if any argument is null
     */
    public DefaultDuplexController(DuplexConfig config,
                                   Executor loopExecutor,
                                   Executor backchannelExecutor,
                                   ResponseGenerator responseGenerator,
                                   DuplexMetricsPublisher metrics,
                                   SpeechTimingTracker timing,
                                   DuplexEventBus events) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.loopExecutor = Objects.requireNonNull(loopExecutor, "loopExecutor must not be null");
        this.backchannelExecutor = Objects.requireNonNull(backchannelExecutor,
                "backchannelExecutor must not be null");
        this.responseGenerator = Objects.requireNonNull(responseGenerator, "responseGenerator must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.timing = Objects.requireNonNull(timing, "timing must not be null");
        this.events = Objects.requireNonNull(events, "events must not be null");
        this.stateMachine = new DuplexStateMachine();
        this.interruptionDetector = new InterruptionDetector(config);
        this.backchannelPolicy = new BackchannelPolicy(config);
        this.pollMillis = Math.max(1, config.pollInterval().toMillis());
    }

    @Override
    public void setComponents(SpeechRecognizer recognizer,
                              SpeechSynthesizer synthesizer,
                              IntentAnalyzer intentAnalyzer) {
        if (recognizer == null || synthesizer == null || intentAnalyzer == null) {
            throw new ControllerConfigurationException(
                    "recognizer, synthesizer and intentAnalyzer are all required");
        }
        lifecycleLock.lock();
        try {
            if (session != null) {
                throw new ControllerConfigurationException("Cannot replace components while a session is running");
            }
            this.recognizer = recognizer;
            this.synthesizer = synthesizer;
            this.intentAnalyzer = intentAnalyzer;
            LOG.info("Components attached: recognizer={}, synthesizer={}, intentAnalyzer={}",
                    recognizer.getClass().getSimpleName(),
                    synthesizer.getClass().getSimpleName(),
                    intentAnalyzer.getClass().getSimpleName());
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public void setCallbacks(DuplexCallbacks callbacks) {
        this.callbacks = callbacks == null ? DuplexCallbacks.NONE : callbacks;
    }

    @Override
    public void setContext(String context) {
        this.context = context;
    }

    @Override
    public void start(AudioInputSource audioInput, AudioOutputSink audioOutput) {
        if (audioInput == null || audioOutput == null) {
            throw new ControllerConfigurationException("audioInput and audioOutput are required");
        }
        lifecycleLock.lock();
        try {
            if (session != null) {
                throw new ControllerConfigurationException("Duplex session already running (session="
                        + session.id + ")");
            }
            if (!hasComponents()) {
                throw new ControllerConfigurationException("Components not set; call setComponents() before start()");
            }

            Session s = new Session(UUID.randomUUID().toString(), audioInput, audioOutput,
                    recognizer, synthesizer, intentAnalyzer);
            timing.reset();
            stateMachine.start();
            events.open();
            session = s;

            try {
                launch(s, DuplexMetricsPublisher.LOOP_LISTEN, () -> listenLoop(s));
                launch(s, DuplexMetricsPublisher.LOOP_PROCESS, () -> processLoop(s));
                launch(s, DuplexMetricsPublisher.LOOP_SPEAK, () -> speakLoop(s));
                launch(s, DuplexMetricsPublisher.LOOP_MONITOR, () -> monitorLoop(s));
            } catch (RejectedExecutionException e) {
                LOG.error("Loop executor rejected duplex loops (session={}); rolling back", s.id);
                stop();
                throw new DuplexVoiceException("Loop executor has no capacity for a duplex session", e);
            }

            LOG.info("Duplex session started (session={}, language={}, interruptions={}, backchannels={})",
                    s.id, config.language(), config.allowInterruptions(), config.enableBackchannels());
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     *
     * @throws ControllerConfigurationException if called from one of the session's own loops,
     *         e.g. from a {@link DuplexCallbacks} hook
     */
    @Override
    public void stop() {
        Session current = session;
        if (current != null && current.loopThreads.contains(Thread.currentThread())) {
            throw new ControllerConfigurationException("stop() must not be called from a controller loop or callback");
        }
        lifecycleLock.lock();
        try {
            Session s = session;
            if (s == null) {
                LOG.debug("stop() called with no active session; ignoring");
                return;
            }
            s.running = false;

            closeQuietly("synthesizer", s.synthesizer::stop);
            RecognitionStream stream = s.recognition;
            if (stream != null) {
                closeQuietly("recognition stream", stream::close);
            }
            closeQuietly("audio input", s.input::close);

            long deadline = System.nanoTime() + config.stopTimeout().toNanos();
            for (Map.Entry<String, FutureTask<Void>> loop : s.loops.entrySet()) {
                awaitTermination(loop.getKey() + " loop", loop.getValue(), deadline);
            }
            for (Future<?> backchannel : List.copyOf(s.backchannels)) {
                awaitTermination("backchannel", backchannel, deadline);
            }

            s.transcriptions.clear();
            s.responses.clear();
            stateMachine.reset();
            timing.reset();
            session = null;
            events.close();
            LOG.info("Duplex session stopped (session={})", s.id);
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public Stream<DuplexEvent> getEvents() {
        return events.subscribe();
    }

    @Override
    public DuplexState getState() {
        return stateMachine.getState();
    }

    @Override
    public TurnState getTurn() {
        return stateMachine.getTurn();
    }

    @Override
    public boolean isRunning() {
        return session != null && stateMachine.getState() != DuplexState.IDLE;
    }

    @Override
    public boolean isListening() {
        DuplexState state = stateMachine.getState();
        return session != null && (state == DuplexState.LISTENING || state == DuplexState.DUPLEX);
    }

    @Override
    public boolean isSpeaking() {
        return stateMachine.isResponseInProgress();
    }

    @Override
    public boolean hasComponents() {
        return recognizer != null && synthesizer != null && intentAnalyzer != null;
    }

    @Override
    public DuplexConfig getConfig() {
        return config;
    }

    // ---------------------------------------------------------------------------------------
    // Listen loop
    // ---------------------------------------------------------------------------------------

    private void listenLoop(Session s) throws InterruptedException {
        RecognitionStream stream = openRecognition(s);
        while (s.running) {
            if (stream == null || !stream.isOpen()) {
                // Recognizer exhausted or unavailable: idle until stop()
                Thread.sleep(pollMillis);
                continue;
            }
            Optional<Transcription> next;
            try {
                next = stream.poll(config.pollInterval());
            } catch (RecognitionException e) {
                LOG.warn("Recognition failed for one chunk (engine={}): {}", e.getEngineName(), e.getMessage());
                metrics.recordLoopError(DuplexMetricsPublisher.LOOP_LISTEN);
                Thread.sleep(pollMillis);
                continue;
            } catch (RuntimeException e) {
                LOG.warn("Recognizer poll failed: {}", e.toString());
                metrics.recordLoopError(DuplexMetricsPublisher.LOOP_LISTEN);
                Thread.sleep(pollMillis);
                continue;
            }
            if (next.isPresent() && s.running) {
                handleTranscription(s, next.get());
            }
        }
    }

    private RecognitionStream openRecognition(Session s) {
        RecognitionStream stream;
        try {
            stream = s.recognizer.transcribeStream(s.input, config.language());
        } catch (RuntimeException e) {
            LOG.error("Failed to open recognition stream (language={})", config.language(), e);
            metrics.recordLoopError(DuplexMetricsPublisher.LOOP_LISTEN);
            return null;
        }
        s.recognition = stream;
        if (!s.running && stream != null) {
            // stop() ran before the stream was published
            closeQuietly("recognition stream", stream::close);
        }
        return stream;
    }

    private void handleTranscription(Session s, Transcription transcription) {
        long heardAt = timing.recordUserSpeech();
        DuplexState state = stateMachine.onUserSpeech();
        s.transcriptions.offer(transcription);
        metrics.recordTranscription(transcription.isFinal());

        if (LOG.isDebugEnabled()) {
            LOG.debug("Transcription (final={}, state={}): '{}'", transcription.isFinal(), state,
                    LogSanitizer.preview(transcription.text()));
        }

        events.publish(DuplexEvent.transcription(transcription, TimeUtils.toInstant(heardAt)));
        invokeCallback("onTranscription", callbacks.onTranscription(), transcription);
    }

    // ---------------------------------------------------------------------------------------
    // Process loop
    // ---------------------------------------------------------------------------------------

    private void processLoop(Session s) throws InterruptedException {
        while (s.running) {
            Transcription transcription = s.transcriptions.poll(pollMillis, TimeUnit.MILLISECONDS);
            if (transcription == null || !transcription.isFinal() || transcription.text().isBlank()) {
                continue;
            }
            long startNanos = System.nanoTime();
            try {
                Intent intent = s.intentAnalyzer.analyze(transcription.text(), context);
                invokeCallback("onIntent", callbacks.onIntent(), intent);

                String response = responseGenerator.generate(intent, config.language());
                if (response == null || response.isBlank()) {
                    LOG.debug("No response generated for action={}", intent.action().value());
                    continue;
                }
                if (!s.running) {
                    return;
                }
                s.responses.offer(response);
                metrics.recordResponseQueued(TimeUtils.elapsedNanos(startNanos));
                LOG.debug("Response queued in {} ms (action={}): '{}'", TimeUtils.elapsedMillis(startNanos),
                        intent.action().value(), LogSanitizer.preview(response));
            } catch (RuntimeException e) {
                LOG.warn("Failed to process transcription '{}': {}",
                        LogSanitizer.preview(transcription.text()), e.toString());
                metrics.recordLoopError(DuplexMetricsPublisher.LOOP_PROCESS);
            }
        }
    }

    // ---------------------------------------------------------------------------------------
    // Speak loop
    // ---------------------------------------------------------------------------------------

    private void speakLoop(Session s) throws InterruptedException {
        String pending = null;
        while (s.running) {
            if (pending == null) {
                pending = s.responses.poll(pollMillis, TimeUnit.MILLISECONDS);
                if (pending == null) {
                    continue;
                }
            }
            // Unprocessed user speech takes priority over starting a new response
            if (!s.transcriptions.isEmpty() || !stateMachine.beginResponse()) {
                Thread.sleep(pollMillis);
                continue;
            }
            String text = pending;
            pending = null;
            speak(s, text);
        }
    }

    private void speak(Session s, String text) {
        LOG.debug("Speaking response: '{}'", LogSanitizer.preview(text));
        try {
            Iterator<byte[]> chunks = s.synthesizer.speakStream(text, config.language());
            while (s.running && chunks.hasNext()) {
                byte[] chunk = chunks.next();
                if (!s.running) {
                    return;
                }
                if (interruptionDetector.shouldInterrupt(stateMachine.getState(), timing.millisSinceUserSpeech())) {
                    handleInterruption(s, text);
                    return;
                }
                s.output.write(chunk);
                timing.recordAssistantSpeech();
            }
        } catch (SynthesisException e) {
            abandonResponse(s);
            LOG.warn("Synthesis failed mid-response '{}': {}", LogSanitizer.preview(text), e.getMessage());
            return;
        } catch (RuntimeException e) {
            abandonResponse(s);
            LOG.warn("Synthesizer error during response '{}'", LogSanitizer.preview(text), e);
            return;
        }

        if (s.running && stateMachine.endResponse()) {
            events.publish(DuplexEvent.response(text, TimeUtils.toInstant(timing.now())));
            metrics.recordResponseCompleted();
            invokeCallback("onResponse", callbacks.onResponse(), text);
        }
    }

    private void abandonResponse(Session s) {
        closeQuietly("synthesizer", s.synthesizer::stop);
        stateMachine.endResponse();
        metrics.recordLoopError(DuplexMetricsPublisher.LOOP_SPEAK);
    }

    private void handleInterruption(Session s, String interruptedText) {
        long triggeredAt = timing.now();
        long userSpeechAt = timing.getLastUserSpeechMs();
        closeQuietly("synthesizer", s.synthesizer::stop);
        if (!stateMachine.interrupt()) {
            return;
        }
        DuplexEvent event = DuplexEvent.interruption(interruptedText,
                TimeUtils.toInstant(triggeredAt), TimeUtils.toInstant(userSpeechAt));
        events.publish(event);
        metrics.recordInterruption();
        LOG.info("Response interrupted by user speech {} ms old: '{}'",
                triggeredAt - userSpeechAt, LogSanitizer.preview(interruptedText));
        invokeCallback("onInterruption", callbacks.onInterruption(), event);
    }

    // ---------------------------------------------------------------------------------------
    // Monitor loop
    // ---------------------------------------------------------------------------------------

    private void monitorLoop(Session s) throws InterruptedException {
        while (s.running) {
            Thread.sleep(pollMillis);
            if (!backchannelPolicy.isEnabled() || !s.running) {
                continue;
            }
            String[] emitted = new String[1];
            try {
                stateMachine.runIfTurn(TurnState.USER, () -> {
                    if (backchannelPolicy.shouldEmit(TurnState.USER,
                            timing.millisSinceBackchannel(), timing.millisSinceUserSpeech())) {
                        String phrase = backchannelPolicy.nextPhrase();
                        long at = timing.recordBackchannel();
                        events.publish(DuplexEvent.backchannel(phrase, TimeUtils.toInstant(at)));
                        metrics.recordBackchannel();
                        emitted[0] = phrase;
                    }
                });
            } catch (RuntimeException e) {
                LOG.warn("Backchannel check failed: {}", e.toString());
                metrics.recordLoopError(DuplexMetricsPublisher.LOOP_MONITOR);
                continue;
            }
            if (emitted[0] != null) {
                LOG.debug("Backchannel: '{}'", emitted[0]);
                playBackchannel(s, emitted[0]);
            }
        }
    }

    private void playBackchannel(Session s, String phrase) {
        s.backchannels.removeIf(Future::isDone);
        FutureTask<Void> task = new FutureTask<>(() -> {
            withSessionContext(s, () -> {
                s.loopThreads.add(Thread.currentThread());
                try {
                    Iterator<byte[]> chunks = s.synthesizer.speakStream(phrase, config.language());
                    while (s.running && chunks.hasNext()) {
                        byte[] chunk = chunks.next();
                        if (!s.running) {
                            break;
                        }
                        s.output.write(chunk);
                    }
                } catch (RuntimeException e) {
                    LOG.warn("Backchannel synthesis failed for '{}': {}", phrase, e.toString());
                    metrics.recordLoopError(DuplexMetricsPublisher.LOOP_MONITOR);
                } finally {
                    s.loopThreads.remove(Thread.currentThread());
                }
            });
            return null;
        });
        s.backchannels.add(task);
        try {
            backchannelExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            s.backchannels.remove(task);
            LOG.debug("Backchannel executor saturated; dropping audio for '{}'", phrase);
        }
    }

    // ---------------------------------------------------------------------------------------
    // Plumbing
    // ---------------------------------------------------------------------------------------

    @FunctionalInterface
    private interface LoopBody {
        void run() throws InterruptedException;
    }

    private void launch(Session s, String name, LoopBody body) {
        FutureTask<Void> task = new FutureTask<>(() -> {
            runLoop(s, name, body);
            return null;
        });
        loopExecutor.execute(task);
        s.loops.put(name, task);
    }

    private void runLoop(Session s, String name, LoopBody body) {
        withSessionContext(s, () -> {
            LOG.debug("{} loop started", name);
            s.loopThreads.add(Thread.currentThread());
            try {
                body.run();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.debug("{} loop interrupted", name);
            } catch (RuntimeException e) {
                LOG.error("{} loop terminated unexpectedly", name, e);
                metrics.recordLoopError(name);
            } finally {
                s.loopThreads.remove(Thread.currentThread());
            }
            LOG.debug("{} loop exited", name);
        });
    }

    private static void withSessionContext(Session s, Runnable action) {
        String previous = ThreadContext.get(SESSION_KEY);
        ThreadContext.put(SESSION_KEY, s.id);
        try {
            action.run();
        } finally {
            if (previous == null) {
                ThreadContext.remove(SESSION_KEY);
            } else {
                ThreadContext.put(SESSION_KEY, previous);
            }
        }
    }

    private void awaitTermination(String name, Future<?> future, long deadlineNanos) {
        long remaining = Math.max(0, deadlineNanos - System.nanoTime());
        try {
            future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            LOG.error("{} did not exit within {} ms; cancelling", name, config.stopTimeout().toMillis());
            future.cancel(true);
        } catch (ExecutionException e) {
            LOG.error("{} failed during shutdown", name, e.getCause());
        } catch (CancellationException e) {
            LOG.debug("{} was already cancelled", name);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for {}; cancelling", name);
            future.cancel(true);
        }
    }

    private static <T> void invokeCallback(String name, Consumer<T> callback, T value) {
        if (callback == null) {
            return;
        }
        try {
            callback.accept(value);
        } catch (RuntimeException e) {
            LOG.warn("Callback {} threw {}; continuing", name, e.toString());
        }
    }

    private static void closeQuietly(String what, Runnable closer) {
        try {
            closer.run();
        } catch (RuntimeException e) {
            LOG.warn("Failed to stop {}: {}", what, e.toString());
        }
    }

    /**
     * Per-session state. A new instance is created by every {@link #start}.
     */
    private static final class Session {
        final String id;
        final AudioInputSource input;
        final AudioOutputSink output;
        final SpeechRecognizer recognizer;
        final SpeechSynthesizer synthesizer;
        final IntentAnalyzer intentAnalyzer;
        final BlockingQueue<Transcription> transcriptions = new LinkedBlockingQueue<>();
        final BlockingQueue<String> responses = new LinkedBlockingQueue<>();
        final Map<String, FutureTask<Void>> loops = new LinkedHashMap<>();
        final Set<Future<?>> backchannels = ConcurrentHashMap.newKeySet();
        final Set<Thread> loopThreads = ConcurrentHashMap.newKeySet();
        volatile boolean running = true;
        volatile RecognitionStream recognition;

        Session(String id, AudioInputSource input, AudioOutputSink output,
                SpeechRecognizer recognizer, SpeechSynthesizer synthesizer, IntentAnalyzer intentAnalyzer) {
            this.id = id;
            this.input = input;
            this.output = output;
            this.recognizer = recognizer;
            this.synthesizer = synthesizer;
            this.intentAnalyzer = intentAnalyzer;
        }
    }
}
