package com.phillippitts.captionhub.service.session;

import com.phillippitts.captionhub.config.properties.PersistenceProperties;
import com.phillippitts.captionhub.config.properties.SessionProperties;
import com.phillippitts.captionhub.config.properties.TranslationProperties;
import com.phillippitts.captionhub.domain.ChannelKey;
import com.phillippitts.captionhub.domain.Language;
import com.phillippitts.captionhub.domain.Session;
import com.phillippitts.captionhub.domain.SessionState;
import com.phillippitts.captionhub.domain.TranscriptSegment;
import com.phillippitts.captionhub.exception.InvalidStateTransitionException;
import com.phillippitts.captionhub.exception.SessionNotFoundException;
import com.phillippitts.captionhub.exception.SessionStartException;
import com.phillippitts.captionhub.exception.UnsupportedLanguageException;
import com.phillippitts.captionhub.service.broadcast.BroadcastHub;
import com.phillippitts.captionhub.service.broadcast.ReleaseListener;
import com.phillippitts.captionhub.service.persistence.DurableLogger;
import com.phillippitts.captionhub.service.translation.SegmentDispatch;
import com.phillippitts.captionhub.service.translation.TranslationFanOut;
import com.phillippitts.captionhub.util.LogSanitizer;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Default {@link SessionOrchestrator}.
 *
 * <p>Live sessions are held in an owned registry (inserted on create, removed on end). Ended
 * sessions move to a bounded recently-ended map so that a repeated end is still reported as
 * a state violation instead of an unknown session.
 *
 * <p><b>End sequence:</b>
 * <ol>
 *   <li>State flips to {@code ENDED} under the session lock; later segments are refused</li>
 *   <li>In-flight dispatches get {@code session.end-grace-period-ms} to finish; the rest are cancelled
 *       and each cancelled language becomes a {@code cancelled} failure marker</li>
 *   <li>Channels are flushed (remaining gaps become skip markers) and closed; subscribers receive a
 *       session-ended frame and are disconnected</li>
 *   <li>The durable logger gets {@code persistence.drain-timeout-ms} for this session's records;
 *       leftovers are discarded with a warning</li>
 * </ol>
 */
@Service
public class DefaultSessionOrchestrator implements SessionOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultSessionOrchestrator.class);

    private final ConcurrentMap<String, SessionRuntime> sessions = new ConcurrentHashMap<>();
    private final Map<String, Session> recentlyEnded;
    private final TranslationFanOut fanOut;
    private final BroadcastHub hub;
    private final DurableLogger durableLogger;
    private final ApplicationEventPublisher publisher;
    private final Duration endGracePeriod;
    private final Duration drainTimeout;
    private final int contextSize;

    public DefaultSessionOrchestrator(TranslationFanOut fanOut,
                                      BroadcastHub hub,
                                      DurableLogger durableLogger,
                                      ApplicationEventPublisher publisher,
                                      SessionProperties sessionProperties,
                                      PersistenceProperties persistenceProperties,
                                      TranslationProperties translationProperties) {
        this.fanOut = Objects.requireNonNull(fanOut, "fanOut");
        this.hub = Objects.requireNonNull(hub, "hub");
        this.durableLogger = Objects.requireNonNull(durableLogger, "durableLogger");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.endGracePeriod = Duration.ofMillis(sessionProperties.getEndGracePeriodMs());
        this.drainTimeout = Duration.ofMillis(persistenceProperties.getDrainTimeoutMs());
        this.contextSize = translationProperties.getContextSize();
        int retention = sessionProperties.getEndedRetention();
        this.recentlyEnded = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Session> eldest) {
                return size() > retention;
            }
        });
    }

    @Override
    public Session createSession(String sourceLanguage, List<String> targetLanguages, boolean loggingEnabled) {
        String source = requireSupported(sourceLanguage);
        List<String> targets = normalizeTargets(source, targetLanguages);
        Session session = Session.created(UUID.randomUUID().toString(), source, targets, loggingEnabled);
        sessions.put(session.id(), new SessionRuntime(session, contextSize));
        LOG.info("Created session {}: {} -> {} (logging={})", session.id(), source, targets, loggingEnabled);
        recordTransition(session, session.createdAt());
        return session;
    }

    @Override
    public Session startSession(String sessionId) {
        SessionRuntime runtime = requireLive(sessionId, SessionState.ACTIVE);
        Session started;
        runtime.lock().lock();
        try {
            Session current = runtime.session();
            if (current.state() != SessionState.CREATED) {
                throw new InvalidStateTransitionException(sessionId, current.state(), SessionState.ACTIVE);
            }
            openChannels(runtime);
            started = current.activated(Instant.now());
            runtime.update(started);
        } finally {
            runtime.lock().unlock();
        }
        LOG.info("Started session {} with {} channel(s)", sessionId, started.targetLanguages().size());
        recordTransition(started, started.startedAt());
        return started;
    }

    @Override
    public Session endSession(String sessionId) {
        SessionRuntime runtime = requireLive(sessionId, SessionState.ENDED);
        Session ended;
        runtime.lock().lock();
        try {
            Session current = runtime.session();
            if (current.state() != SessionState.ACTIVE) {
                throw new InvalidStateTransitionException(sessionId, current.state(), SessionState.ENDED);
            }
            ended = current.ended(Instant.now());
            runtime.update(ended);
        } finally {
            runtime.lock().unlock();
        }
        LOG.info("Ending session {}", sessionId);
        recordTransition(ended, ended.endedAt());
        tearDown(runtime);
        sessions.remove(sessionId);
        recentlyEnded.put(sessionId, ended);
        return ended;
    }

    @Override
    public Session stopSession(String sessionId) {
        return endSession(sessionId);
    }

    @Override
    public Session getSession(String sessionId) {
        SessionRuntime runtime = sessions.get(sessionId);
        if (runtime != null) {
            return runtime.session();
        }
        Session ended = recentlyEnded.get(sessionId);
        if (ended != null) {
            return ended;
        }
        throw new SessionNotFoundException(sessionId);
    }

    @Override
    public List<Session> activeSessions() {
        List<Session> active = new ArrayList<>();
        for (SessionRuntime runtime : sessions.values()) {
            Session s = runtime.session();
            if (s.isActive()) {
                active.add(s);
            }
        }
        return active;
    }

    @Override
    public boolean submitSegment(TranscriptSegment segment) {
        SessionRuntime runtime = sessions.get(segment.sessionId());
        if (runtime == null) {
            if (recentlyEnded.containsKey(segment.sessionId())) {
                return false;
            }
            throw new SessionNotFoundException(segment.sessionId());
        }
        Session session;
        List<String> context;
        runtime.lock().lock();
        try {
            session = runtime.session();
            if (!session.isActive()) {
                LOG.debug("Refusing seq={} for session {} in state {}",
                        segment.sequence(), session.id(), session.state());
                return false;
            }
            context = runtime.context().snapshotAndAppend(segment.text());
            runtime.update(session.withTranscript());
            runtime.beginAdmission();
        } finally {
            runtime.lock().unlock();
        }
        SegmentDispatch dispatch = null;
        try {
            dispatch = fanOut.dispatch(segment, session.sourceLanguage(), session.targetLanguages(), context, hub);
        } finally {
            runtime.endAdmission(dispatch);
        }
        LOG.debug("Dispatched seq={} \"{}\"", segment.sequence(), LogSanitizer.preview(segment.text()));
        return true;
    }

    /**
     * Ends every active session on shutdown.
     */
    @PreDestroy
    public void shutdown() {
        for (Session session : activeSessions()) {
            try {
                endSession(session.id());
            } catch (RuntimeException e) {
                LOG.warn("Failed to end session {} on shutdown: {}", session.id(), e.getMessage());
            }
        }
    }

    private void openChannels(SessionRuntime runtime) {
        Session session = runtime.session();
        ReleaseListener listener = session.loggingEnabled() ? durableLogger::logTranslation : ReleaseListener.NONE;
        List<ChannelKey> opened = new ArrayList<>();
        try {
            for (ChannelKey key : runtime.channelKeys()) {
                hub.openChannel(key, listener);
                opened.add(key);
            }
        } catch (RuntimeException e) {
            LOG.error("Failed to open channels for session {}; closing {} opened", session.id(), opened.size(), e);
            opened.forEach(hub::closeChannel);
            throw new SessionStartException(session.id(), e);
        }
    }

    private void tearDown(SessionRuntime runtime) {
        String sessionId = runtime.session().id();
        ThreadContext.put("sessionId", sessionId);
        try {
            awaitInFlight(runtime);
            for (ChannelKey key : runtime.channelKeys()) {
                hub.closeChannel(key);
            }
            if (!durableLogger.awaitDrained(sessionId, drainTimeout)) {
                LOG.warn("Persistence for session {} not drained within {} ms", sessionId, drainTimeout.toMillis());
                durableLogger.discard(sessionId);
            }
            LOG.info("Session {} torn down", sessionId);
        } finally {
            ThreadContext.remove("sessionId");
        }
    }

    /**
     * Gives in-flight dispatches the grace period, then cancels the rest. Each cancelled
     * (segment, language) pair emits a {@code cancelled} failure marker into its channel
     * before the channels are closed.
     */
    private void awaitInFlight(SessionRuntime runtime) {
        long deadline = System.nanoTime() + endGracePeriod.toNanos();
        try {
            if (!runtime.awaitAdmissions(endGracePeriod.toNanos())) {
                LOG.warn("Admitted segments still dispatching after {} ms", endGracePeriod.toMillis());
            }
            List<SegmentDispatch> pending = runtime.inFlight();
            if (pending.isEmpty()) {
                return;
            }
            CompletableFuture<?>[] completions = pending.stream()
                    .map(SegmentDispatch::completion)
                    .toArray(CompletableFuture[]::new);
            long remaining = Math.max(0L, deadline - System.nanoTime());
            CompletableFuture.allOf(completions).get(remaining, TimeUnit.NANOSECONDS);
            LOG.debug("All {} in-flight segment(s) finished within grace period", pending.size());
        } catch (TimeoutException e) {
            int cancelled = cancelInFlight(runtime);
            LOG.warn("Grace period of {} ms elapsed; cancelled {} in-flight translation(s)",
                    endGracePeriod.toMillis(), cancelled);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelInFlight(runtime);
        } catch (ExecutionException e) {
            LOG.debug("In-flight dispatch completed exceptionally: {}", e.getMessage());
        }
    }

    private static int cancelInFlight(SessionRuntime runtime) {
        int cancelled = 0;
        for (SegmentDispatch dispatch : runtime.inFlight()) {
            cancelled += dispatch.cancel();
        }
        return cancelled;
    }

    private void recordTransition(Session session, Instant at) {
        durableLogger.logSessionEvent(session.id(), session.state(), at);
        publisher.publishEvent(new SessionStateChangedEvent(session, at));
    }

    private SessionRuntime requireLive(String sessionId, SessionState requested) {
        SessionRuntime runtime = sessions.get(sessionId);
        if (runtime != null) {
            return runtime;
        }
        Session ended = recentlyEnded.get(sessionId);
        if (ended != null) {
            throw new InvalidStateTransitionException(sessionId, ended.state(), requested);
        }
        throw new SessionNotFoundException(sessionId);
    }

    private static String requireSupported(String code) {
        if (code == null || code.isBlank()) {
            throw new UnsupportedLanguageException(String.valueOf(code), "Language code must not be blank");
        }
        return Language.find(code)
                .map(Language::code)
                .orElseThrow(() -> new UnsupportedLanguageException(code));
    }

    private static List<String> normalizeTargets(String source, List<String> targetLanguages) {
        if (targetLanguages == null || targetLanguages.isEmpty()) {
            throw new UnsupportedLanguageException("", "At least one target language is required");
        }
        Set<String> targets = new LinkedHashSet<>();
        for (String code : targetLanguages) {
            String normalized = requireSupported(code);
            if (normalized.equals(source)) {
                throw new UnsupportedLanguageException(normalized,
                        "Target language must differ from source language: " + normalized);
            }
            targets.add(normalized);
        }
        return List.copyOf(targets);
    }
}
