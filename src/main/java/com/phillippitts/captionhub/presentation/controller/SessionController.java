package com.phillippitts.captionhub.presentation.controller;

import com.phillippitts.captionhub.domain.SegmentEvent;
import com.phillippitts.captionhub.domain.Session;
import com.phillippitts.captionhub.presentation.controller.dto.CreateSessionRequest;
import com.phillippitts.captionhub.presentation.controller.dto.IngestResponse;
import com.phillippitts.captionhub.presentation.controller.dto.SegmentRequest;
import com.phillippitts.captionhub.presentation.controller.dto.SessionView;
import com.phillippitts.captionhub.service.broadcast.BroadcastHub;
import com.phillippitts.captionhub.service.ingest.IngestResult;
import com.phillippitts.captionhub.service.ingest.SegmentSourceAdapter;
import com.phillippitts.captionhub.service.session.SessionOrchestrator;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Session control surface and segment ingress.
 */
@RestController
@RequestMapping("/api/sessions")
class SessionController {

    private static final Logger LOG = LogManager.getLogger(SessionController.class);

    private final SessionOrchestrator orchestrator;
    private final SegmentSourceAdapter ingest;
    private final BroadcastHub hub;

    SessionController(SessionOrchestrator orchestrator, SegmentSourceAdapter ingest, BroadcastHub hub) {
        this.orchestrator = orchestrator;
        this.ingest = ingest;
        this.hub = hub;
    }

    @PostMapping
    ResponseEntity<SessionView> create(@Valid @RequestBody CreateSessionRequest request) {
        Session session = orchestrator.createSession(request.sourceLanguage(), request.targetLanguages(),
                request.loggingEnabledOrDefault());
        return ResponseEntity.status(HttpStatus.CREATED).body(view(session));
    }

    @PostMapping("/{id}/start")
    SessionView start(@PathVariable("id") String id) {
        return view(orchestrator.startSession(id));
    }

    @PostMapping("/{id}/end")
    SessionView end(@PathVariable("id") String id) {
        return view(orchestrator.endSession(id));
    }

    @PostMapping("/{id}/stop")
    SessionView stop(@PathVariable("id") String id) {
        return view(orchestrator.stopSession(id));
    }

    @GetMapping("/{id}")
    SessionView get(@PathVariable("id") String id) {
        return view(orchestrator.getSession(id));
    }

    @GetMapping
    List<SessionView> active() {
        return orchestrator.activeSessions().stream().map(this::view).toList();
    }

    @PostMapping("/{id}/segments")
    ResponseEntity<IngestResponse> submitSegment(@PathVariable("id") String id,
                                                 @RequestBody SegmentRequest request) {
        long sequence = request.sequence() == null ? 0 : request.sequence();
        SegmentEvent event = new SegmentEvent(id, sequence, request.text(),
                Boolean.TRUE.equals(request.isFinal()), request.timestamp());
        IngestResult result = ingest.accept(event);
        LOG.debug("Segment seq={} -> {}", sequence, result);
        return ResponseEntity.status(statusOf(result)).body(new IngestResponse(id, sequence, result.name()));
    }

    static HttpStatus statusOf(IngestResult result) {
        return switch (result) {
            case ACCEPTED, DROPPED_PARTIAL -> HttpStatus.ACCEPTED;
            case REJECTED_INVALID -> HttpStatus.BAD_REQUEST;
            case REJECTED_OUT_OF_ORDER, REJECTED_SESSION_INACTIVE -> HttpStatus.CONFLICT;
            case REJECTED_UNKNOWN_SESSION -> HttpStatus.NOT_FOUND;
        };
    }

    private SessionView view(Session session) {
        return SessionView.of(session, hub.subscriberCounts(session.id(), session.targetLanguages()));
    }
}
