package com.phillippitts.captionhub.integration;

import org.json.JSONObject;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Drives a whole session over HTTP and a real websocket: create, start, subscribe, ingest,
 * end. Uses the echo translator and the in-memory H2 database.
 */
@Tag("integration")
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class CaptionPipelineIntegrationTest {

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate rest;

    @Autowired
    private JdbcTemplate jdbc;

    @Test
    void captionsFlowFromIngestToSubscriberAndStorage() throws Exception {
        String sessionId = createSession("{\"sourceLanguage\":\"en\",\"targetLanguages\":[\"fr\",\"de\"]}");
        assertThat(post("/api/sessions/" + sessionId + "/start", null).getStatusCode()).isEqualTo(HttpStatus.OK);

        RecordingHandler frames = new RecordingHandler();
        WebSocketSession socket = connect(frames, "sessionId=" + sessionId + "&language=fr");
        await().atMost(Duration.ofSeconds(5)).until(() -> frames.types().contains("replay-end"));

        assertThat(segment(sessionId, 1, "hello", true).getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(segment(sessionId, 2, "hel", false).getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(segment(sessionId, 2, "world", true).getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(segment(sessionId, 2, "again", true).getStatusCode()).isEqualTo(HttpStatus.CONFLICT);

        await().atMost(Duration.ofSeconds(5)).until(() -> frames.captions().size() == 2);
        assertThat(frames.captions()).extracting(json -> json.getLong("sequence")).containsExactly(1L, 2L);
        assertThat(frames.captions()).extracting(json -> json.getString("text"))
                .containsExactly("[fr] hello", "[fr] world");

        ResponseEntity<String> ended = post("/api/sessions/" + sessionId + "/end", null);
        assertThat(ended.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(new JSONObject(ended.getBody()).getString("state")).isEqualTo("ENDED");

        await().atMost(Duration.ofSeconds(5)).until(() -> frames.closeStatus.get() != null);
        assertThat(frames.types()).endsWith("session-ended");
        assertThat(socket.isOpen()).isFalse();

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(jdbc.queryForObject(
                "SELECT COUNT(*) FROM caption_translations WHERE session_id = ?", Integer.class, sessionId))
                .isEqualTo(4));
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(jdbc.queryForList(
                "SELECT state FROM session_events WHERE session_id = ?", String.class, sessionId))
                .containsExactlyInAnyOrder("CREATED", "ACTIVE", "ENDED"));

        assertThat(segment(sessionId, 3, "late", true).getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(post("/api/sessions/" + sessionId + "/end", null).getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    void lateJoinerGetsBacklogReplay() throws Exception {
        String sessionId = createSession("{\"sourceLanguage\":\"en\",\"targetLanguages\":[\"es\"]}");
        post("/api/sessions/" + sessionId + "/start", null);
        for (int seq = 1; seq <= 3; seq++) {
            segment(sessionId, seq, "line " + seq, true);
        }
        // stored rows are written after release, so the backlog is complete once they appear
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(jdbc.queryForObject(
                "SELECT COUNT(*) FROM caption_translations WHERE session_id = ?", Integer.class, sessionId))
                .isEqualTo(3));

        RecordingHandler frames = new RecordingHandler();
        WebSocketSession socket = connect(frames, "sessionId=" + sessionId + "&language=es&lastSequence=1");

        await().atMost(Duration.ofSeconds(5)).until(() -> frames.types().contains("replay-end"));
        assertThat(frames.captions()).extracting(json -> json.getLong("sequence")).containsExactly(2L, 3L);
        assertThat(frames.captions()).allMatch(json -> json.optBoolean("replay"));

        socket.close();
        post("/api/sessions/" + sessionId + "/end", null);
    }

    @Test
    void subscribingToUnknownChannelIsRefused() throws Exception {
        RecordingHandler frames = new RecordingHandler();
        connect(frames, "sessionId=missing&language=fr");

        await().atMost(Duration.ofSeconds(5)).until(() -> frames.closeStatus.get() != null);
        assertThat(frames.closeStatus.get().getCode()).isEqualTo(CloseStatus.POLICY_VIOLATION.getCode());
    }

    @Test
    void unknownSessionIsNotFound() {
        ResponseEntity<String> response = rest.getForEntity("/api/sessions/does-not-exist", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(new JSONObject(response.getBody()).getString("errorCode")).isEqualTo("SessionNotFoundException");
    }

    private String createSession(String body) {
        ResponseEntity<String> response = post("/api/sessions", body);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        return new JSONObject(response.getBody()).getString("id");
    }

    private ResponseEntity<String> segment(String sessionId, long sequence, String text, boolean isFinal) {
        JSONObject body = new JSONObject()
                .put("sequence", sequence)
                .put("text", text)
                .put("isFinal", isFinal);
        return post("/api/sessions/" + sessionId + "/segments", body.toString());
    }

    private ResponseEntity<String> post(String path, String json) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return rest.postForEntity(path, new HttpEntity<>(json, headers), String.class);
    }

    private WebSocketSession connect(RecordingHandler handler, String query) throws Exception {
        String uri = "ws://localhost:" + port + "/ws/captions?" + query;
        return new StandardWebSocketClient().execute(handler, uri).get(5, TimeUnit.SECONDS);
    }

    private static final class RecordingHandler extends TextWebSocketHandler {

        private final List<JSONObject> frames = new CopyOnWriteArrayList<>();
        private final AtomicReference<CloseStatus> closeStatus = new AtomicReference<>();

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            frames.add(new JSONObject(message.getPayload()));
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            closeStatus.set(status);
        }

        List<String> types() {
            return frames.stream().map(json -> json.getString("type")).toList();
        }

        List<JSONObject> captions() {
            return frames.stream().filter(json -> "caption".equals(json.getString("type"))).toList();
        }
    }
}
