package com.phillippitts.captionhub.service.broadcast;

import com.phillippitts.captionhub.domain.ChannelKey;
import com.phillippitts.captionhub.domain.Translation;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class CaptionMessageCodecTest {

    private static final ChannelKey KEY = new ChannelKey("s1", "fr");

    @Test
    void encodesTranslatedCaption() {
        Translation t = new Translation("s1", 7, "fr", Translation.Outcome.TRANSLATED, "Bonjour", null,
                Instant.parse("2024-05-01T10:00:00Z"));

        JSONObject json = new JSONObject(CaptionMessageCodec.encode(OutboundMessage.caption(t, false)));

        assertThat(json.getString("type")).isEqualTo("caption");
        assertThat(json.getString("sessionId")).isEqualTo("s1");
        assertThat(json.getString("language")).isEqualTo("fr");
        assertThat(json.getLong("sequence")).isEqualTo(7);
        assertThat(json.getString("text")).isEqualTo("Bonjour");
        assertThat(json.getString("timestamp")).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(json.has("skipped")).isFalse();
        assertThat(json.has("replay")).isFalse();
    }

    @Test
    void encodesSkipMarkerWithoutText() {
        Translation marker = Translation.skipped(KEY, 8, "timeout");

        JSONObject json = new JSONObject(CaptionMessageCodec.encode(OutboundMessage.caption(marker, true)));

        assertThat(json.getBoolean("skipped")).isTrue();
        assertThat(json.getString("reason")).isEqualTo("timeout");
        assertThat(json.has("text")).isFalse();
        assertThat(json.getBoolean("replay")).isTrue();
        assertThat(json.has("skippedFrom")).isFalse();
    }

    @Test
    void collapsedMarkerCarriesFirstSkippedSlot() {
        Translation marker = Translation.skippedRange(KEY, 9, 600, "overflow");

        JSONObject json = new JSONObject(CaptionMessageCodec.encode(OutboundMessage.caption(marker, false)));

        assertThat(json.getLong("sequence")).isEqualTo(600);
        assertThat(json.getLong("skippedFrom")).isEqualTo(9);
        assertThat(json.getString("reason")).isEqualTo("overflow");
    }

    @Test
    void failureMarkerIsRenderedAsSkipped() {
        Translation failed = Translation.failed("s1", 9, "fr", "rate_limited");

        JSONObject json = new JSONObject(CaptionMessageCodec.encode(OutboundMessage.caption(failed, false)));

        assertThat(json.getBoolean("skipped")).isTrue();
        assertThat(json.getString("reason")).isEqualTo("rate_limited");
    }

    @Test
    void encodesControlFrames() {
        JSONObject start = new JSONObject(CaptionMessageCodec.encode(OutboundMessage.replayStart(KEY, 3)));
        JSONObject end = new JSONObject(CaptionMessageCodec.encode(OutboundMessage.replayEnd(KEY)));
        JSONObject ended = new JSONObject(CaptionMessageCodec.encode(OutboundMessage.sessionEnded(KEY)));

        assertThat(start.getString("type")).isEqualTo("replay-start");
        assertThat(start.getInt("count")).isEqualTo(3);
        assertThat(end.getString("type")).isEqualTo("replay-end");
        assertThat(end.has("sequence")).isFalse();
        assertThat(ended.getString("type")).isEqualTo("session-ended");
        assertThat(ended.getString("language")).isEqualTo("fr");
    }
}
