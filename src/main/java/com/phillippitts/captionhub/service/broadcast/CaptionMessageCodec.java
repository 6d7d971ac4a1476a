package com.phillippitts.captionhub.service.broadcast;

import com.phillippitts.captionhub.domain.Translation;
import org.json.JSONObject;

import java.util.Locale;

/**
 * Encodes outbound frames as the JSON text sent to subscribers.
 *
 * <pre>
 * {"type":"caption","sessionId":"s1","language":"fr","sequence":7,"text":"Bonjour","timestamp":"..."}
 * {"type":"caption","sessionId":"s1","language":"fr","sequence":8,"skipped":true,"reason":"timeout"}
 * {"type":"caption","sessionId":"s1","language":"fr","sequence":600,"skipped":true,"reason":"overflow","skippedFrom":9}
 * {"type":"replay-start","sessionId":"s1","language":"fr","count":3}
 * {"type":"session-ended","sessionId":"s1","language":"fr"}
 * </pre>
 *
 * <p>{@code skippedFrom} appears only on a marker that stands for several slots; the marker
 * then covers every sequence from {@code skippedFrom} through {@code sequence}.
 */
public final class CaptionMessageCodec {

    private CaptionMessageCodec() {
    }

    public static String encode(OutboundMessage message) {
        return toJson(message).toString();
    }

    static JSONObject toJson(OutboundMessage message) {
        JSONObject json = new JSONObject();
        json.put("type", message.type().wireName());
        json.put("sessionId", message.channel().sessionId());
        json.put("language", message.channel().language());
        switch (message.type()) {
            case CAPTION -> putCaption(json, message);
            case REPLAY_START -> json.put("count", message.count());
            default -> {
                // control frame without payload
            }
        }
        return json;
    }

    private static void putCaption(JSONObject json, OutboundMessage message) {
        Translation t = message.translation();
        json.put("sequence", t.sequence());
        json.put("timestamp", t.completedAt().toString());
        if (t.isMarker()) {
            json.put("skipped", true);
            json.put("reason", t.failureReason() == null ? t.outcome().name().toLowerCase(Locale.ROOT) : t.failureReason());
            if (t.slotsCovered() > 1) {
                json.put("skippedFrom", t.skippedFrom());
            }
        } else {
            json.put("text", t.text());
        }
        if (message.replay()) {
            json.put("replay", true);
        }
    }
}
