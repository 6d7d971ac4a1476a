package com.phillippitts.captionhub.service.broadcast;

import com.phillippitts.captionhub.domain.ChannelKey;
import com.phillippitts.captionhub.domain.Translation;

import java.util.Objects;

/**
 * One frame queued for a subscriber.
 *
 * @param type        frame type
 * @param channel     channel the frame belongs to
 * @param translation caption payload; {@code null} for control frames
 * @param replay      {@code true} for captions re-sent from the backlog
 * @param count       number of replayed captions; only meaningful for {@link Type#REPLAY_START}
 */
public record OutboundMessage(Type type, ChannelKey channel, Translation translation, boolean replay, int count) {

    public enum Type {
        CAPTION("caption"),
        REPLAY_START("replay-start"),
        REPLAY_END("replay-end"),
        SESSION_ENDED("session-ended");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    public OutboundMessage {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(channel, "channel must not be null");
        if (type == Type.CAPTION) {
            Objects.requireNonNull(translation, "translation must not be null for a caption");
        }
    }

    public static OutboundMessage caption(Translation translation, boolean replay) {
        return new OutboundMessage(Type.CAPTION, translation.channel(), translation, replay, 0);
    }

    public static OutboundMessage replayStart(ChannelKey channel, int count) {
        return new OutboundMessage(Type.REPLAY_START, channel, null, false, count);
    }

    public static OutboundMessage replayEnd(ChannelKey channel) {
        return new OutboundMessage(Type.REPLAY_END, channel, null, false, 0);
    }

    public static OutboundMessage sessionEnded(ChannelKey channel) {
        return new OutboundMessage(Type.SESSION_ENDED, channel, null, false, 0);
    }

    public boolean isCaption() {
        return type == Type.CAPTION;
    }

    /**
     * @return caption sequence, or 0 for control frames
     */
    public long sequence() {
        return translation == null ? 0 : translation.sequence();
    }
}
