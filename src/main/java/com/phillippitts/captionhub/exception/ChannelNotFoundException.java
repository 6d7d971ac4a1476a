package com.phillippitts.captionhub.exception;

import com.phillippitts.captionhub.domain.ChannelKey;

/**
 * Thrown when a subscriber asks for a (session, language) channel that is not open.
 */
public class ChannelNotFoundException extends CaptionHubException {

    private final ChannelKey channel;

    public ChannelNotFoundException(ChannelKey channel) {
        super("No open caption channel: " + channel);
        this.channel = channel;
    }

    public ChannelKey getChannel() {
        return channel;
    }
}
