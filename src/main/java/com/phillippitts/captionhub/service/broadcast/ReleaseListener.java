package com.phillippitts.captionhub.service.broadcast;

import com.phillippitts.captionhub.domain.Translation;

/**
 * Observes every translation a channel releases, in release order.
 *
 * <p>Called under the channel lock, so implementations must not block.
 */
@FunctionalInterface
public interface ReleaseListener {

    ReleaseListener NONE = translation -> { };

    void onReleased(Translation translation);
}
