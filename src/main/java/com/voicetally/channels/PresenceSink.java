package com.voicetally.channels;

import com.voicetally.shared.model.PresenceEvent;

import java.time.Instant;
import java.util.Collection;

public interface PresenceSink {
    void accept(PresenceEvent event);

    /** Authoritative list of users present at {@code at}, delivered once the source is ready. */
    void snapshot(Collection<String> presentUserIds, Instant at);
}
