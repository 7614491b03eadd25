package com.voicetally.channels;

import com.voicetally.shared.model.PresenceEvent;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

public final class VoiceTransitions {

    private VoiceTransitions() {}

    /**
     * Maps a voice-state change to a join or leave of the tracked channel. Moves
     * between other channels, or updates that stay in place, map to nothing.
     *
     * @param leftChannelId   channel the user was in before, null if none
     * @param joinedChannelId channel the user is in after, null if none
     */
    public static Optional<PresenceEvent> translate(long trackedChannelId, String userId,
                                                    Long leftChannelId, Long joinedChannelId, Instant at) {
        boolean wasIn = Objects.equals(leftChannelId, trackedChannelId);
        boolean isIn = Objects.equals(joinedChannelId, trackedChannelId);
        if (wasIn == isIn) return Optional.empty();
        return Optional.of(new PresenceEvent(userId, isIn, at));
    }
}
