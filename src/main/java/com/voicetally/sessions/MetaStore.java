package com.voicetally.sessions;

import java.util.Optional;

/**
 * Small key/value table for scheduler and command markers.
 */
public interface MetaStore {
    Optional<String> get(String key);
    void set(String key, String value);
}
