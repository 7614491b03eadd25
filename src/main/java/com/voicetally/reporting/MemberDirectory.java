package com.voicetally.reporting;

import java.util.Optional;

@FunctionalInterface
public interface MemberDirectory {
    Optional<String> displayName(String userId);
}
