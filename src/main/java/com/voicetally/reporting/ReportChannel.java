package com.voicetally.reporting;

@FunctionalInterface
public interface ReportChannel {
    /** Sends without mentioning anyone; blocks until delivered or throws. */
    void send(String content);
}
