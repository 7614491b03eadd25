package com.voicetally.tracking;

public class InvalidIntervalException extends IllegalArgumentException {

    public InvalidIntervalException(String message) {
        super(message);
    }
}
