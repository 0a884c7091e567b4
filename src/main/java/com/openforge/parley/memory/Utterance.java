package com.openforge.parley.memory;

import java.time.Instant;

public record Utterance(String text, Instant timestamp, String sessionId) {

    public static Utterance of(String text, String sessionId) {
        return new Utterance(text, Instant.now(), sessionId);
    }
}
