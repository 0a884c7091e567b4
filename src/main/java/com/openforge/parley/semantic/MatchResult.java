package com.openforge.parley.semantic;

import java.util.List;
import java.util.Optional;

/**
 * Ranked matches plus the degraded flag.
 *
 * {@code degraded == true} means the embedding provider was unavailable and
 * every score was forced to 0; callers must treat the ranking as meaningless.
 */
public record MatchResult(List<Match> matches, boolean degraded) {

    public MatchResult {
        matches = List.copyOf(matches);
    }

    public static MatchResult empty(boolean degraded) {
        return new MatchResult(List.of(), degraded);
    }

    public Optional<Match> best() {
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }
}
