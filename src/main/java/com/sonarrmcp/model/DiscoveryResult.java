package com.sonarrmcp.model;

import java.util.List;

/**
 * The ranked, bounded answer to a {@link DiscoveryQuery}. An empty result means "no matches" and is not an error.
 *
 * @param matches      The matches, best first.
 * @param totalMatches How many tools matched before the result limit was applied.
 */
public record DiscoveryResult(List<DiscoveryMatch> matches, int totalMatches) {

    public DiscoveryResult {
        matches = List.copyOf(matches);
    }

    public boolean isEmpty() {
        return matches.isEmpty();
    }

    /**
     * @return {@code true} if more tools matched than were returned.
     */
    public boolean isTruncated() {
        return totalMatches > matches.size();
    }
}
