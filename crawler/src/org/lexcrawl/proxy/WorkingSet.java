package org.lexcrawl.proxy;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Immutable snapshot of the healthy proxies, best first: perfect before working, then by response time.
 */
public record WorkingSet(List<Member> members, Instant takenAt) {
    // must be initialized before EMPTY, which goes through the sorting constructor
    private static final Comparator<Member> RANKING = Comparator
            .comparing((Member m) -> m.status() == ProbeStatus.PERFECT ? 0 : 1)
            .thenComparingLong(Member::responseTimeMs)
            .thenComparingLong(m -> m.endpoint().id());

    public static final WorkingSet EMPTY = new WorkingSet(List.of(), Instant.EPOCH);

    public WorkingSet {
        members = members.stream().sorted(RANKING).toList();
    }

    public record Member(ProxyEndpoint endpoint, ProbeStatus status, long responseTimeMs) {
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public int size() {
        return members.size();
    }
}
