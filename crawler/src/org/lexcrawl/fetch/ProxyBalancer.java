package org.lexcrawl.fetch;

import org.jetbrains.annotations.Nullable;
import org.lexcrawl.proxy.ProxyEndpoint;
import org.lexcrawl.proxy.WorkingSet;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Smooth weighted round-robin over the current working set, weighting each proxy by the inverse of its probed
 * response time. Over a full cycle every proxy is chosen in proportion to its weight, and choices of the same
 * proxy are spread out rather than bunched.
 */
public class ProxyBalancer {
    private final Supplier<WorkingSet> workingSet;
    private final Map<Long, Double> currentWeights = new HashMap<>();

    public ProxyBalancer(Supplier<WorkingSet> workingSet) {
        this.workingSet = workingSet;
    }

    /**
     * Picks the next proxy, skipping {@code avoid} (the proxy that just failed this entry) unless it is the only
     * one available.
     *
     * @return null if the working set is empty
     */
    public synchronized @Nullable ProxyEndpoint select(@Nullable Long avoid) {
        var members = new ArrayList<>(workingSet.get().members());
        if (avoid != null && members.size() > 1) {
            members.removeIf(member -> member.endpoint().id() == avoid);
        }
        if (members.isEmpty()) return null;

        var live = new HashSet<Long>();
        double total = 0;
        WorkingSet.Member best = null;
        double bestWeight = Double.NEGATIVE_INFINITY;
        for (var member : members) {
            long id = member.endpoint().id();
            live.add(id);
            double weight = weight(member);
            total += weight;
            double current = currentWeights.merge(id, weight, Double::sum);
            if (current > bestWeight) {
                best = member;
                bestWeight = current;
            }
        }
        Objects.requireNonNull(best);
        currentWeights.put(best.endpoint().id(), bestWeight - total);
        currentWeights.keySet().retainAll(live);
        return best.endpoint();
    }

    static double weight(WorkingSet.Member member) {
        return 1000.0 / Math.max(1, member.responseTimeMs());
    }
}
