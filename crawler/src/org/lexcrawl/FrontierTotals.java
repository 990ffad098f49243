package org.lexcrawl;

import java.util.List;

/**
 * Frontier entry counts by state. Parked entries are pending but waiting for an adapter fix and are counted
 * separately.
 */
public record FrontierTotals(long pending, long leased, long done, long failed, long parked) {

    static FrontierTotals of(List<FrontierDAO.StateCount> counts) {
        long pending = 0, leased = 0, done = 0, failed = 0, parked = 0;
        for (var count : counts) {
            switch (count.state()) {
                case PENDING -> {
                    if (count.errorKind() == ErrorKind.PARSE) parked += count.count();
                    else pending += count.count();
                }
                case LEASED -> leased += count.count();
                case DONE -> done += count.count();
                case FAILED -> failed += count.count();
            }
        }
        return new FrontierTotals(pending, leased, done, failed, parked);
    }

    public long total() {
        return pending + leased + done + failed + parked;
    }
}
