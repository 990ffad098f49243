package org.lexcrawl.fetch;

/**
 * @param confidence how specific the matching rule is, from 0 to 1
 * @param reason     human-readable name of the rule that matched
 */
public record Classification(Strategy strategy, double confidence, String reason) {
    @Override
    public String toString() {
        return strategy.name().toLowerCase() + " " + String.format(java.util.Locale.ROOT, "%.2f", confidence) + " " + reason;
    }
}
