package org.lexcrawl.normalize;

public sealed interface NormalizeOutcome permits NormalizeOutcome.Parsed, NormalizeOutcome.Rejected {

    record Parsed(ParsedFields fields) implements NormalizeOutcome {
    }

    /**
     * Extraction produced nothing usable. Recoverable: the page is kept and can be re-normalized once the
     * adapter is fixed.
     */
    record Rejected(String reason) implements NormalizeOutcome {
    }
}
