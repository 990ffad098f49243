package org.lexcrawl.config;

import org.lexcrawl.fetch.ClassifierRule;

import java.util.List;

/**
 * @param rules rules tried in addition to the built-in ones
 */
public record ClassifierConfig(List<ClassifierRule> rules) {
    public ClassifierConfig {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }
}
