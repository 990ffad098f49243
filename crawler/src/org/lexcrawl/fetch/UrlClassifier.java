package org.lexcrawl.fetch;

import org.lexcrawl.config.ClassifierConfig;
import org.lexcrawl.util.Url;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static org.lexcrawl.fetch.Strategy.DIRECT;
import static org.lexcrawl.fetch.Strategy.RENDERED;

/**
 * Routes URLs to the cheap direct fetch or the browser render using static pattern rules. Rules are tried in
 * descending order of confidence and the first match wins. No network access.
 */
public class UrlClassifier {
    public static final List<ClassifierRule> DEFAULT_RULES = List.of(
            new ClassifierRule.Extension(List.of("pdf"), DIRECT, 1.0, "Direct PDF file link"),
            new ClassifierRule.PathSegment(List.of("download", "pdf"), DIRECT, 0.95, "Download/PDF directory"),
            new ClassifierRule.PathSegment(List.of("search", "browse", "advanced_search", "filter", "category"),
                    RENDERED, 0.95, "Search or browse page"),
            new ClassifierRule.PathPattern("/(doc|judgment|case)/\\d+", DIRECT, 0.90,
                    "Document ID pattern (static HTML)"),
            new ClassifierRule.QueryParam(List.of("formInput", "q"), null, RENDERED, 0.85, "Form/query parameters"),
            new ClassifierRule.QueryParam(List.of("pdf", "download"), "1", DIRECT, 0.80,
                    "Direct download query parameter"),
            new ClassifierRule.Extension(List.of("html", "htm"), DIRECT, 0.70, "Static HTML page"));

    public static final Classification DEFAULT = new Classification(RENDERED, 0.50,
            "Unknown pattern - defaulting to rendered");

    private final List<ClassifierRule> rules;

    public UrlClassifier() {
        this(DEFAULT_RULES);
    }

    public UrlClassifier(ClassifierConfig config) {
        this(merge(config.rules()));
    }

    public UrlClassifier(List<ClassifierRule> rules) {
        var sorted = new ArrayList<>(rules);
        // stable sort, so rules of equal confidence keep their configured order
        sorted.sort(Comparator.comparingDouble(ClassifierRule::confidence).reversed());
        this.rules = List.copyOf(sorted);
    }

    private static List<ClassifierRule> merge(List<ClassifierRule> extra) {
        var merged = new ArrayList<ClassifierRule>();
        if (extra != null) merged.addAll(extra);
        merged.addAll(DEFAULT_RULES);
        return merged;
    }

    public Classification classify(Url url) {
        try {
            for (var rule : rules) {
                if (rule.matches(url)) return rule.classification();
            }
        } catch (IllegalArgumentException e) {
            return new Classification(RENDERED, 0.0, "Unparseable URL");
        }
        return DEFAULT;
    }

    public List<ClassifierRule> rules() {
        return rules;
    }
}
