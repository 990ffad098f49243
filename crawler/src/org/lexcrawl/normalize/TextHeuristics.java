package org.lexcrawl.normalize;

import org.jetbrains.annotations.Nullable;
import org.lexcrawl.identity.DocCategory;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extraction helpers shared by adapters.
 */
public final class TextHeuristics {
    static final Pattern YEAR = Pattern.compile("\\b(1[7-9]\\d{2}|20\\d{2})\\b");
    private static final int YEAR_SCAN_LIMIT = 2000;

    private TextHeuristics() {
    }

    public static @Nullable Integer findYear(@Nullable String text) {
        if (text == null) return null;
        String head = text.length() > YEAR_SCAN_LIMIT ? text.substring(0, YEAR_SCAN_LIMIT) : text;
        Matcher matcher = YEAR.matcher(head);
        return matcher.find() ? Integer.parseInt(matcher.group(1)) : null;
    }

    /**
     * Year from the title, else from the start of the body.
     */
    public static @Nullable Integer findYear(@Nullable String title, @Nullable String body) {
        Integer year = findYear(title);
        return year != null ? year : findYear(body);
    }

    /**
     * Guesses the instrument type from words in the title. The order matters: "Rules" and "Order" are checked
     * before "Act", because subordinate instruments are usually titled after their parent act.
     */
    public static @Nullable DocCategory categoryFromTitle(@Nullable String title) {
        if (title == null) return null;
        String t = title.toLowerCase(Locale.ROOT);
        if (t.contains("constitution")) return DocCategory.CONSTITUTION;
        if (t.contains("ordinance") || title.contains("অধ্যাদেশ")) return DocCategory.ORDINANCE;
        if (t.matches(".*\\brules?\\b.*") || title.contains("বিধি")) return DocCategory.RULE;
        if (t.contains("regulation")) return DocCategory.REGULATION;
        if (t.matches(".*\\border\\b.*")) return DocCategory.ORDER;
        if (t.contains("notification")) return DocCategory.NOTIFICATION;
        if (t.contains("circular")) return DocCategory.CIRCULAR;
        if (t.contains("gazette")) return DocCategory.GAZETTE;
        if (t.contains("treaty") || t.contains("convention")) return DocCategory.TREATY;
        if (t.matches(".*\\b(v\\.?|vs\\.?|versus)\\b.*") || t.contains("judgment")) return DocCategory.CASE;
        if (t.matches(".*\\b(act|code)\\b.*") || title.contains("আইন")) return DocCategory.ACT;
        return null;
    }

    public static String collapseWhitespace(String text) {
        return text.replaceAll("\\s+", " ").trim();
    }
}
