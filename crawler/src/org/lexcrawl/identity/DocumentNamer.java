package org.lexcrawl.identity;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical file names and folder paths. Both are derived from the global id so they stay stable once assigned.
 */
public class DocumentNamer {
    static final int SHORT_TITLE_MAX = 50;
    static final int SLUG_MAX = 40;
    private static final Pattern YEAR = Pattern.compile("\\b(1[7-9]\\d{2}|20\\d{2})\\b");
    private static final Pattern INSTRUMENT_WORD = Pattern.compile("\\s+(Act|Ordinance)\\b", Pattern.CASE_INSENSITIVE);

    /**
     * Shortens a full title: drops a leading "The", the instrument word, and any year.
     * {@code "The Penal Code, 1860"} becomes {@code "Penal Code"}.
     */
    public String shortTitle(String title) {
        String s = title.trim();
        if (s.regionMatches(true, 0, "The ", 0, 4)) s = s.substring(4);
        s = YEAR.matcher(s).replaceAll("");
        s = INSTRUMENT_WORD.matcher(s).replaceAll("");
        s = s.replaceAll("[\\s,.\\-]+$", "").replaceAll("\\s+", " ").trim();
        if (s.isEmpty()) s = title.trim();
        return StringUtils.abbreviate(s, SHORT_TITLE_MAX);
    }

    /**
     * Filename-safe form of a short title: punctuation removed, whitespace and dashes collapsed into underscores.
     */
    public String slug(@Nullable String shortTitle) {
        if (shortTitle == null) return "Untitled";
        String slug = shortTitle.replaceAll("[^\\p{L}\\p{N}_\\s-]", "")
                .replaceAll("[-\\s]+", "_");
        slug = StringUtils.strip(StringUtils.left(slug, SLUG_MAX), "_");
        return slug.isEmpty() ? "Untitled" : slug;
    }

    /**
     * {@code BD_ACT_1860_0045_Penal_Code_CRM}
     */
    public String filename(GlobalId id, String shortTitle, SubjectCode subject) {
        return String.join("_", id.countryCode(), id.category().code(), id.yearString(), id.sequenceString(),
                slug(shortTitle), subject.name());
    }

    /**
     * {@code BD/ACT/1851-1900}, or {@code IN/CASE/SC/2001-2050} for a case with a known court. Years are grouped
     * into half centuries; unknown years go to {@code UNDATED}.
     */
    public String folder(GlobalId id, @Nullable String court) {
        var parts = new ArrayList<String>();
        parts.add(id.countryCode());
        parts.add(id.category().name());
        if (id.category() == DocCategory.CASE && court != null && !court.isBlank()) {
            parts.add(slug(court.toUpperCase(Locale.ROOT)));
        }
        parts.add(period(id.year()));
        return String.join("/", parts);
    }

    static String period(int year) {
        if (year <= 0) return "UNDATED";
        int start = ((year - 1) / 50) * 50 + 1;
        return start + "-" + (start + 49);
    }
}
