package org.lexcrawl.identity;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Human-decodable document identifier such as {@code BD-ACT-1860-0045}: country, category code, year ({@code 0000}
 * when unknown) and the sequence allocated within that country/category/year.
 */
public record GlobalId(String countryCode, DocCategory category, int year, long sequence) {
    private static final Pattern PATTERN = Pattern.compile("([A-Z]{2,3})-([A-Z]{3})-(\\d{4})-(\\d{4,})");

    public static GlobalId parse(String value) {
        Matcher matcher = PATTERN.matcher(value);
        if (!matcher.matches()) throw new IllegalArgumentException("Not a global id: " + value);
        return new GlobalId(matcher.group(1), DocCategory.parse(matcher.group(2)),
                Integer.parseInt(matcher.group(3)), Long.parseLong(matcher.group(4)));
    }

    public String yearString() {
        return String.format(Locale.ROOT, "%04d", year);
    }

    public String sequenceString() {
        return String.format(Locale.ROOT, "%04d", sequence);
    }

    @Override
    public String toString() {
        return countryCode + "-" + category.code() + "-" + yearString() + "-" + sequenceString();
    }
}
