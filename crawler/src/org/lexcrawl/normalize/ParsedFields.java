package org.lexcrawl.normalize;

import org.jetbrains.annotations.Nullable;
import org.lexcrawl.identity.DocCategory;

import java.util.Map;

/**
 * Fields an adapter extracted from a page. Everything but the title may be missing.
 *
 * @param court court code for case law, used in the folder layout
 * @param extra source-specific fields such as an act number, stored as JSON with the document
 */
public record ParsedFields(
        @Nullable String title,
        @Nullable Integer year,
        @Nullable DocCategory category,
        @Nullable String body,
        @Nullable String pdfUrl,
        @Nullable String court,
        @Nullable String titleShort,
        Map<String, String> extra) {

    public ParsedFields {
        extra = extra == null ? Map.of() : Map.copyOf(extra);
    }

    public ParsedFields withTitle(String title) {
        return new ParsedFields(title, year, category, body, pdfUrl, court, titleShort, extra);
    }

    public ParsedFields withYear(@Nullable Integer year) {
        return new ParsedFields(title, year, category, body, pdfUrl, court, titleShort, extra);
    }

    public ParsedFields withCategory(DocCategory category) {
        return new ParsedFields(title, year, category, body, pdfUrl, court, titleShort, extra);
    }
}
