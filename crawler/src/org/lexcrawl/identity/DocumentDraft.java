package org.lexcrawl.identity;

import org.jetbrains.annotations.Nullable;

/**
 * Everything known about a document before it has an identity.
 *
 * @param body    extracted text, used to pick a subject and not stored
 * @param court   court code for case law, used in the folder path
 */
public record DocumentDraft(
        String sourceUrl,
        String sourceId,
        String countryCode,
        DocCategory category,
        @Nullable Integer year,
        String titleFull,
        @Nullable String titleShort,
        @Nullable SubjectCode subject,
        @Nullable String court,
        @Nullable String body,
        @Nullable String parsedFields,
        @Nullable String rawContentRef,
        @Nullable String pdfUrl,
        @Nullable Long proxyId) {

    public static DocumentDraft minimal(String sourceUrl, String countryCode, DocCategory category,
                                        @Nullable Integer year, String title) {
        return new DocumentDraft(sourceUrl, "manual", countryCode, category, year, title, null, null, null,
                null, null, null, null, null);
    }
}
