package org.lexcrawl.identity;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.UUID;

/**
 * A normalized legal document. {@code sourceUrl} is the dedup key: unique across the store.
 *
 * @param rawContentRef where the fetched bytes are archived, see {@link org.lexcrawl.RawStore}
 * @param parsedFields  adapter-specific extra fields as JSON
 * @param proxyId       proxy the document was fetched through, kept for audit
 */
public record Document(
        long id,
        String globalId,
        UUID uuid,
        String countryCode,
        DocCategory docCategory,
        @Nullable Integer docYear,
        long yearlySequence,
        String titleFull,
        @Nullable String titleShort,
        String subjectCode,
        String sourceUrl,
        String sourceId,
        @Nullable String rawContentRef,
        @Nullable String parsedFields,
        String filename,
        String folderPath,
        @Nullable String pdfUrl,
        boolean pdfDownloaded,
        @Nullable Long proxyId,
        Instant createdAt,
        Instant updatedAt) {

    public String relativePath() {
        return folderPath + "/" + filename;
    }
}
