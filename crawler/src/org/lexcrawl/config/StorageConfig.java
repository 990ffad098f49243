package org.lexcrawl.config;

import org.jetbrains.annotations.Nullable;

/**
 * @param prefix filename prefix of the raw content WARC files
 * @param pdfDir root directory for downloaded PDFs, relative to the job directory
 */
public record StorageConfig(
        @Nullable String prefix,
        @Nullable String pdfDir) {
}
