package org.lexcrawl.fetch;

import org.jetbrains.annotations.Nullable;
import org.lexcrawl.ErrorKind;

import java.util.List;
import java.util.Locale;

/**
 * Maps HTTP responses to error kinds.
 */
final class ResponseRules {
    private static final int SIGNATURE_SCAN_LIMIT = 64 * 1024;

    private ResponseRules() {
    }

    /**
     * @return the failure, or null if the response is usable
     */
    static FetchOutcome.@Nullable Failed check(int status, String body, List<String> blockSignatures) {
        String signature = findSignature(body, blockSignatures);
        if (signature != null) {
            return FetchOutcome.Failed.permanent("Blocked (HTTP " + status + "): matched '" + signature + "'");
        }
        if (status >= 200 && status < 300) return null;
        if (status == 429 || status == 403 || status == 408 || status >= 500) {
            // 403 without a block page is usually a per-IP refusal, so another proxy may get through
            return new FetchOutcome.Failed(ErrorKind.TRANSIENT, "HTTP " + status);
        }
        return new FetchOutcome.Failed(ErrorKind.PERMANENT, "HTTP " + status);
    }

    static @Nullable String findSignature(String body, List<String> blockSignatures) {
        if (blockSignatures.isEmpty()) return null;
        String head = body.length() > SIGNATURE_SCAN_LIMIT ? body.substring(0, SIGNATURE_SCAN_LIMIT) : body;
        String lower = head.toLowerCase(Locale.ROOT);
        for (String signature : blockSignatures) {
            if (lower.contains(signature.toLowerCase(Locale.ROOT))) return signature;
        }
        return null;
    }
}
