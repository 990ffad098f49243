package org.lexcrawl.normalize;

import org.jetbrains.annotations.Nullable;
import org.lexcrawl.fetch.Strategy;
import org.lexcrawl.util.Url;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.time.Instant;
import java.util.Locale;

/**
 * Bytes of a fetched page, as archived.
 *
 * @param status HTTP status, or 200 for a rendered page
 */
public record RawContent(Url url, @Nullable String contentType, byte[] body, int status, Strategy strategy,
                         Instant fetchedAt) {

    public String text() {
        return new String(body, charset());
    }

    Charset charset() {
        if (contentType != null) {
            for (String param : contentType.split(";")) {
                String p = param.trim();
                if (p.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                    try {
                        return Charset.forName(p.substring(8).replace("\"", "").trim());
                    } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                        break;
                    }
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    public boolean isPdf() {
        if (contentType != null && contentType.toLowerCase(Locale.ROOT).contains("application/pdf")) return true;
        return body.length >= 4 && body[0] == '%' && body[1] == 'P' && body[2] == 'D' && body[3] == 'F';
    }

    public boolean isHtml() {
        if (contentType != null) return contentType.toLowerCase(Locale.ROOT).contains("html");
        return !isPdf();
    }
}
