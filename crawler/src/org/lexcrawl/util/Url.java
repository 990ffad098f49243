package org.lexcrawl.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.Nullable;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * URL type which caches parsing.
 */
public class Url {
    private final String url;
    private URI uri;

    @JsonCreator
    public Url(String url) {
        this.url = url;
    }

    /**
     * @throws IllegalArgumentException if the URL is not syntactically valid
     */
    public synchronized URI toURI() {
        if (uri == null) {
            uri = URI.create(url);
        }
        return uri;
    }

    public boolean isValid() {
        try {
            return toURI().getHost() != null;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public String path() {
        String path = toURI().getPath();
        return path == null ? "" : path;
    }

    public @Nullable String query() {
        return toURI().getRawQuery();
    }

    /**
     * Decoded query parameters in order of appearance. Repeated names keep their first value.
     */
    public Map<String, String> queryParams() {
        String query = query();
        if (query == null || query.isEmpty()) return Map.of();
        var params = new LinkedHashMap<String, String>();
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String name = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            params.putIfAbsent(decode(name), decode(value));
        }
        return params;
    }

    private static String decode(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return s;
        }
    }

    /**
     * Path segments, lowercased, ignoring empty ones.
     */
    public List<String> pathSegments() {
        var segments = new ArrayList<String>();
        for (String segment : path().split("/")) {
            if (!segment.isEmpty()) segments.add(segment.toLowerCase(Locale.ROOT));
        }
        return segments;
    }

    /**
     * The last path segment's file name, or an empty string.
     */
    public String fileName() {
        String path = path();
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    private static boolean startsWithIgnoreCase(String str, String prefix) {
        return str.regionMatches(true, 0, prefix, 0, prefix.length());
    }

    public boolean isHttp() {
        return startsWithIgnoreCase(url, "http:") ||
               startsWithIgnoreCase(url, "https:");
    }

    public Url withoutFragment() {
        int i = url.indexOf('#');
        if (i == -1) {
            return this;
        }
        return new Url(url.substring(0, i));
    }

    @JsonValue
    public String toString() {
        return url;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return url.equals(((Url) o).url);
    }

    @Override
    public int hashCode() {
        return url.hashCode();
    }
}
