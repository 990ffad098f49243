package org.lexcrawl.normalize;

import org.jetbrains.annotations.Nullable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.lexcrawl.config.SourceConfig;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Fallback extraction for sites without a dedicated adapter: title from the page metadata or first heading,
 * year by pattern, and the first linked PDF.
 */
public class GenericHtmlAdapter implements SourceAdapter {
    public static final String ID = "generic-html";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ParsedFields extract(RawContent raw, SourceConfig source) throws ExtractionException {
        if (raw.isPdf()) return fromPdfLink(raw);
        if (!raw.isHtml()) throw new ExtractionException("Unsupported content type " + raw.contentType());

        Document doc = Jsoup.parse(raw.text(), raw.url().toString());
        doc.select("script, style, noscript").remove();
        String title = firstNonBlank(
                doc.selectFirst("meta[property=og:title]") == null ? null
                        : doc.selectFirst("meta[property=og:title]").attr("content"),
                doc.title(),
                text(doc.selectFirst("h1")));
        doc.select("nav, footer, aside, header").remove();
        String body = doc.body() == null ? "" : TextHeuristics.collapseWhitespace(doc.body().text());
        Element pdfLink = doc.selectFirst("a[href~=(?i)\\.pdf($|\\?)]");
        return new ParsedFields(title, TextHeuristics.findYear(title, body), TextHeuristics.categoryFromTitle(title),
                body, pdfLink == null ? null : pdfLink.absUrl("href"), null, null, Map.of());
    }

    /**
     * A bare PDF carries no metadata we can read here, so the title comes from its file name.
     */
    private ParsedFields fromPdfLink(RawContent raw) {
        String name = URLDecoder.decode(raw.url().fileName(), StandardCharsets.UTF_8)
                .replaceAll("(?i)\\.pdf$", "")
                .replaceAll("[_+\\-]+", " ");
        String title = TextHeuristics.collapseWhitespace(name);
        return new ParsedFields(title, TextHeuristics.findYear(title), TextHeuristics.categoryFromTitle(title),
                null, raw.url().toString(), null, null, Map.of());
    }

    static @Nullable String text(@Nullable Element element) {
        return element == null ? null : TextHeuristics.collapseWhitespace(element.text());
    }

    static @Nullable String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) return TextHeuristics.collapseWhitespace(value);
        }
        return null;
    }
}
