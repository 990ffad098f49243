package org.lexcrawl.normalize;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.lexcrawl.config.SourceConfig;
import org.lexcrawl.identity.DocCategory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Laws of Bangladesh (bdlaws.minlaw.gov.bd). Act pages put the act name in the {@code <title>}, suffixed with the
 * site name, while the page body is dominated by navigation; a heading is only trusted if it names an act or
 * ordinance.
 */
public class BdLawsAdapter implements SourceAdapter {
    public static final String ID = "bdlaws";
    private static final List<String> SITE_SUFFIXES = List.of(" - Laws of Bangladesh", " | Laws of Bangladesh");
    private static final List<String> TITLE_KEYWORDS = List.of("Act", "Ordinance", "Code", "Regulation", "Order",
            "Rules", "আইন", "অধ্যাদেশ", "বিধি");
    private static final Pattern ACT_NUMBER = Pattern.compile(
            "\\b(?:Act|Ordinance|Regulation|P\\.O\\.)\\s+No\\.?\\s*([IVXLCDM]+|\\d+)\\s+of\\s+(\\d{4})",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern YEAR_IN_TITLE = Pattern.compile(",?\\s*\\(?\\b(1[7-9]\\d{2}|20\\d{2})\\b\\)?");

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ParsedFields extract(RawContent raw, SourceConfig source) throws ExtractionException {
        if (!raw.isHtml()) throw new ExtractionException("Expected an HTML act page, got " + raw.contentType());
        Document doc = Jsoup.parse(raw.text(), raw.url().toString());
        doc.select("script, style, noscript").remove();

        String title = titleFromHead(doc);
        if (title == null) title = titleFromHeadings(doc);
        if (title == null) throw new ExtractionException("No act title in <title> or headings");

        String body = TextHeuristics.collapseWhitespace(doc.body() == null ? "" : doc.body().text());
        var extra = new LinkedHashMap<String, String>();
        Matcher actNumber = ACT_NUMBER.matcher(body);
        if (actNumber.find()) {
            extra.put("actNumber", actNumber.group(1).toUpperCase(Locale.ROOT));
            extra.put("actNumberYear", actNumber.group(2));
        }
        Integer year = TextHeuristics.findYear(title, body);
        Element pdfLink = doc.selectFirst("a[href~=(?i)pdf]");
        return new ParsedFields(title, year, category(title), body,
                pdfLink == null ? null : pdfLink.absUrl("href"), null, shortTitle(title), extra);
    }

    @Nullable String titleFromHead(Document doc) {
        String title = doc.title().trim();
        for (String suffix : SITE_SUFFIXES) {
            title = StringUtils.removeEnd(title, suffix).trim();
        }
        if (title.length() < 10 || title.length() > 300) return null;
        boolean hasKeyword = TITLE_KEYWORDS.stream().anyMatch(title::contains);
        return hasKeyword || title.length() > 20 ? title : null;
    }

    @Nullable String titleFromHeadings(Document doc) {
        for (Element heading : doc.select("h1, h2")) {
            String text = TextHeuristics.collapseWhitespace(heading.text());
            if (text.contains("Act") || text.contains("Ordinance") || text.contains("আইন")
                || text.contains("অধ্যাদেশ")) {
                return text;
            }
        }
        return null;
    }

    static DocCategory category(String title) {
        String t = title.toLowerCase(Locale.ROOT);
        if (t.contains("ordinance") || title.contains("অধ্যাদেশ")) return DocCategory.ORDINANCE;
        if (t.matches(".*\\brules?\\b.*") || title.contains("বিধি")) return DocCategory.RULE;
        if (t.matches(".*\\border\\b.*")) return DocCategory.ORDER;
        if (t.contains("regulation")) return DocCategory.REGULATION;
        return DocCategory.ACT;
    }

    static String shortTitle(String title) {
        String s = StringUtils.removeStartIgnoreCase(title.trim(), "The ");
        s = YEAR_IN_TITLE.matcher(s).replaceAll("");
        s = s.replace(" Act", "").replace(" Ordinance", "");
        return StringUtils.abbreviate(TextHeuristics.collapseWhitespace(s), 50);
    }
}
