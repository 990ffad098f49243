package org.lexcrawl.normalize;

import org.junit.jupiter.api.Test;
import org.lexcrawl.config.SourceConfig;
import org.lexcrawl.fetch.Strategy;
import org.lexcrawl.identity.DocCategory;
import org.lexcrawl.util.Url;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class BdLawsAdapterTest {
    private final BdLawsAdapter adapter = new BdLawsAdapter();
    private final SourceConfig source = new SourceConfig("BD", "http://bdlaws.minlaw.gov.bd/", BdLawsAdapter.ID,
            "ACT", null, null, null, null);

    @Test
    void actPage() throws ExtractionException {
        var fields = adapter.extract(html("""
                <html><head><title>The Penal Code, 1860 - Laws of Bangladesh</title></head>
                <body><nav><a href="/">Home</a></nav>
                <h1>Related Links</h1>
                <p>( Act No. XLV of 1860 )</p>
                <p>Whereas it is expedient to provide a general Penal Code for Bangladesh;</p>
                <a href="/upload/act/1860-45.pdf">Download PDF</a>
                </body></html>"""), source);
        assertEquals("The Penal Code, 1860", fields.title());
        assertEquals("Penal Code", fields.titleShort());
        assertEquals(1860, fields.year());
        assertEquals(DocCategory.ACT, fields.category());
        assertEquals("XLV", fields.extra().get("actNumber"));
        assertEquals("1860", fields.extra().get("actNumberYear"));
        assertEquals("http://bdlaws.minlaw.gov.bd/upload/act/1860-45.pdf", fields.pdfUrl());
        assertTrue(fields.body().contains("general Penal Code"));
    }

    @Test
    void fallsBackToAnActHeadingWhenTheTitleIsGeneric() throws ExtractionException {
        var fields = adapter.extract(html("""
                <html><head><title>Laws of Bangladesh</title></head>
                <body><h1>Related Links</h1><h2>The Bangladesh Labour Act, 2006</h2>
                <p>Act No. 42 of 2006</p></body></html>"""), source);
        assertEquals("The Bangladesh Labour Act, 2006", fields.title());
        assertEquals("Bangladesh Labour", fields.titleShort());
        assertEquals("42", fields.extra().get("actNumber"));
    }

    @Test
    void bengaliHeading() throws ExtractionException {
        var fields = adapter.extract(html("""
                <html><head><title></title></head>
                <body><h1>বাংলাদেশ শ্রম আইন</h1></body></html>"""), source);
        assertEquals("বাংলাদেশ শ্রম আইন", fields.title());
        assertEquals(DocCategory.ACT, fields.category());
        assertNull(fields.year());
    }

    @Test
    void pagesWithoutAnActTitleAreRejected() {
        var e = assertThrows(ExtractionException.class, () -> adapter.extract(html("""
                <html><head><title>Home</title></head>
                <body><h1>Related Links</h1><h2>Chronological Index</h2></body></html>"""), source));
        assertTrue(e.getMessage().contains("No act title"));
    }

    @Test
    void pdfIsNotAnActPage() {
        var raw = new RawContent(new Url("http://bdlaws.minlaw.gov.bd/upload/act/1860-45.pdf"), "application/pdf",
                "%PDF-1.4".getBytes(StandardCharsets.US_ASCII), 200, Strategy.DIRECT, Instant.EPOCH);
        assertThrows(ExtractionException.class, () -> adapter.extract(raw, source));
    }

    @Test
    void categories() {
        assertEquals(DocCategory.ORDINANCE, BdLawsAdapter.category("Money Laundering Prevention Ordinance, 2008"));
        assertEquals(DocCategory.RULE, BdLawsAdapter.category("The Bangladesh Labour Rules, 2015"));
        assertEquals(DocCategory.ORDER, BdLawsAdapter.category("Bangladesh Bank Order, 1972"));
        assertEquals(DocCategory.REGULATION, BdLawsAdapter.category("Bengal Regulation of 1818"));
        assertEquals(DocCategory.ACT, BdLawsAdapter.category("The Code of Criminal Procedure, 1898"));
    }

    private static RawContent html(String body) {
        return new RawContent(new Url("http://bdlaws.minlaw.gov.bd/act-11.html"), "text/html; charset=UTF-8",
                body.getBytes(StandardCharsets.UTF_8), 200, Strategy.DIRECT, Instant.EPOCH);
    }
}
