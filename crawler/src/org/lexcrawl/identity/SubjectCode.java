package org.lexcrawl.identity;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Broad area of law, used in canonical filenames. Assigned from keywords when the source doesn't say.
 */
public enum SubjectCode {
    CRM("murder", "theft", "robbery", "criminal", "penal", "offense", "crime", "punishment", "bail", "police",
            "arrest", "section 302", "section 304", "crpc", "ipc", "evidence act", "narcotics", "arms act"),
    CIV("contract", "tort", "negligence", "damages", "civil", "suit", "decree", "injunction", "specific performance",
            "breach", "cpc", "limitation"),
    CON("constitution", "fundamental", "writ", "amendment", "parliament", "legislative", "judicial review",
            "habeas corpus", "mandamus", "certiorari", "quo warranto"),
    PRO("property", "land", "transfer of property", "sale deed", "mutation", "partition", "possession", "easement",
            "mortgage", "lease", "tenancy"),
    FAM("marriage", "divorce", "custody", "maintenance", "adoption", "guardianship", "succession", "inheritance",
            "family", "matrimonial", "dowry", "domestic violence"),
    COM("company", "companies", "partnership", "commercial", "banking", "insurance", "securities", "arbitration",
            "negotiable", "corporate", "shareholder"),
    TAX("income tax", "tax", "revenue", "assessment", "refund", "gst", "customs", "excise", "vat"),
    LAB("labor", "labour", "employment", "industrial", "wages", "workman", "factory", "factories", "trade union",
            "strike", "lockout"),
    ENV("environment", "pollution", "forest", "wildlife", "conservation", "climate", "biodiversity",
            "green tribunal"),
    IPR("patent", "copyright", "trademark", "intellectual property", "infringement", "passing off", "trade secret",
            "geographical indication"),
    ADM("administrative", "government", "tender", "pension", "promotion", "disciplinary", "public servant",
            "corruption"),
    CSM("consumer", "deficiency", "unfair trade", "misleading advertisement"),
    IT("cyber", "digital", "electronic", "computer", "privacy", "internet", "information technology", "hacking",
            "phishing"),
    INT("international", "treaty", "convention", "extradition", "refugee", "asylum", "diplomatic", "bilateral",
            "multilateral"),
    HUM("human rights", "discrimination", "equality", "dignity", "right to life", "torture", "detention"),
    GEN;

    private final List<Pattern> keywords;

    SubjectCode(String... keywords) {
        this.keywords = java.util.Arrays.stream(keywords)
                .map(k -> Pattern.compile("\\b" + Pattern.quote(k) + "\\b",
                        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                .toList();
    }

    int hits(String text) {
        if (text == null || text.isEmpty()) return 0;
        int hits = 0;
        for (Pattern keyword : keywords) {
            if (keyword.matcher(text).find()) hits++;
        }
        return hits;
    }

    public static SubjectCode parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
