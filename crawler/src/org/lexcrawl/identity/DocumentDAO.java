package org.lexcrawl.identity;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jetbrains.annotations.Nullable;
import org.lexcrawl.util.MustUpdate;

import java.time.Instant;
import java.util.List;

@RegisterConstructorMapper(Document.class)
@RegisterConstructorMapper(DocumentDAO.YearCount.class)
@RegisterConstructorMapper(DocumentDAO.CategoryCount.class)
@RegisterConstructorMapper(DocumentDAO.PdfCount.class)
public interface DocumentDAO {
    @SqlUpdate("""
            INSERT INTO documents (global_id, uuid, country_code, doc_category, doc_year, yearly_sequence, title_full,
                                   title_short, subject_code, source_url, source_id, raw_content_ref, parsed_fields,
                                   filename, folder_path, pdf_url, pdf_downloaded, proxy_id, created_at, updated_at)
            VALUES (:globalId, :uuid, :countryCode, :docCategory, :docYear, :yearlySequence, :titleFull,
                    :titleShort, :subjectCode, :sourceUrl, :sourceId, :rawContentRef, :parsedFields,
                    :filename, :folderPath, :pdfUrl, :pdfDownloaded, :proxyId, :createdAt, :updatedAt)""")
    @GetGeneratedKeys
    long insert(@BindMethods Document document);

    @SqlQuery("SELECT * FROM documents WHERE source_url = ?")
    Document findBySourceUrl(String sourceUrl);

    @SqlQuery("SELECT * FROM documents WHERE global_id = ?")
    Document findByGlobalId(String globalId);

    @SqlQuery("SELECT global_id FROM documents WHERE source_url = ?")
    String findGlobalId(String sourceUrl);

    @SqlQuery("SELECT * FROM documents WHERE (:country IS NULL OR country_code = :country) ORDER BY id")
    List<Document> list(@Nullable String country);

    @SqlUpdate("""
            UPDATE documents SET title_full = :titleFull, title_short = :titleShort, parsed_fields = :parsedFields,
                                 pdf_url = COALESCE(:pdfUrl, pdf_url), updated_at = :updatedAt
            WHERE id = :id""")
    @MustUpdate(1)
    void updateParsed(long id, String titleFull, String titleShort, @Nullable String parsedFields,
                      @Nullable String pdfUrl, Instant updatedAt);

    @SqlUpdate("UPDATE documents SET pdf_downloaded = 1, updated_at = :updatedAt WHERE id = :id")
    @MustUpdate(1)
    void markPdfDownloaded(long id, Instant updatedAt);

    @SqlQuery("SELECT COUNT(*) FROM documents WHERE (:country IS NULL OR country_code = :country)")
    long count(@Nullable String country);

    @SqlQuery("""
            SELECT COUNT(*) FROM documents
            WHERE (:country IS NULL OR country_code = :country) AND created_at >= :since""")
    long countCreatedSince(@Nullable String country, Instant since);

    @SqlQuery("""
            SELECT doc_year, COUNT(*) AS count FROM documents
            WHERE (:country IS NULL OR country_code = :country)
            GROUP BY doc_year ORDER BY doc_year""")
    List<YearCount> countByYear(@Nullable String country);

    @SqlQuery("""
            SELECT doc_category, COUNT(*) AS count FROM documents
            WHERE (:country IS NULL OR country_code = :country)
            GROUP BY doc_category ORDER BY count DESC""")
    List<CategoryCount> countByCategory(@Nullable String country);

    @SqlQuery("""
            SELECT COUNT(pdf_url) AS with_pdf, COALESCE(SUM(pdf_downloaded), 0) AS downloaded FROM documents
            WHERE (:country IS NULL OR country_code = :country)""")
    PdfCount pdfCount(@Nullable String country);

    @SqlQuery("""
            SELECT * FROM documents
            WHERE (:country IS NULL OR country_code = :country)
              AND (title_full LIKE :pattern ESCAPE '!' OR title_short LIKE :pattern ESCAPE '!'
                   OR global_id LIKE :pattern ESCAPE '!' OR parsed_fields LIKE :pattern ESCAPE '!')
            ORDER BY doc_year DESC, global_id
            LIMIT :limit""")
    List<Document> search(String pattern, @Nullable String country, int limit);

    record YearCount(@Nullable Integer docYear, long count) {
    }

    record CategoryCount(DocCategory docCategory, long count) {
    }

    record PdfCount(long withPdf, long downloaded) {
    }
}
