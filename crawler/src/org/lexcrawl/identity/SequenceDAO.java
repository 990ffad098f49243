package org.lexcrawl.identity;

import org.jdbi.v3.sqlobject.statement.SqlQuery;

public interface SequenceDAO {
    /**
     * Allocates the next sequence number for a country/category/year, creating the counter on first use.
     */
    @SqlQuery("""
            INSERT INTO sequence_counters (country_code, doc_category, doc_year, next_value)
            VALUES (:countryCode, :category, :year, 2)
            ON CONFLICT (country_code, doc_category, doc_year) DO UPDATE SET next_value = next_value + 1
            RETURNING next_value - 1""")
    long allocate(String countryCode, DocCategory category, int year);

    @SqlQuery("""
            SELECT next_value FROM sequence_counters
            WHERE country_code = :countryCode AND doc_category = :category AND doc_year = :year""")
    Long peek(String countryCode, DocCategory category, int year);
}
