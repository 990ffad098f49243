package org.lexcrawl;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jetbrains.annotations.Nullable;
import org.lexcrawl.fetch.Strategy;
import org.lexcrawl.util.MustUpdate;
import org.lexcrawl.util.Url;

import java.time.Instant;
import java.util.List;

@RegisterConstructorMapper(FrontierEntry.class)
@RegisterConstructorMapper(FrontierDAO.StateCount.class)
public interface FrontierDAO {
    @SqlUpdate("""
            INSERT INTO frontier (url, country_code, source_id, state, time_added)
            VALUES (:url, :countryCode, :sourceId, 'PENDING', :timeAdded)
            ON CONFLICT(url) DO NOTHING""")
    int add(Url url, String countryCode, String sourceId, Instant timeAdded);

    @SqlQuery("SELECT * FROM frontier WHERE url = ?")
    FrontierEntry findByUrl(Url url);

    @SqlQuery("SELECT * FROM frontier WHERE id = ?")
    FrontierEntry findById(long id);

    /**
     * Claims the oldest entry that is pending and due, or whose lease has expired.
     */
    @SqlQuery("""
            UPDATE frontier SET state = 'LEASED', lease_owner = :owner, lease_expiry = :leaseExpiry
            WHERE id = (SELECT id FROM frontier
                        WHERE (:country IS NULL OR country_code = :country)
                          AND ((state = 'PENDING' AND (next_attempt_at IS NULL OR next_attempt_at <= :now))
                               OR (state = 'LEASED' AND lease_expiry <= :now))
                        ORDER BY id LIMIT 1)
            RETURNING *""")
    FrontierEntry leaseNext(String owner, @Nullable String country, Instant now, Instant leaseExpiry);

    @SqlUpdate("""
            UPDATE frontier SET state = 'DONE', lease_owner = NULL, lease_expiry = NULL, next_attempt_at = NULL,
                                error_kind = NULL, last_error = NULL, raw_content_ref = :rawContentRef,
                                last_proxy_id = :proxyId
            WHERE id = :id AND state = 'LEASED' AND lease_owner = :owner""")
    @MustUpdate(1)
    void complete(long id, String owner, @Nullable String rawContentRef, @Nullable Long proxyId);

    @SqlUpdate("""
            UPDATE frontier SET state = :state, attempts = attempts + 1, last_error = :error, error_kind = :kind,
                                lease_owner = NULL, lease_expiry = NULL, next_attempt_at = :nextAttemptAt,
                                last_proxy_id = COALESCE(:proxyId, last_proxy_id)
            WHERE id = :id AND state = 'LEASED' AND lease_owner = :owner""")
    @MustUpdate(1)
    void fail(long id, String owner, FrontierEntry.State state, String error, ErrorKind kind,
              @Nullable Instant nextAttemptAt, @Nullable Long proxyId);

    @SqlUpdate("""
            UPDATE frontier SET state = 'PENDING', lease_owner = NULL, lease_expiry = NULL
            WHERE id = :id AND state = 'LEASED' AND lease_owner = :owner""")
    @MustUpdate(1)
    void requeue(long id, String owner);

    @SqlUpdate("""
            UPDATE frontier SET state = 'PENDING', lease_owner = NULL, lease_expiry = NULL, strategy = :strategy,
                                last_error = :reason, error_kind = NULL, raw_content_ref = :rawContentRef,
                                next_attempt_at = NULL
            WHERE id = :id AND state = 'LEASED' AND lease_owner = :owner""")
    @MustUpdate(1)
    void escalate(long id, String owner, Strategy strategy, String reason, @Nullable String rawContentRef);

    @SqlUpdate("""
            UPDATE frontier SET state = 'PENDING', lease_owner = NULL, lease_expiry = NULL, last_error = :reason,
                                error_kind = 'PARSE', raw_content_ref = :rawContentRef, next_attempt_at = :until
            WHERE id = :id AND state = 'LEASED' AND lease_owner = :owner""")
    @MustUpdate(1)
    void park(long id, String owner, String reason, @Nullable String rawContentRef, Instant until);

    @SqlUpdate("UPDATE frontier SET classification = :classification WHERE id = :id")
    void setClassification(long id, String classification);

    @SqlUpdate("""
            UPDATE frontier SET state = 'PENDING', next_attempt_at = NULL
            WHERE state = 'FAILED' AND (:country IS NULL OR country_code = :country)""")
    int requeueFailed(@Nullable String country);

    @SqlQuery("""
            SELECT * FROM frontier
            WHERE state = 'PENDING' AND error_kind = 'PARSE' AND raw_content_ref IS NOT NULL
              AND (:country IS NULL OR country_code = :country)
            ORDER BY id""")
    List<FrontierEntry> listParked(@Nullable String country);

    /**
     * Leases a specific parked entry for re-normalization, regardless of when it is due.
     */
    @SqlQuery("""
            UPDATE frontier SET state = 'LEASED', lease_owner = :owner, lease_expiry = :leaseExpiry
            WHERE id = :id AND state = 'PENDING'
            RETURNING *""")
    FrontierEntry leaseById(long id, String owner, Instant leaseExpiry);

    @SqlQuery("""
            SELECT state, error_kind, COUNT(*) AS count FROM frontier
            WHERE (:country IS NULL OR country_code = :country)
            GROUP BY state, error_kind""")
    List<StateCount> countByState(@Nullable String country);

    @SqlQuery("""
            SELECT COUNT(*) FROM frontier
            WHERE (:country IS NULL OR country_code = :country)
              AND ((state = 'PENDING' AND (error_kind IS NULL OR error_kind != 'PARSE')) OR state = 'LEASED')""")
    long countActive(@Nullable String country);

    @SqlQuery("""
            SELECT * FROM frontier WHERE state = 'FAILED' AND (:country IS NULL OR country_code = :country)
            ORDER BY id LIMIT :limit""")
    List<FrontierEntry> listFailed(@Nullable String country, int limit);

    record StateCount(FrontierEntry.State state, @Nullable ErrorKind errorKind, long count) {
    }
}
