package org.lexcrawl.proxy;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jetbrains.annotations.Nullable;
import org.lexcrawl.util.MustUpdate;

import java.time.Instant;
import java.util.List;

@RegisterConstructorMapper(ProxyEndpoint.class)
public interface ProxyDAO {
    @SqlUpdate("""
            INSERT INTO proxy_endpoints (provider, external_id, address, port, region, credentials_ref, state,
                                         created_at)
            VALUES (:provider, :externalId, :address, :port, :region, :credentialsRef, :state, :createdAt)""")
    @GetGeneratedKeys
    long insert(String provider, @Nullable String externalId, @Nullable String address, int port,
                @Nullable String region, @Nullable String credentialsRef, ProxyEndpoint.State state,
                Instant createdAt);

    @SqlQuery("SELECT * FROM proxy_endpoints WHERE id = ?")
    ProxyEndpoint findById(long id);

    @SqlQuery("SELECT * FROM proxy_endpoints WHERE provider = :provider AND external_id = :externalId")
    ProxyEndpoint findByExternalId(String provider, String externalId);

    @SqlQuery("""
            SELECT * FROM proxy_endpoints
            WHERE address = :address AND port = :port AND state != 'TERMINATED'""")
    ProxyEndpoint findLiveByAddress(String address, int port);

    @SqlQuery("""
            SELECT * FROM proxy_endpoints
            WHERE (:state IS NULL OR state = :state)
              AND (:provider IS NULL OR provider = :provider)
              AND (:region IS NULL OR region = :region)
            ORDER BY id""")
    List<ProxyEndpoint> list(@BindMethods ProxyFilter filter);

    @SqlUpdate("""
            UPDATE proxy_endpoints SET external_id = COALESCE(external_id, :externalId),
                                       address = COALESCE(:address, address), region = COALESCE(:region, region),
                                       credentials_ref = COALESCE(:credentialsRef, credentials_ref)
            WHERE id = :id""")
    void updateDetails(long id, @Nullable String externalId, @Nullable String address, @Nullable String region,
                       @Nullable String credentialsRef);

    @SqlUpdate("UPDATE proxy_endpoints SET state = :state WHERE id = :id AND state != 'TERMINATED'")
    int updateState(long id, ProxyEndpoint.State state);

    @SqlUpdate("""
            UPDATE proxy_endpoints SET state = :state, last_tested_at = :testedAt,
                                       last_response_time_ms = :responseTimeMs
            WHERE id = :id AND state != 'TERMINATED'""")
    int recordProbe(long id, ProxyEndpoint.State state, Instant testedAt, @Nullable Long responseTimeMs);

    @SqlUpdate("UPDATE proxy_endpoints SET state = 'TERMINATED' WHERE id = :id")
    @MustUpdate(1)
    void markTerminated(long id);
}
