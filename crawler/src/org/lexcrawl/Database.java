package org.lexcrawl;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.argument.ArgumentFactory;
import org.jdbi.v3.core.argument.NullArgument;
import org.jdbi.v3.core.config.JdbiConfig;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.ParsedSql;
import org.jdbi.v3.core.statement.SqlLogger;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.CreateSqlObject;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.jdbi.v3.sqlobject.transaction.Transactional;
import org.lexcrawl.identity.DocumentDAO;
import org.lexcrawl.identity.SequenceDAO;
import org.lexcrawl.proxy.ProxyDAO;
import org.lexcrawl.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

import static org.jdbi.v3.core.generic.GenericTypes.getErasedType;

/**
 * The crawl state store: proxies, frontier, documents and sequence counters in one SQLite file.
 * <p>
 * The pool holds a single connection, so every transaction is serialized.
 */
public interface Database extends AutoCloseable, Transactional<Database> {
    static Database newDatabaseInMemory() {
        return open("jdbc:sqlite::memory:");
    }

    static Database open(Path path) {
        return open("jdbc:sqlite:" + path);
    }

    static Database open(String jdbcUrl) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setConnectionInitSql("PRAGMA synchronous = NORMAL; PRAGMA foreign_keys = ON; PRAGMA busy_timeout = 60000;");
        config.setMaximumPoolSize(1);
        config.setPoolName("lexcrawl-db");
        var dataSource = new HikariDataSource(config);
        var jdbi = Jdbi.create(dataSource);
        jdbi.installPlugin(new SqlObjectPlugin());
        registerStringType(jdbi, Url.class, Url::new, Url::toString);
        registerStringType(jdbi, UUID.class, UUID::fromString, UUID::toString);
        registerEpochMillis(jdbi);
        jdbi.getConfig(PoolHolder.class).dataSource = dataSource;
        jdbi.setSqlLogger(new SlowSqlLogger(Duration.ofMillis(100)));
        Database db = jdbi.onDemand(Database.class);
        db.init();
        return db;
    }

    /**
     * Stores values of {@code type} in TEXT columns.
     */
    @SuppressWarnings("unchecked")
    private static <T> void registerStringType(Jdbi jdbi, Class<T> type, Function<String, T> parse,
                                               Function<T, String> format) {
        jdbi.registerColumnMapper(type, (ColumnMapper<T>) (rs, col, ctx) -> {
            String text = rs.getString(col);
            return text == null ? null : parse.apply(text);
        });
        jdbi.registerArgument((ArgumentFactory.Preparable) (argType, config) -> {
            if (!type.isAssignableFrom(getErasedType(argType))) return Optional.empty();
            return Optional.of(value -> {
                if (value == null) return new NullArgument(Types.VARCHAR);
                String text = format.apply((T) value);
                return (pos, stmt, ctx) -> stmt.setString(pos, text);
            });
        });
    }

    /**
     * Stores instants as epoch milliseconds so lease and due-time comparisons are integer compares.
     */
    private static void registerEpochMillis(Jdbi jdbi) {
        jdbi.registerColumnMapper(Instant.class, (rs, col, ctx) -> {
            long millis = rs.getLong(col);
            return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
        });
        jdbi.registerArgument((ArgumentFactory.Preparable) (argType, config) -> {
            if (!Instant.class.isAssignableFrom(getErasedType(argType))) return Optional.empty();
            return Optional.of(value -> {
                if (value == null) return new NullArgument(Types.BIGINT);
                long millis = ((Instant) value).toEpochMilli();
                return (pos, stmt, ctx) -> stmt.setLong(pos, millis);
            });
        });
    }

    default void init() {
        // executeAsSeparateStatements() because the sqlite driver only runs the first statement of a batch
        try (var stream = Objects.requireNonNull(Database.class.getResourceAsStream("schema.sql"), "missing schema.sql")) {
            var schema = new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            useHandle(handle -> handle.createScript(schema).executeAsSeparateStatements());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @CreateSqlObject
    ProxyDAO proxies();

    @CreateSqlObject
    FrontierDAO frontier();

    @CreateSqlObject
    DocumentDAO documents();

    @CreateSqlObject
    SequenceDAO sequences();

    default HikariDataSource dataSource() {
        return withHandle(handle -> handle.getConfig(PoolHolder.class).dataSource);
    }

    default void close() {
        dataSource().close();
    }

    class SlowSqlLogger implements SqlLogger {
        private static final Logger log = LoggerFactory.getLogger(Database.class);
        private final Duration threshold;

        SlowSqlLogger(Duration threshold) {
            this.threshold = threshold;
        }

        @Override
        public void logAfterExecution(StatementContext context) {
            Instant started = context.getExecutionMoment();
            Instant completed = context.getCompletionMoment();
            if (started == null || completed == null) return;
            Duration elapsed = Duration.between(started, completed);
            if (elapsed.compareTo(threshold) > 0) {
                ParsedSql parsedSql = context.getParsedSql();
                log.atWarn().addKeyValue("millis", elapsed.toMillis())
                        .log("Slow SQL: {}", parsedSql != null ? parsedSql.getSql() : "<sql unavailable>");
            }
        }
    }

    class PoolHolder implements JdbiConfig<PoolHolder> {
        private HikariDataSource dataSource;

        public PoolHolder() {
        }

        @Override
        public PoolHolder createCopy() {
            var copy = new PoolHolder();
            copy.dataSource = dataSource;
            return copy;
        }
    }
}
