package ch.so.arp.chatcache.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link QueryStore} on top of the {@code query_cache} table. Works against
 * PostgreSQL and H2.
 * <p>
 * Question texts are unbounded; uniqueness is enforced on the SHA-256 hex digest
 * of the text in {@code query_hash}.
 */
public class JdbcQueryStore implements QueryStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcQueryStore.class);

    private static final String INCREMENT_SQL = """
            UPDATE query_cache
            SET response = :response,
                usage_count = usage_count + 1
            WHERE query_hash = :hash AND query_text = :query
            """;

    private static final String INSERT_SQL = """
            INSERT INTO query_cache (query_hash, query_text, embedding, response, usage_count)
            VALUES (:hash, :query, :embedding, :response, 1)
            """;

    private static final String SELECT_SQL = """
            SELECT id, query_text, embedding, response, usage_count
            FROM query_cache
            """;

    private final JdbcClient jdbcClient;
    private final TransactionTemplate transactionTemplate;

    public JdbcQueryStore(JdbcClient jdbcClient, TransactionTemplate transactionTemplate) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate");
    }

    @Override
    public boolean upsert(String query, float[] embedding, String response) {
        byte[] blob = EmbeddingCodec.encode(embedding);
        String hash = hash(query);
        try {
            Boolean inserted = transactionTemplate.execute(status -> {
                if (increment(hash, query, response) > 0) {
                    return Boolean.FALSE;
                }
                jdbcClient.sql(INSERT_SQL)
                        .param("hash", hash)
                        .param("query", query)
                        .param("embedding", blob)
                        .param("response", response)
                        .update();
                return Boolean.TRUE;
            });
            return Boolean.TRUE.equals(inserted);
        } catch (DuplicateKeyException ex) {
            // another caller inserted the same question between our update and insert
            LOGGER.debug("Concurrent insert of '{}', retrying as update", query);
            return retryIncrement(hash, query, response);
        } catch (DataAccessException | TransactionException ex) {
            throw new StoreFailureException("Unable to store answer for '" + query + "'", ex);
        }
    }

    @Override
    public List<QueryRecord> findAll() {
        try {
            return jdbcClient.sql(SELECT_SQL + "ORDER BY id")
                    .query(QueryRecordMapper.INSTANCE)
                    .list();
        } catch (DataAccessException | IllegalArgumentException ex) {
            throw new StoreFailureException("Unable to read stored questions", ex);
        }
    }

    @Override
    public Optional<QueryRecord> findByQuery(String query) {
        try {
            return jdbcClient.sql(SELECT_SQL + "WHERE query_hash = :hash AND query_text = :query")
                    .param("hash", hash(query))
                    .param("query", query)
                    .query(QueryRecordMapper.INSTANCE)
                    .optional();
        } catch (DataAccessException | IllegalArgumentException ex) {
            throw new StoreFailureException("Unable to read stored question '" + query + "'", ex);
        }
    }

    private boolean retryIncrement(String hash, String query, String response) {
        try {
            Integer updated = transactionTemplate.execute(status -> increment(hash, query, response));
            if (updated == null || updated == 0) {
                throw new StoreFailureException("Question '" + query + "' vanished during concurrent insert");
            }
            return false;
        } catch (DataAccessException | TransactionException ex) {
            throw new StoreFailureException("Unable to store answer for '" + query + "'", ex);
        }
    }

    private int increment(String hash, String query, String response) {
        return jdbcClient.sql(INCREMENT_SQL)
                .param("hash", hash)
                .param("query", query)
                .param("response", response)
                .update();
    }

    static String hash(String query) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(query.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm not available", ex);
        }
    }

    private enum QueryRecordMapper implements RowMapper<QueryRecord> {
        INSTANCE;

        @Override
        public QueryRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new QueryRecord(
                    rs.getLong("id"),
                    rs.getString("query_text"),
                    EmbeddingCodec.decode(rs.getBytes("embedding")),
                    rs.getString("response"),
                    rs.getInt("usage_count"));
        }
    }
}
