package com.propertyintel.estate.output;

import com.propertyintel.estate.config.EstateScraperProperties;
import com.propertyintel.estate.config.EstateScraperProperties.Output.OutputMode;
import com.propertyintel.estate.model.EstateItem;
import com.propertyintel.estate.model.ScrapeRun;
import com.propertyintel.estate.model.UpsertResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes estate items to PostgreSQL.
 *
 * Each upsert first looks the listing up by hash_id (or the legacy id
 * column used by older tables) and skips it if present. Two writers can
 * both pass that check for the same listing; the unique index on hash_id
 * then rejects the second insert, which is logged and reported as a
 * skipped duplicate.
 */
@Component
@Slf4j
public class PostgresEstateWriter implements PersistenceAdapter {

    enum Kind { TEXT, BIGINT, INTEGER, DOUBLE, NUMERIC, BOOLEAN, TEXT_ARRAY }

    record Column(String name, String field, Kind kind) {}

    /** Flat item field → typed column, in insert order */
    static final List<Column> COLUMNS = List.of(
            new Column("hash_id", "hash_id", Kind.BIGINT),
            new Column("id", "hash_id", Kind.BIGINT),
            new Column("name", "name", Kind.TEXT),
            new Column("labels_all", "labelsAll", Kind.TEXT),
            new Column("exclusively_at_rk", "exclusively_at_rk", Kind.BOOLEAN),
            new Column("category", "category", Kind.INTEGER),
            new Column("has_floor_plan", "has_floor_plan", Kind.BOOLEAN),
            new Column("locality", "locality", Kind.TEXT),
            new Column("is_new", "new", Kind.BOOLEAN),
            new Column("type", "type", Kind.INTEGER),
            new Column("price", "price", Kind.NUMERIC),
            new Column("seo_category_main_cb", "seo_category_main_cb", Kind.INTEGER),
            new Column("seo_category_sub_cb", "seo_category_sub_cb", Kind.INTEGER),
            new Column("seo_category_type_cb", "seo_category_type_cb", Kind.INTEGER),
            new Column("seo_locality", "seo_locality", Kind.TEXT),
            new Column("price_czk_value_raw", "price_czk_value_raw", Kind.NUMERIC),
            new Column("price_czk_unit", "price_czk_unit", Kind.TEXT),
            new Column("price_czk_alt_value_raw", "price_czk_alt_value_raw", Kind.NUMERIC),
            new Column("price_czk_alt_unit", "price_czk_alt_unit", Kind.TEXT),
            new Column("links_iterator_href", "links_iterator_href", Kind.TEXT),
            new Column("links_self_href", "links_self_href", Kind.TEXT),
            new Column("links_images", "links_images", Kind.TEXT_ARRAY),
            new Column("links_image_middle2", "links_image_middle2", Kind.TEXT_ARRAY),
            new Column("gps_lat", "gps_lat", Kind.DOUBLE),
            new Column("gps_lon", "gps_lon", Kind.DOUBLE),
            new Column("embedded_company_url", "embedded_company_url", Kind.TEXT),
            new Column("embedded_company_id", "embedded_company_id", Kind.BIGINT),
            new Column("embedded_company_name", "embedded_company_name", Kind.TEXT),
            new Column("embedded_company_logo_small", "embedded_company_logo_small", Kind.TEXT)
    );

    private final JdbcTemplate jdbcTemplate;
    private final String table;
    private final String runsTable;
    private final String listDelimiter;

    public PostgresEstateWriter(JdbcTemplate jdbcTemplate, EstateScraperProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.table = identifier(properties.getOutput().getRelational().getTable());
        this.runsTable = identifier(properties.getOutput().getRelational().getRunsTable());
        this.listDelimiter = properties.getOutput().getCsv().getListDelimiter();
    }

    @Override
    public OutputMode mode() {
        return OutputMode.RELATIONAL;
    }

    @Override
    public void open() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
        } catch (DataAccessException e) {
            throw new PersistenceException("PostgreSQL is not reachable: " + e.getMessage(), e);
        }
        ensureSchema();
    }

    public void ensureSchema() {
        log.info("Ensuring PostgreSQL schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS %s
            (
                row_id                      BIGSERIAL PRIMARY KEY,
                hash_id                     BIGINT NOT NULL,
                id                          BIGINT,
                name                        TEXT,
                labels_all                  TEXT,
                exclusively_at_rk           BOOLEAN,
                category                    INTEGER,
                has_floor_plan              BOOLEAN,
                locality                    TEXT,
                is_new                      BOOLEAN,
                type                        INTEGER,
                price                       NUMERIC,
                seo_category_main_cb        INTEGER,
                seo_category_sub_cb         INTEGER,
                seo_category_type_cb        INTEGER,
                seo_locality                TEXT,
                price_czk_value_raw         NUMERIC,
                price_czk_unit              TEXT,
                price_czk_alt_value_raw     NUMERIC,
                price_czk_alt_unit          TEXT,
                links_iterator_href         TEXT,
                links_self_href             TEXT,
                links_images                TEXT[],
                links_image_middle2         TEXT[],
                gps_lat                     DOUBLE PRECISION,
                gps_lon                     DOUBLE PRECISION,
                embedded_company_url        TEXT,
                embedded_company_id         BIGINT,
                embedded_company_name       TEXT,
                embedded_company_logo_small TEXT,
                scraped_at                  TIMESTAMP,
                source_page                 INTEGER,
                source_category             TEXT,
                ingested_at                 TIMESTAMPTZ NOT NULL DEFAULT now()
            )
            """.formatted(table));

        jdbcTemplate.execute("CREATE UNIQUE INDEX IF NOT EXISTS %s_hash_id_idx ON %s (hash_id)".formatted(table, table));
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS %s_id_idx ON %s (id)".formatted(table, table));

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS %s
            (
                run_id              TEXT PRIMARY KEY,
                output_mode         TEXT,
                started_at          TIMESTAMP NOT NULL,
                completed_at        TIMESTAMP,
                status              TEXT NOT NULL,
                records_expected    BIGINT,
                records_fetched     BIGINT,
                records_written     BIGINT,
                error_message       TEXT
            )
            """.formatted(runsTable));

        log.info("PostgreSQL schema ready.");
    }

    @Override
    public UpsertResult upsert(EstateItem item) {
        Long hashId = toLong(item.getId());
        if (hashId == null) {
            log.error("Cannot store listing without a numeric hash_id (got {})", item.getId());
            return UpsertResult.FAILED;
        }

        try {
            Integer existing = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM " + table + " WHERE hash_id = ? OR id = ?",
                    Integer.class, hashId, hashId);
            if (existing != null && existing > 0) {
                log.info("Listing {} already exists in the database", hashId);
                return UpsertResult.SKIPPED_DUPLICATE;
            }

            insert(item);
            return UpsertResult.INSERTED;

        } catch (DuplicateKeyException e) {
            log.error("Listing {} was inserted concurrently, skipping: {}", hashId, e.getMessage());
            return UpsertResult.SKIPPED_DUPLICATE;
        } catch (DataAccessException e) {
            log.error("Failed to write listing {}: {}", hashId, e.getMessage(), e);
            return UpsertResult.FAILED;
        }
    }

    @Override
    public void close() {
        // JdbcTemplate connections are pooled and released per statement
    }

    public void writeScrapeRun(ScrapeRun run) {
        try {
            jdbcTemplate.update("""
                INSERT INTO %s
                (run_id, output_mode, started_at, completed_at, status,
                 records_expected, records_fetched, records_written, error_message)
                VALUES (?,?,?,?,?,?,?,?,?)
                """.formatted(runsTable),
                    run.getRunId(),
                    run.getOutputMode(),
                    Timestamp.valueOf(run.getStartedAt()),
                    run.getCompletedAt() != null ? Timestamp.valueOf(run.getCompletedAt()) : null,
                    run.getStatus(),
                    run.getRecordsExpected(),
                    run.getRecordsFetched(),
                    run.getRecordsWritten(),
                    run.getErrorMessage());
        } catch (Exception e) {
            log.warn("Failed to write scrape run: {}", e.getMessage());
        }
    }

    private void insert(EstateItem item) {
        List<String> names = new ArrayList<>(COLUMNS.stream().map(Column::name).toList());
        names.addAll(List.of("scraped_at", "source_page", "source_category"));
        String placeholders = names.stream().map(n -> "?").collect(Collectors.joining(","));
        String sql = "INSERT INTO " + table + " (" + String.join(", ", names) + ") VALUES (" + placeholders + ")";

        List<Object> values = columnValues(item);

        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(sql);
            int idx = 1;
            for (int i = 0; i < COLUMNS.size(); i++) {
                Kind kind = COLUMNS.get(i).kind();
                Object value = values.get(i);
                if (value == null) {
                    ps.setNull(idx++, sqlType(kind));
                } else if (kind == Kind.TEXT_ARRAY) {
                    ps.setArray(idx++, con.createArrayOf("text", (String[]) value));
                } else {
                    ps.setObject(idx++, value, sqlType(kind));
                }
            }
            if (item.getScrapedAt() != null) {
                ps.setTimestamp(idx++, Timestamp.valueOf(item.getScrapedAt()));
            } else {
                ps.setNull(idx++, Types.TIMESTAMP);
            }
            ps.setInt(idx++, item.getSourcePage());
            ps.setString(idx, item.getSourceCategory());
            return ps;
        });
    }

    /** Values for {@link #COLUMNS}, converted to the column's Java type */
    List<Object> columnValues(EstateItem item) {
        List<Object> values = new ArrayList<>(COLUMNS.size());
        for (Column column : COLUMNS) {
            values.add(convert(item.get(column.field()), column.kind()));
        }
        return values;
    }

    private Object convert(Object raw, Kind kind) {
        if (raw == null) return null;
        return switch (kind) {
            case TEXT -> raw instanceof Collection<?> c
                    ? c.stream().map(String::valueOf).collect(Collectors.joining(listDelimiter))
                    : raw.toString();
            case BIGINT -> toLong(raw);
            case INTEGER -> {
                Long l = toLong(raw);
                yield l == null ? null : l.intValue();
            }
            case DOUBLE -> toDouble(raw);
            case NUMERIC -> {
                if (raw instanceof Long l) yield BigDecimal.valueOf(l);
                Double d = toDouble(raw);
                yield d == null ? null : BigDecimal.valueOf(d);
            }
            case BOOLEAN -> raw instanceof Boolean b ? b : Boolean.parseBoolean(raw.toString());
            case TEXT_ARRAY -> raw instanceof Collection<?> c
                    ? c.stream().map(String::valueOf).toArray(String[]::new)
                    : new String[]{raw.toString()};
        };
    }

    private int sqlType(Kind kind) {
        return switch (kind) {
            case TEXT -> Types.VARCHAR;
            case BIGINT -> Types.BIGINT;
            case INTEGER -> Types.INTEGER;
            case DOUBLE -> Types.DOUBLE;
            case NUMERIC -> Types.NUMERIC;
            case BOOLEAN -> Types.BOOLEAN;
            case TEXT_ARRAY -> Types.ARRAY;
        };
    }

    private static Long toLong(Object raw) {
        if (raw == null) return null;
        if (raw instanceof Number n) return n.longValue();
        try {
            return Long.parseLong(raw.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double toDouble(Object raw) {
        if (raw instanceof Number n) return n.doubleValue();
        try {
            return Double.parseDouble(raw.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String identifier(String name) {
        if (name == null || !name.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException("Invalid table name: " + name);
        }
        return name;
    }
}
