package com.algocoin.data.store;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import com.algocoin.data.metrics.SeriesPoint;
import com.algocoin.data.metrics.WideTable;
import com.google.common.collect.Lists;

/**
 * The sentiment table: one row per timestamp with one column per metric and
 * a running {@code window_id}.
 */
public class SentimentStore {

    private static final Logger logger = LoggerFactory.getLogger(SentimentStore.class);

    public static final String TABLE = "sentiment";
    public static final String TIMESTAMP_COLUMN = "timestamp";
    public static final String WINDOW_ID_COLUMN = "window_id";
    public static final String VOLUME_PREFIX = "social_volume_";

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final String database;

    public SentimentStore(DataSource dataSource, String database) {
        this(new NamedParameterJdbcTemplate(dataSource), database);
    }

    public SentimentStore(NamedParameterJdbcTemplate jdbcTemplate, String database) {
        this.jdbcTemplate = jdbcTemplate;
        this.database = StoreDataSources.checkIdentifier(database);
    }

    /**
     * Rows with {@code start <= timestamp <= end}; either bound may be null.
     */
    public WideTable read(Instant start, Instant end) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        List<String> conditions = new ArrayList<>();
        if (start != null) {
            params.addValue("ts0", Timestamp.from(start));
            conditions.add("timestamp >= :ts0");
        }
        if (end != null) {
            params.addValue("ts1", Timestamp.from(end));
            conditions.add("timestamp <= :ts1");
        }
        String where = conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
        String sql = "SELECT * FROM " + database + "." + TABLE + where + " ORDER BY timestamp";

        List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql, params);
        WideTable.Builder table = WideTable.builder();
        for (Map<String, Object> row : rows) {
            Instant timestamp = toInstant(row.get(TIMESTAMP_COLUMN));
            if (timestamp == null) {
                continue;
            }
            table.row(timestamp);
            for (Map.Entry<String, Object> cell : row.entrySet()) {
                if (!cell.getKey().equalsIgnoreCase(TIMESTAMP_COLUMN)) {
                    table.value(timestamp, cell.getKey(), SeriesPoint.toDouble(cell.getValue()));
                }
            }
        }
        WideTable result = table.build();
        logger.info("Read {} sentiment rows ({} .. {})", result.rowCount(), start, end);
        return result;
    }

    /**
     * Creates the sentiment table for the given metric columns if it does not exist yet.
     */
    public void createSchema(List<String> columns) {
        jdbcTemplate.getJdbcTemplate().execute("CREATE DATABASE IF NOT EXISTS " + database);

        StringJoiner definition = new StringJoiner(",\n    ", "(\n    ", "\n)");
        definition.add(TIMESTAMP_COLUMN + " DateTime");
        for (String column : metricColumns(columns)) {
            definition.add(column + (isVolume(column) ? " Nullable(UInt32)" : " Nullable(Float64)"));
        }
        definition.add(WINDOW_ID_COLUMN + " UInt32");

        String sql = "CREATE TABLE IF NOT EXISTS " + database + "." + TABLE + " " + definition
                + " ENGINE = MergeTree() ORDER BY timestamp";
        jdbcTemplate.getJdbcTemplate().execute(sql);
        logger.info("✓ Sentiment table {}.{} created/verified", database, TABLE);
    }

    /**
     * Inserts every row of the table in batches. The {@code window_id}
     * column is taken from the table when present, otherwise rows are
     * numbered from 1 in timestamp order.
     *
     * @return number of rows inserted
     */
    public int insert(WideTable table, int batchSize) {
        List<String> columns = metricColumns(table.getColumns());
        boolean hasWindowId = table.hasColumn(WINDOW_ID_COLUMN);

        StringJoiner names = new StringJoiner(", ", "(", ")");
        StringJoiner placeholders = new StringJoiner(", ", "(", ")");
        names.add(TIMESTAMP_COLUMN);
        placeholders.add("?");
        for (String column : columns) {
            names.add(column);
            placeholders.add("?");
        }
        names.add(WINDOW_ID_COLUMN);
        placeholders.add("?");
        String sql = "INSERT INTO " + database + "." + TABLE + " " + names + " VALUES " + placeholders;

        List<Object[]> values = new ArrayList<>(table.rowCount());
        long windowId = 1;
        for (Map.Entry<Instant, Map<String, Double>> row : table.getRows().entrySet()) {
            Object[] args = new Object[columns.size() + 2];
            args[0] = Timestamp.from(row.getKey());
            for (int i = 0; i < columns.size(); i++) {
                Double value = row.getValue().get(columns.get(i));
                args[i + 1] = value != null && isVolume(columns.get(i)) ? (Object) Math.round(value) : value;
            }
            Double storedId = hasWindowId ? row.getValue().get(WINDOW_ID_COLUMN) : null;
            args[args.length - 1] = storedId != null ? Math.round(storedId) : windowId;
            windowId++;
            values.add(args);
        }

        int inserted = 0;
        for (List<Object[]> batch : Lists.partition(values, batchSize)) {
            jdbcTemplate.getJdbcTemplate().batchUpdate(sql, batch);
            inserted += batch.size();
            logger.debug("Inserted {}/{} sentiment rows", inserted, values.size());
        }
        logger.info("✅ Uploaded {} rows to {}.{}", inserted, database, TABLE);
        return inserted;
    }

    private static List<String> metricColumns(List<String> columns) {
        List<String> metrics = new ArrayList<>();
        for (String column : columns) {
            if (!column.equals(WINDOW_ID_COLUMN) && !column.equals(TIMESTAMP_COLUMN)) {
                metrics.add(StoreDataSources.checkIdentifier(column));
            }
        }
        return metrics;
    }

    static boolean isVolume(String column) {
        return column.startsWith(VOLUME_PREFIX);
    }

    static Instant toInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toInstant();
        }
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toInstant();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
        }
        if (value instanceof java.util.Date) {
            return ((java.util.Date) value).toInstant();
        }
        return Instant.parse(value.toString());
    }
}
