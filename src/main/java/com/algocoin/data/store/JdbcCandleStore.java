package com.algocoin.data.store;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/**
 * Candle table access over JDBC. Candles are joined with their instrument
 * and the base and quote currencies so a query can name the pair by codes.
 */
public class JdbcCandleStore implements CandleStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcCandleStore.class);

    private static final String FROM_JOINS =
            "FROM   %1$s.candles AS c\n"
            + "       JOIN %1$s.instrument AS i ON c.inst_id = i.id\n"
            + "       JOIN %1$s.currency   AS b ON i.base    = b.id\n"
            + "       JOIN %1$s.currency   AS q ON i.quote   = q.id\n";

    private static final String INSTRUMENT_FILTER =
            "WHERE  i.ex_id = :ex\n"
            + "  AND  b.code = :b\n"
            + "  AND  q.code = :q\n"
            + "  AND  i.mkt = :m\n"
            + "  AND  c.interval = :iv\n";

    private static final RowMapper<Candle> CANDLE_MAPPER = (rs, rowNum) -> new Candle(
            toInstant(rs.getTimestamp("open_time")),
            rs.getDouble("open"),
            rs.getDouble("high"),
            rs.getDouble("low"),
            rs.getDouble("close"),
            rs.getDouble("volume"),
            rs.getDouble("quote_vol"),
            rs.getDouble("trades"),
            rs.getDouble("taker_base"),
            rs.getDouble("taker_quote"));

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final String database;
    private boolean debug;

    public JdbcCandleStore(DataSource dataSource, String database) {
        this(new NamedParameterJdbcTemplate(dataSource), database);
    }

    public JdbcCandleStore(NamedParameterJdbcTemplate jdbcTemplate, String database) {
        this.jdbcTemplate = jdbcTemplate;
        this.database = StoreDataSources.checkIdentifier(database);
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    @Override
    public List<Candle> fetchCandles(CandleQuery query) {
        MapSqlParameterSource params = instrumentParams(query);
        StringBuilder sql = new StringBuilder()
                .append("SELECT c.open_time,\n")
                .append("       c.open, c.high, c.low, c.close,\n")
                .append("       c.volume, c.quote_vol, c.trades,\n")
                .append("       c.taker_base, c.taker_quote\n")
                .append(String.format(FROM_JOINS, database))
                .append(INSTRUMENT_FILTER);
        if (query.getStart() != null) {
            params.addValue("ts0", Timestamp.from(query.getStart()));
            sql.append("  AND  c.open_time >= :ts0\n");
        }
        if (query.getEnd() != null) {
            params.addValue("ts1", Timestamp.from(query.getEnd()));
            sql.append("  AND  c.open_time <= :ts1\n");
        }
        sql.append("ORDER BY c.open_time");

        if (debug) {
            logger.info("SQL  : {}", sql);
            logger.info("PARAM: {}", params.getValues());
        }
        List<Candle> candles = jdbcTemplate.query(sql.toString(), params, CANDLE_MAPPER);
        logger.debug("{} candles for {}", candles.size(), query);
        return candles;
    }

    @Override
    public AvailableRange availableRange(CandleQuery query) {
        String sql = "SELECT min(c.open_time) AS min_time,\n"
                + "       max(c.open_time) AS max_time\n"
                + String.format(FROM_JOINS, database)
                + INSTRUMENT_FILTER;

        List<AvailableRange> ranges = jdbcTemplate.query(sql, instrumentParams(query), JdbcCandleStore::mapRange);
        AvailableRange range = ranges.isEmpty() ? AvailableRange.none() : ranges.get(0);
        logger.debug("Available range for {} {}: {}", query.getSymbol(), query.getInterval(), range);
        return range;
    }

    /**
     * ClickHouse answers min/max over no rows with the epoch instead of null.
     */
    private static AvailableRange mapRange(ResultSet rs, int rowNum) throws SQLException {
        Instant min = toInstant(rs.getTimestamp("min_time"));
        Instant max = toInstant(rs.getTimestamp("max_time"));
        if (Instant.EPOCH.equals(min) && Instant.EPOCH.equals(max)) {
            return AvailableRange.none();
        }
        return AvailableRange.of(min, max);
    }

    private MapSqlParameterSource instrumentParams(CandleQuery query) {
        return new MapSqlParameterSource()
                .addValue("ex", query.getExchangeId())
                .addValue("b", query.getPair().getBase())
                .addValue("q", query.getPair().getQuote())
                .addValue("m", query.getMarket().getCode())
                .addValue("iv", query.getInterval().getCode());
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
