package com.algocoin.data.export;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Iterator;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.algocoin.data.metrics.SeriesPoint;
import com.algocoin.data.metrics.WideTable;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Writes and reads the JSON form of a {@link WideTable}: an object keyed by
 * {@code YYYY-MM-DDTHH:MM:SSZ} timestamps whose values map metric names to
 * numbers. Null cells are left out and {@code social_volume_*} counts are
 * written as integers.
 */
public class WideTableJsonExporter {

    private static final Logger logger = LoggerFactory.getLogger(WideTableJsonExporter.class);

    public static final String WINDOW_ID = "window_id";
    public static final String VOLUME_PREFIX = "social_volume_";

    static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;
    private final boolean includeWindowId;

    public WideTableJsonExporter() {
        this(true);
    }

    /**
     * @param includeWindowId number rows from 1 in a {@code window_id} field
     */
    public WideTableJsonExporter(boolean includeWindowId) {
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        this.includeWindowId = includeWindowId;
    }

    public ObjectNode toJson(WideTable table) {
        ObjectNode root = objectMapper.createObjectNode();
        long windowId = 1;
        for (Map.Entry<Instant, Map<String, Double>> row : table.getRows().entrySet()) {
            ObjectNode values = root.putObject(TIMESTAMP_FORMAT.format(row.getKey()));
            if (includeWindowId && !table.hasColumn(WINDOW_ID)) {
                values.put(WINDOW_ID, windowId);
            }
            for (Map.Entry<String, Double> cell : row.getValue().entrySet()) {
                Double value = cell.getValue();
                if (value == null) {
                    continue;
                }
                if (isInteger(cell.getKey())) {
                    values.put(cell.getKey(), Math.round(value));
                } else {
                    values.put(cell.getKey(), value);
                }
            }
            windowId++;
        }
        return root;
    }

    public String writeToString(WideTable table) throws IOException {
        return objectMapper.writeValueAsString(toJson(table));
    }

    public void write(WideTable table, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(path.toFile(), toJson(table));
        logger.info("💾 Saved {} rows to {}", table.rowCount(), path);
    }

    public WideTable read(Path path) throws IOException {
        WideTable table = fromJson(objectMapper.readTree(path.toFile()));
        logger.info("📂 Loaded {} rows from {}", table.rowCount(), path);
        return table;
    }

    public WideTable readFromString(String json) throws IOException {
        return fromJson(objectMapper.readTree(json));
    }

    /**
     * Entries whose key is not a timestamp are skipped.
     */
    WideTable fromJson(JsonNode root) {
        WideTable.Builder table = WideTable.builder();
        int skipped = 0;
        for (Iterator<Map.Entry<String, JsonNode>> it = root.fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> entry = it.next();
            Instant timestamp = parseTimestamp(entry.getKey());
            if (timestamp == null || !entry.getValue().isObject()) {
                skipped++;
                continue;
            }
            table.row(timestamp);
            for (Iterator<Map.Entry<String, JsonNode>> cells = entry.getValue().fields(); cells.hasNext();) {
                Map.Entry<String, JsonNode> cell = cells.next();
                JsonNode value = cell.getValue();
                Object raw = value.isNull() ? null : value.isNumber() ? (Object) value.doubleValue() : value.asText();
                table.value(timestamp, cell.getKey(), SeriesPoint.toDouble(raw));
            }
        }
        if (skipped > 0) {
            logger.warn("Skipped {} entries without a readable timestamp", skipped);
        }
        return table.build();
    }

    private static Instant parseTimestamp(String text) {
        try {
            return Instant.parse(text);
        } catch (RuntimeException e) {
            return null;
        }
    }

    private static boolean isInteger(String column) {
        return column.startsWith(VOLUME_PREFIX) || column.equals(WINDOW_ID);
    }
}
