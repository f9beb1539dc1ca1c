package com.algocoin.data.config;

import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.algocoin.data.metrics.Frequency;

public class PipelineConfigTest {

    @Test
    public void defaults() {
        PipelineConfig config = PipelineConfig.fromProperties(new Properties());

        assertEquals(10, config.getMetricBatchSize());
        assertEquals(Duration.ofDays(30), config.getTimeBatchDuration());
        assertEquals(Frequency.ofMinutes(5), config.getFrequency());
        assertFalse(config.isAutoClip());
        assertEquals(1, config.getMaxConcurrentBatches());
        assertEquals(60, config.getRequestsPerMinute());
        assertEquals(Duration.ofSeconds(60), config.getRequestTimeout());
        assertEquals(PipelineConfig.DEFAULT_SANTIMENT_URL, config.getSantimentUrl());
        assertEquals("crypto", config.getStoreDatabase());
        config.validate();
    }

    @Test
    public void overridesAreCopies() {
        PipelineConfig base = PipelineConfig.fromProperties(new Properties());
        PipelineConfig changed = base.with(PipelineConfig.FREQUENCY, "1h").with(PipelineConfig.AUTO_CLIP, null);

        assertEquals(Frequency.ofHours(1), changed.getFrequency());
        assertEquals(Frequency.ofMinutes(5), base.getFrequency());
        assertFalse(changed.isAutoClip());
    }

    @Test
    public void validationRejectsBadBatching() {
        Properties properties = new Properties();
        properties.setProperty(PipelineConfig.METRIC_BATCH_SIZE, "0");
        assertThrows(IllegalArgumentException.class, () -> PipelineConfig.fromProperties(properties).validate());

        Properties misaligned = new Properties();
        misaligned.setProperty(PipelineConfig.FREQUENCY, "7m");
        misaligned.setProperty(PipelineConfig.TIME_BATCH_DURATION, "1h");
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> PipelineConfig.fromProperties(misaligned).validate());
        assertTrue(error.getMessage().contains(PipelineConfig.TIME_BATCH_DURATION));
    }

    @Test
    public void missingCredentialsAreReported() {
        PipelineConfig config = PipelineConfig.fromProperties(new Properties());
        IllegalStateException error = assertThrows(IllegalStateException.class,
                config::requireSantimentCredentials);
        assertTrue(error.getMessage().contains(PipelineConfig.ENV_SANTIMENT_API_KEY));
        assertThrows(IllegalStateException.class, config::requireLunarCrushCredentials);
        assertThrows(IllegalStateException.class, config::requireStore);
    }

    @Test
    public void loadsFileThenSystemProperties(@TempDir Path dir) throws Exception {
        File file = dir.resolve("algocoin.properties").toFile();
        Files.writeString(file.toPath(), "timeBatchDuration=10d\nrequestsPerMinute=30\n");

        System.setProperty("algocoin.requestsPerMinute", "45");
        try {
            PipelineConfig config = PipelineConfig.load(file);
            assertEquals(Duration.ofDays(10), config.getTimeBatchDuration());
            assertEquals(45, config.getRequestsPerMinute());
        } finally {
            System.clearProperty("algocoin.requestsPerMinute");
        }
    }
}
