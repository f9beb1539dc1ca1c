package com.algocoin.data.clients;

import com.algocoin.data.config.PipelineConfig;
import com.algocoin.data.metrics.MetricBatcher;
import com.algocoin.data.metrics.RemoteFetcher;
import com.algocoin.data.metrics.TimeRangeBatcher;
import com.algocoin.data.metrics.TimeSeriesCollector;

/**
 * Main entry point for the time-series providers.
 * Builds the provider clients and the collector from one configuration.
 */
public class TimeSeriesApiClient {

    private final PipelineConfig config;
    private ApiBase santimentBase;
    private ApiBase lunarCrushBase;

    public TimeSeriesApiClient(PipelineConfig config) {
        this.config = config;
    }

    /**
     * Santiment client for one asset slug, e.g. {@code bitcoin}.
     */
    public synchronized SantimentClient santiment(String slug) {
        if (santimentBase == null) {
            config.requireSantimentCredentials();
            santimentBase = newBase(config.getSantimentUrl(),
                    SantimentClient.authorization(config.getSantimentApiKey()));
        }
        return new SantimentClient(santimentBase, slug, config.getFrequency());
    }

    /**
     * LunarCrush client for one coin symbol, e.g. {@code BTC}.
     */
    public synchronized LunarCrushClient lunarCrush(String coin) {
        if (lunarCrushBase == null) {
            config.requireLunarCrushCredentials();
            lunarCrushBase = newBase(config.getLunarCrushUrl(),
                    LunarCrushClient.authorization(config.getLunarCrushApiKey()));
        }
        return new LunarCrushClient(lunarCrushBase, coin, config.getFrequency());
    }

    /**
     * Collector using the configured batch sizes, frequency and concurrency.
     */
    public TimeSeriesCollector collector(RemoteFetcher fetcher) {
        config.validate();
        return new TimeSeriesCollector(fetcher,
                new MetricBatcher(config.getMetricBatchSize()),
                new TimeRangeBatcher(config.getTimeBatchDuration()),
                config.getFrequency(),
                config.getMaxConcurrentBatches());
    }

    private ApiBase newBase(String url, String authorization) {
        ApiBase base = new ApiBase(url, authorization, config.getRequestsPerMinute(), config.getRequestTimeout());
        base.setDebugLevel(config.getDebugLevel());
        return base;
    }

    public PipelineConfig getConfig() {
        return config;
    }
}
