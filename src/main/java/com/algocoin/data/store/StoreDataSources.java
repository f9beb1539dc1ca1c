package com.algocoin.data.store;

import java.util.regex.Pattern;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import com.algocoin.data.config.PipelineConfig;
import com.google.common.base.Preconditions;

/**
 * Builds the JDBC data source of the candle and sentiment store.
 */
public final class StoreDataSources {

    private static final Logger logger = LoggerFactory.getLogger(StoreDataSources.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private StoreDataSources() {
    }

    public static DataSource fromConfig(PipelineConfig config) {
        config.requireStore();
        DriverManagerDataSource dataSource = new DriverManagerDataSource(config.getStoreUrl(),
                config.getStoreUser(), config.getStorePassword());
        logger.info("Store data source: {} (database {})", config.getStoreUrl(), config.getStoreDatabase());
        return dataSource;
    }

    /**
     * Database, table and column names are spliced into SQL text, so only
     * plain identifiers are accepted.
     */
    public static String checkIdentifier(String name) {
        Preconditions.checkArgument(name != null && IDENTIFIER.matcher(name).matches(),
                "Not a valid SQL identifier: %s", name);
        return name;
    }
}
