package com.algocoin.data.metrics;

import java.util.List;

/**
 * One bulk query for a metric subset over a time subset against a remote
 * time-series provider. Implementations never throw for provider or
 * transport problems; they report them as a failed {@link FetchOutcome}.
 */
public interface RemoteFetcher {

    FetchOutcome fetch(List<String> metrics, TimeWindow window);
}
