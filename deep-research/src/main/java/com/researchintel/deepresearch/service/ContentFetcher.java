package com.researchintel.deepresearch.service;

import com.researchintel.deepresearch.model.FetchedDocument;
import com.researchintel.deepresearch.model.HarvestedSource;

/**
 * Acquires the content of one source. Called concurrently from the worker pool, so
 * implementations must be thread-safe and must only return data.
 */
public interface ContentFetcher {

    FetchedDocument fetch(HarvestedSource source);
}
