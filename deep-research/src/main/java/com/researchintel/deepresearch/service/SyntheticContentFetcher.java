package com.researchintel.deepresearch.service;

import com.researchintel.deepresearch.model.FetchedDocument;
import com.researchintel.deepresearch.model.HarvestedSource;
import lombok.RequiredArgsConstructor;

import java.time.Clock;

/**
 * Offline fetcher returning a short generated document per source.
 */
@RequiredArgsConstructor
public class SyntheticContentFetcher implements ContentFetcher {

    private final Clock clock;

    @Override
    public FetchedDocument fetch(HarvestedSource source) {
        String content = source.title() + " summarises findings relevant to the research question. "
                + "The material at " + source.url() + " was acquired for analysis. "
                + "Further detail is available in the original document.";
        return new FetchedDocument(source.url(), source.title(), content, clock.instant());
    }
}
