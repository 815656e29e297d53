package com.researchintel.deepresearch.model;

import java.util.List;

/**
 * Key points and supporting quotes pulled from one fetched document.
 * {@code citationId} is null until the extract stage registers the source.
 */
public record ExtractedRecord(String url,
                              String title,
                              String citationId,
                              List<String> keyPoints,
                              List<String> quotes) {

    public ExtractedRecord withCitationId(String cid) {
        return new ExtractedRecord(url, title, cid, keyPoints, quotes);
    }
}
