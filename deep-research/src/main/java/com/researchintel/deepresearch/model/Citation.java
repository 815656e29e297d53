package com.researchintel.deepresearch.model;

import java.time.Instant;

/**
 * A registered source reference. {@code cid} is always {@code C} followed by three digits.
 */
public record Citation(String cid,
                       String url,
                       String title,
                       String locator,
                       Instant fetchedAt,
                       String quoteHash,
                       String localPath) {
}
