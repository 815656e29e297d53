package com.researchintel.deepresearch.model;

import java.time.Instant;

public record FetchedDocument(String url, String title, String content, Instant fetchedAt) {
}
