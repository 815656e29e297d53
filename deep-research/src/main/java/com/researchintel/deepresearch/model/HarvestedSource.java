package com.researchintel.deepresearch.model;

public record HarvestedSource(String url, String title, double relevance) {
}
