package com.researchintel.deepresearch.model;

import java.util.List;

public record Plan(List<String> queries,
                   List<String> sourceCategories,
                   int estimatedSourceCount,
                   Depth depth) {
}
