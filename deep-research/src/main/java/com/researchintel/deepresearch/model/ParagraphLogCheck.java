package com.researchintel.deepresearch.model;

import java.util.List;

public record ParagraphLogCheck(boolean passed, List<String> errors) {
}
