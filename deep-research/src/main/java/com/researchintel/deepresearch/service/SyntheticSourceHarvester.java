package com.researchintel.deepresearch.service;

import com.researchintel.deepresearch.model.HarvestedSource;
import com.researchintel.deepresearch.model.Plan;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic placeholder sources, one per budget slot, cycling through the plan's queries.
 * Relevance starts at 0.9 and drops by 0.1 per rank, floored at zero.
 */
public class SyntheticSourceHarvester implements SourceHarvester {

    @Override
    public List<HarvestedSource> harvest(String topic, Plan plan, int budget) {
        List<String> queries = plan.queries().isEmpty() ? List.of(topic) : plan.queries();
        List<HarvestedSource> sources = new ArrayList<>(budget);

        for (int i = 0; i < budget; i++) {
            String query = queries.get(i % queries.size());
            double relevance = Math.max(0.0, Math.round((0.9 - i * 0.1) * 100) / 100.0);
            sources.add(new HarvestedSource(
                    "https://example.com/" + i,
                    "Source " + i + ": " + query,
                    relevance));
        }
        return sources;
    }
}
