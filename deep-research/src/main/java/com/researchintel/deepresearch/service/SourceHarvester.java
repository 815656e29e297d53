package com.researchintel.deepresearch.service;

import com.researchintel.deepresearch.model.HarvestedSource;
import com.researchintel.deepresearch.model.Plan;

import java.util.List;

/**
 * Produces candidate sources for a planned topic, most relevant first.
 */
public interface SourceHarvester {

    List<HarvestedSource> harvest(String topic, Plan plan, int budget);
}
