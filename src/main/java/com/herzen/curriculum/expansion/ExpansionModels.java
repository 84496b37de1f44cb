package com.herzen.curriculum.expansion;

import com.herzen.curriculum.domain.DomainModels.SubtopicRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ExpansionModels {

    /**
     * @param quotas items allotted per cluster id before back-fill and trimming
     * @param backfilled specialized items added to reach the target
     * @param trimmed items dropped to stay within the target
     */
    public record ExpansionResult(List<SubtopicRecord> subtopics, Map<String, Integer> quotas,
                                  int backfilled, int trimmed) {
        public ExpansionResult {
            subtopics = List.copyOf(subtopics);
            quotas = Collections.unmodifiableMap(new LinkedHashMap<>(quotas));
        }
    }
}
