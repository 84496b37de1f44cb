package com.herzen.curriculum.consistency;

import com.herzen.curriculum.config.DisciplineProfile;
import com.herzen.curriculum.consistency.ConsistencyModels.ConsistencyIssue;
import com.herzen.curriculum.consistency.ConsistencyModels.ConsistencyReport;
import com.herzen.curriculum.domain.DomainModels.SubtopicRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Read-only audit of a finished sequence. Findings are reported, never fixed.
 */
@Component
public class ConsistencyChecker {
    private static final Logger log = LoggerFactory.getLogger(ConsistencyChecker.class);

    public static final String PREREQUISITE_NOT_EARLIER = "PREREQUISITE_NOT_EARLIER";
    public static final String COMPLEXITY_INVERSION = "COMPLEXITY_INVERSION";
    public static final String ERA_INVERSION = "ERA_INVERSION";
    public static final String TIER_REGRESSION = "TIER_REGRESSION";

    private static final double PENALTY_PER_ISSUE = 0.1;

    public ConsistencyReport check(String discipline, DisciplineProfile profile, List<SubtopicRecord> sequence) {
        List<SubtopicRecord> ordered = sequence.stream()
                .sorted(Comparator.comparingInt(SubtopicRecord::sequenceIndex))
                .toList();
        Map<String, SubtopicRecord> byId = new HashMap<>();
        ordered.forEach(s -> byId.put(s.id(), s));

        List<ConsistencyIssue> issues = new ArrayList<>();
        int references = 0;
        int satisfied = 0;

        for (SubtopicRecord item : ordered) {
            for (String prerequisiteId : item.prerequisites()) {
                references++;
                SubtopicRecord prerequisite = byId.get(prerequisiteId);
                if (prerequisite == null) {
                    issues.add(new ConsistencyIssue(discipline, PREREQUISITE_NOT_EARLIER, List.of(item.id(), prerequisiteId),
                            "Prerequisite " + prerequisiteId + " of " + item.id() + " is not in the sequence"));
                    continue;
                }
                if (prerequisite.sequenceIndex() >= item.sequenceIndex()) {
                    issues.add(new ConsistencyIssue(discipline, PREREQUISITE_NOT_EARLIER, List.of(item.id(), prerequisiteId),
                            String.format("Prerequisite %s (#%d) does not come before %s (#%d)",
                                    prerequisiteId, prerequisite.sequenceIndex(), item.id(), item.sequenceIndex())));
                } else {
                    satisfied++;
                }

                int requiredComplexity = profile.complexityOf(prerequisite.title());
                int ownComplexity = profile.complexityOf(item.title());
                if (requiredComplexity > ownComplexity) {
                    issues.add(new ConsistencyIssue(discipline, COMPLEXITY_INVERSION, List.of(item.id(), prerequisiteId),
                            String.format("Prerequisite '%s' (complexity %d) is harder than '%s' (complexity %d)",
                                    prerequisite.title(), requiredComplexity, item.title(), ownComplexity)));
                }

                int requiredEra = profile.eraOf(prerequisite.title());
                int ownEra = profile.eraOf(item.title());
                if (requiredEra > 0 && ownEra > 0 && requiredEra > ownEra) {
                    issues.add(new ConsistencyIssue(discipline, ERA_INVERSION, List.of(item.id(), prerequisiteId),
                            String.format("Prerequisite '%s' belongs to a later era than '%s'",
                                    prerequisite.title(), item.title())));
                }
            }
        }

        for (int i = 1; i < ordered.size(); i++) {
            SubtopicRecord previous = ordered.get(i - 1);
            SubtopicRecord current = ordered.get(i);
            if (current.educationalTier().compareTo(previous.educationalTier()) < 0) {
                issues.add(new ConsistencyIssue(discipline, TIER_REGRESSION, List.of(previous.id(), current.id()),
                        String.format("Tier drops from %s to %s at position %d",
                                previous.educationalTier().label(), current.educationalTier().label(),
                                current.sequenceIndex())));
            }
        }

        double satisfaction = references == 0 ? 1.0 : (double) satisfied / references;
        double penalty = Math.max(0.0, 1.0 - PENALTY_PER_ISSUE * issues.size());
        double quality = (satisfaction + penalty) / 2.0;

        if (!issues.isEmpty()) {
            log.warn("Consistency check of {} found {} issues (quality {})", discipline, issues.size(),
                    String.format(Locale.ROOT, "%.2f", quality));
        }
        return new ConsistencyReport(discipline, issues, satisfaction, quality);
    }
}
