package com.herzen.curriculum.consistency;

import java.util.List;

public class ConsistencyModels {

    /** A non-fatal finding about the finished sequence. */
    public record ConsistencyIssue(String discipline, String code, List<String> subtopicIds, String message) {
        public ConsistencyIssue {
            subtopicIds = List.copyOf(subtopicIds);
        }
    }

    /**
     * @param prerequisiteSatisfaction share of prerequisite references that point to an earlier item
     * @param qualityScore overall ordering quality in [0,1]
     */
    public record ConsistencyReport(String discipline, List<ConsistencyIssue> issues,
                                    double prerequisiteSatisfaction, double qualityScore) {
        public ConsistencyReport {
            issues = List.copyOf(issues);
        }

        public boolean clean() {
            return issues.isEmpty();
        }

        public long count(String code) {
            return issues.stream().filter(i -> i.code().equals(code)).count();
        }
    }
}
