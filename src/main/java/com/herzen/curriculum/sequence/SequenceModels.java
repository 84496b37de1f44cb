package com.herzen.curriculum.sequence;

import com.herzen.curriculum.domain.DomainModels.Cluster;
import com.herzen.curriculum.domain.DomainModels.EducationalTier;

import java.util.List;

public class SequenceModels {

    /** A node to place: its tier bucket and its declared difficulty for fallback ordering. */
    public record SequenceNode(String id, EducationalTier tier, int difficulty) {}

    public record SequencingIssue(String code, EducationalTier tier, List<String> nodes, String message) {}

    public record SequencingResult(List<String> order, List<SequencingIssue> issues) {
        public SequencingResult {
            order = List.copyOf(order);
            issues = List.copyOf(issues);
        }
    }

    /** Clusters in final order, each carrying its effective tier. */
    public record ClusterSequence(List<Cluster> clusters, List<SequencingIssue> issues) {
        public ClusterSequence {
            clusters = List.copyOf(clusters);
            issues = List.copyOf(issues);
        }
    }
}
