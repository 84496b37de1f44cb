package com.herzen.curriculum.domain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class DomainModels {

    /** Raw heading as supplied by the extraction collaborator. Never mutated here. */
    public record TopicRecord(String title,
                              int hierarchyLevel,
                              String sourceId,
                              EducationalTier sourceEducationalTier,
                              String language) {}

    public enum EducationalTier {
        HS_FOUNDATIONS("HS-Found"),
        HS_ADVANCED("HS-Adv"),
        UG_INTRO("UG-Intro"),
        UG_ADVANCED("UG-Adv"),
        GRAD_INTRO("Grad-Intro"),
        GRAD_ADVANCED("Grad-Adv");

        private final String label;

        EducationalTier(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }

        public static EducationalTier fromHierarchyLevel(int hierarchyLevel) {
            EducationalTier[] tiers = values();
            int index = Math.max(1, Math.min(hierarchyLevel, tiers.length)) - 1;
            return tiers[index];
        }
    }

    public enum CognitiveLevel { UNDERSTAND, APPLY, ANALYZE, EVALUATE, CREATE }

    public enum QuestionType { COMPUTATIONAL, CONCEPTUAL, GRAPHICAL, EXPERIMENTAL }

    public enum VariantKind { FOUNDATIONAL, TEMPLATE, GENERIC, SPECIALIZED }

    /**
     * Records judged to denote the same concept. {@code notes} keeps the titles and sources
     * of the non-canonical members.
     */
    public record ConceptGroup(TopicRecord canonical, List<TopicRecord> members, List<String> notes) {
        public ConceptGroup {
            members = List.copyOf(members);
            notes = List.copyOf(notes);
        }

        public String title() {
            return canonical.title();
        }
    }

    public record Cluster(String id,
                          String label,
                          int hierarchyLevel,
                          EducationalTier tier,
                          int difficulty,
                          List<String> memberConcepts,
                          double expansionPotential,
                          Set<String> prerequisiteClusterIds,
                          Set<String> authoritySources) {
        public Cluster {
            memberConcepts = List.copyOf(memberConcepts);
            prerequisiteClusterIds = Collections.unmodifiableSet(new LinkedHashSet<>(prerequisiteClusterIds));
            authoritySources = Collections.unmodifiableSet(new LinkedHashSet<>(authoritySources));
        }

        public Cluster withPrerequisites(Set<String> prerequisites) {
            return new Cluster(id, label, hierarchyLevel, tier, difficulty, memberConcepts,
                    expansionPotential, prerequisites, authoritySources);
        }

        public Cluster withTier(EducationalTier effectiveTier) {
            return new Cluster(id, label, hierarchyLevel, effectiveTier, difficulty, memberConcepts,
                    expansionPotential, prerequisiteClusterIds, authoritySources);
        }
    }

    public record SubtopicRecord(String id,
                                 String clusterId,
                                 String title,
                                 String parentConcept,
                                 EducationalTier educationalTier,
                                 CognitiveLevel cognitiveLevel,
                                 VariantKind variantKind,
                                 List<String> prerequisites,
                                 List<QuestionType> questionTypes,
                                 List<String> learningObjectives,
                                 int sequenceIndex) {
        public SubtopicRecord {
            prerequisites = List.copyOf(prerequisites);
            questionTypes = List.copyOf(questionTypes);
            learningObjectives = List.copyOf(learningObjectives);
        }
    }
}
