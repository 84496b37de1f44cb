package com.herzen.curriculum.expansion;

import com.herzen.curriculum.config.DisciplineProfile;
import com.herzen.curriculum.domain.DomainModels.Cluster;
import com.herzen.curriculum.domain.DomainModels.CognitiveLevel;
import com.herzen.curriculum.domain.DomainModels.QuestionType;
import com.herzen.curriculum.domain.DomainModels.SubtopicRecord;
import com.herzen.curriculum.domain.DomainModels.VariantKind;
import com.herzen.curriculum.domain.IdNamespace;
import com.herzen.curriculum.expansion.ExpansionModels.ExpansionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Turns ordered clusters into exactly {@code target} items. Quotas follow expansion potential;
 * each cluster's items stay in one contiguous block, so the cluster order fixed by the
 * sequencer carries over to the items. Item positions are assigned here and nowhere else.
 * <p>
 * Rounding excess is trimmed from the end of the largest cluster's block, so a trimmed item
 * is not necessarily one at the end of the sequence.
 */
@Component
public class QuotaExpander {
    private static final Logger log = LoggerFactory.getLogger(QuotaExpander.class);

    private static final List<String> SPECIALIZED_AREAS = List.of(
            "Research Methods",
            "Advanced Applications",
            "Interdisciplinary Connections",
            "Current Developments",
            "Computational Methods",
            "Experimental Techniques");

    private static final Map<QuestionType, List<String>> QUESTION_KEYWORDS = questionKeywords();

    private static final Map<CognitiveLevel, String> OBJECTIVES = objectives();

    public ExpansionResult expand(DisciplineProfile profile, List<Cluster> orderedClusters, int target) {
        return expand(profile, orderedClusters, target, new IdNamespace());
    }

    public ExpansionResult expand(DisciplineProfile profile, List<Cluster> orderedClusters, int target, IdNamespace ids) {
        if (target < 0) throw new IllegalArgumentException("target must not be negative: " + target);

        Map<String, Integer> quotas = quotas(orderedClusters, target);
        Map<String, List<Draft>> blocks = new LinkedHashMap<>();
        for (Cluster cluster : orderedClusters) {
            blocks.put(cluster.id(), generate(cluster, quotas.get(cluster.id()), profile));
        }

        int total = blocks.values().stream().mapToInt(List::size).sum();
        int backfilled = 0;
        if (total < target && !orderedClusters.isEmpty()) {
            backfilled = backfill(orderedClusters, blocks, target - total);
        }
        int trimmed = 0;
        if (total > target) {
            trimmed = trim(blocks, total - target);
        }

        Map<String, Cluster> byId = new HashMap<>();
        orderedClusters.forEach(c -> byId.put(c.id(), c));
        String disciplineSlug = IdNamespace.slug(profile.name());

        List<SubtopicRecord> items = new ArrayList<>(target);
        int sequenceIndex = 0;
        for (var block : blocks.entrySet()) {
            Cluster cluster = byId.get(block.getKey());
            String clusterSlug = IdNamespace.slug(cluster.label());
            for (Draft draft : block.getValue()) {
                String id = ids.unique(disciplineSlug + "_" + clusterSlug + "_" + IdNamespace.slug(draft.title()));
                CognitiveLevel level = cognitiveLevel(cluster.hierarchyLevel(), draft.variantIndex());
                items.add(new SubtopicRecord(id, cluster.id(), draft.title(), draft.concept(), cluster.tier(),
                        level, draft.kind(), List.of(), questionTypes(draft.title()),
                        learningObjectives(draft.title(), level), sequenceIndex++));
            }
        }

        if (items.size() != target) {
            log.warn("Expansion of {} produced {} items for a target of {}", profile.name(), items.size(), target);
        }
        log.info("Expanded {} clusters of {} into {} items ({} back-filled, {} trimmed)",
                orderedClusters.size(), profile.name(), items.size(), backfilled, trimmed);
        return new ExpansionResult(items, quotas, backfilled, trimmed);
    }

    /** Items allotted per cluster id, in cluster order. */
    public Map<String, Integer> quotas(List<Cluster> clusters, int target) {
        Map<String, Integer> quotas = new LinkedHashMap<>();
        if (clusters.isEmpty()) return quotas;

        double totalPotential = clusters.stream().mapToDouble(c -> Math.max(0.0, c.expansionPotential())).sum();
        if (totalPotential <= 0.0) {
            int base = target / clusters.size();
            int remainder = target % clusters.size();
            for (int i = 0; i < clusters.size(); i++) {
                quotas.put(clusters.get(i).id(), base + (i < remainder ? 1 : 0));
            }
            return quotas;
        }

        for (Cluster cluster : clusters) {
            int quota = (int) Math.round(target * Math.max(0.0, cluster.expansionPotential()) / totalPotential);
            if (!cluster.memberConcepts().isEmpty()) quota = Math.max(1, quota);
            quotas.put(cluster.id(), quota);
        }
        return quotas;
    }

    private List<Draft> generate(Cluster cluster, int quota, DisciplineProfile profile) {
        List<String> concepts = cluster.memberConcepts().isEmpty() ? List.of(cluster.label()) : cluster.memberConcepts();
        int base = quota / concepts.size();
        int remainder = quota % concepts.size();

        List<Draft> drafts = new ArrayList<>(quota);
        for (int c = 0; c < concepts.size(); c++) {
            String concept = concepts.get(c);
            int count = base + (c < remainder ? 1 : 0);
            for (int v = 0; v < count; v++) {
                drafts.add(variant(concept, v, profile.expansionSuffixes()));
            }
        }
        return drafts;
    }

    private Draft variant(String concept, int index, List<String> suffixes) {
        if (index < suffixes.size()) {
            return new Draft(concept, String.format(suffixes.get(index), concept),
                    index == 0 ? VariantKind.FOUNDATIONAL : VariantKind.TEMPLATE, index);
        }
        if (index == 0) {
            return new Draft(concept, concept, VariantKind.FOUNDATIONAL, 0);
        }
        int topic = index - suffixes.size() + 1;
        return new Draft(concept, concept + " - Advanced Topic " + topic, VariantKind.GENERIC, index);
    }

    private int backfill(List<Cluster> clusters, Map<String, List<Draft>> blocks, int shortfall) {
        List<Cluster> candidates = clusters.stream().filter(c -> !c.memberConcepts().isEmpty()).toList();
        if (candidates.isEmpty()) candidates = clusters;

        Map<String, Integer> specializedCount = new HashMap<>();
        for (int added = 0; added < shortfall; added++) {
            Cluster leastPopulated = candidates.get(0);
            for (Cluster candidate : candidates) {
                if (blocks.get(candidate.id()).size() < blocks.get(leastPopulated.id()).size()) {
                    leastPopulated = candidate;
                }
            }

            int k = specializedCount.merge(leastPopulated.id(), 1, Integer::sum) - 1;
            String title = SPECIALIZED_AREAS.get(k % SPECIALIZED_AREAS.size()) + " in " + leastPopulated.label();
            if (k >= SPECIALIZED_AREAS.size()) title += " " + (k / SPECIALIZED_AREAS.size() + 1);

            List<Draft> block = blocks.get(leastPopulated.id());
            String concept = leastPopulated.memberConcepts().isEmpty()
                    ? leastPopulated.label()
                    : leastPopulated.memberConcepts().get(0);
            block.add(new Draft(concept, title, VariantKind.SPECIALIZED, block.size()));
            log.debug("Back-filled '{}' into {}", title, leastPopulated.id());
        }
        return shortfall;
    }

    private int trim(Map<String, List<Draft>> blocks, int excess) {
        List<List<Draft>> ordered = new ArrayList<>(blocks.values());
        for (int removed = 0; removed < excess; removed++) {
            List<Draft> largest = null;
            for (List<Draft> block : ordered) {
                if (block.size() > 1 && (largest == null || block.size() >= largest.size())) largest = block;
            }
            if (largest == null) {
                // every block is down to its first item: drop trailing clusters instead
                for (int i = ordered.size() - 1; i >= 0; i--) {
                    if (!ordered.get(i).isEmpty()) {
                        largest = ordered.get(i);
                        break;
                    }
                }
            }
            if (largest == null) return removed;
            largest.remove(largest.size() - 1);
        }
        return excess;
    }

    static CognitiveLevel cognitiveLevel(int hierarchyLevel, int variantIndex) {
        int index = Math.min(Math.max(0, hierarchyLevel - 1) + (variantIndex % 2), CognitiveLevel.values().length - 1);
        return CognitiveLevel.values()[index];
    }

    static List<QuestionType> questionTypes(String title) {
        String lower = title.toLowerCase(Locale.ROOT);
        List<QuestionType> types = new ArrayList<>();
        for (var entry : QUESTION_KEYWORDS.entrySet()) {
            if (entry.getValue().stream().anyMatch(lower::contains)) types.add(entry.getKey());
        }
        return types.isEmpty() ? List.of(QuestionType.CONCEPTUAL) : types;
    }

    static List<String> learningObjectives(String title, CognitiveLevel level) {
        List<String> objectives = new ArrayList<>();
        for (CognitiveLevel l : CognitiveLevel.values()) {
            if (l.compareTo(level) > 0) break;
            objectives.add(String.format(OBJECTIVES.get(l), title));
        }
        return objectives.size() > 3 ? objectives.subList(objectives.size() - 3, objectives.size()) : objectives;
    }

    private static Map<QuestionType, List<String>> questionKeywords() {
        Map<QuestionType, List<String>> keywords = new EnumMap<>(QuestionType.class);
        keywords.put(QuestionType.COMPUTATIONAL, List.of("mathematical", "calculation", "computational",
                "problem-solving", "derivation", "quantitative", "equation"));
        keywords.put(QuestionType.CONCEPTUAL, List.of("principles", "concepts", "theoretical", "historical"));
        keywords.put(QuestionType.GRAPHICAL, List.of("graph", "diagram", "visual", "vector", "field", "wave"));
        keywords.put(QuestionType.EXPERIMENTAL, List.of("experiment", "laboratory", "measurement",
                "techniques", "spectroscopic", "observation"));
        return keywords;
    }

    private static Map<CognitiveLevel, String> objectives() {
        Map<CognitiveLevel, String> objectives = new EnumMap<>(CognitiveLevel.class);
        objectives.put(CognitiveLevel.UNDERSTAND, "Explain the core ideas of %s");
        objectives.put(CognitiveLevel.APPLY, "Apply %s to solve representative problems");
        objectives.put(CognitiveLevel.ANALYZE, "Analyze how %s connects to related concepts");
        objectives.put(CognitiveLevel.EVALUATE, "Evaluate models and evidence in %s");
        objectives.put(CognitiveLevel.CREATE, "Design an investigation or model involving %s");
        return objectives;
    }

    private record Draft(String concept, String title, VariantKind kind, int variantIndex) {}
}
