package com.herzen.curriculum.cluster;

import com.herzen.curriculum.config.CurriculumProperties;
import com.herzen.curriculum.config.DisciplineProfile;
import com.herzen.curriculum.domain.DomainModels.Cluster;
import com.herzen.curriculum.domain.DomainModels.ConceptGroup;
import com.herzen.curriculum.domain.DomainModels.EducationalTier;
import com.herzen.curriculum.domain.DomainModels.TopicRecord;
import com.herzen.curriculum.domain.IdNamespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Partitions concept groups by hierarchy level and then by content area. Clusters come out
 * in ascending level order, areas in profile order with the general area last; no
 * prerequisite relation is implied by that order.
 */
@Component
public class ClusterBuilder {
    private static final Logger log = LoggerFactory.getLogger(ClusterBuilder.class);

    private static final Map<Integer, Integer> LEVEL_MULTIPLIERS = Map.of(
            1, 2,
            2, 8,
            3, 12,
            4, 15,
            5, 8,
            6, 3);

    private final CurriculumProperties properties;

    public ClusterBuilder(CurriculumProperties properties) {
        this.properties = properties;
    }

    public List<Cluster> buildClusters(List<ConceptGroup> groups, DisciplineProfile profile) {
        Map<Integer, List<ConceptGroup>> byLevel = new TreeMap<>();
        for (ConceptGroup group : groups) {
            byLevel.computeIfAbsent(cappedLevel(group.canonical().hierarchyLevel()), k -> new ArrayList<>()).add(group);
        }

        String prefix = IdNamespace.slug(profile.name());
        List<Cluster> clusters = new ArrayList<>();
        int counter = 0;
        for (var levelEntry : byLevel.entrySet()) {
            int level = levelEntry.getKey();
            for (var area : groupByContentArea(levelEntry.getValue(), profile).entrySet()) {
                counter++;
                String id = String.format("%s-l%d-%03d", prefix, level, counter);
                clusters.add(toCluster(id, area.getKey(), level, area.getValue(), profile));
            }
        }

        log.info("Built {} clusters for {} from {} concept groups", clusters.size(), profile.name(), groups.size());
        return clusters;
    }

    public double expansionPotential(int memberCount, int level, DisciplineProfile profile) {
        return memberCount * LEVEL_MULTIPLIERS.getOrDefault(level, 5) * profile.disciplineFactor();
    }

    private Map<String, List<ConceptGroup>> groupByContentArea(List<ConceptGroup> groups, DisciplineProfile profile) {
        Map<String, List<ConceptGroup>> byArea = new LinkedHashMap<>();
        profile.contentAreas().keySet().forEach(area -> byArea.put(area, new ArrayList<>()));
        String general = profile.generalLabel();
        byArea.put(general, new ArrayList<>());

        for (ConceptGroup group : groups) {
            String title = group.title().toLowerCase(Locale.ROOT);
            String area = profile.contentAreas().entrySet().stream()
                    .filter(e -> e.getValue().stream().anyMatch(title::contains))
                    .map(Map.Entry::getKey)
                    .findFirst()
                    .orElse(general);
            byArea.get(area).add(group);
        }
        byArea.values().removeIf(List::isEmpty);
        return byArea;
    }

    private Cluster toCluster(String id, String label, int level, List<ConceptGroup> groups, DisciplineProfile profile) {
        List<String> concepts = groups.stream().map(g -> g.title().trim()).toList();
        List<TopicRecord> records = groups.stream().flatMap(g -> g.members().stream()).toList();

        List<EducationalTier> tiers = records.stream().map(TopicRecord::sourceEducationalTier).sorted().toList();
        EducationalTier tier = tiers.isEmpty()
                ? EducationalTier.fromHierarchyLevel(level)
                : tiers.get((tiers.size() - 1) / 2);

        int difficulty = Math.max(level, concepts.stream().mapToInt(profile::complexityOf).max().orElse(1));

        Set<String> sources = records.stream()
                .map(TopicRecord::sourceId)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        return new Cluster(id, label, level, tier, difficulty, concepts,
                expansionPotential(concepts.size(), level, profile), Set.of(), sources);
    }

    private int cappedLevel(int level) {
        return Math.max(1, Math.min(level, properties.getMaxHierarchyLevels()));
    }
}
