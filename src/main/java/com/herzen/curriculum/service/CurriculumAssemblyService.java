package com.herzen.curriculum.service;

import com.herzen.curriculum.cluster.ClusterBuilder;
import com.herzen.curriculum.config.CurriculumProperties;
import com.herzen.curriculum.config.DisciplineCatalog;
import com.herzen.curriculum.config.DisciplineProfile;
import com.herzen.curriculum.consistency.ConsistencyChecker;
import com.herzen.curriculum.consistency.ConsistencyModels.ConsistencyReport;
import com.herzen.curriculum.dedup.ConceptDeduplicator;
import com.herzen.curriculum.dedup.DedupModels.DedupResult;
import com.herzen.curriculum.dedup.DedupModels.SkippedRecord;
import com.herzen.curriculum.domain.DomainModels.Cluster;
import com.herzen.curriculum.domain.DomainModels.SubtopicRecord;
import com.herzen.curriculum.domain.DomainModels.TopicRecord;
import com.herzen.curriculum.domain.IdNamespace;
import com.herzen.curriculum.expansion.ExpansionModels.ExpansionResult;
import com.herzen.curriculum.expansion.QuotaExpander;
import com.herzen.curriculum.graph.CycleResolver;
import com.herzen.curriculum.graph.DependencyGraphBuilder;
import com.herzen.curriculum.graph.GraphModels.ClusterGraph;
import com.herzen.curriculum.graph.GraphModels.CycleResolution;
import com.herzen.curriculum.graph.GraphModels.DependencyEdge;
import com.herzen.curriculum.graph.GraphModels.DependencyGraph;
import com.herzen.curriculum.graph.GraphModels.SubtopicGraph;
import com.herzen.curriculum.sequence.LevelAwareSequencer;
import com.herzen.curriculum.sequence.SequenceModels.ClusterSequence;
import com.herzen.curriculum.sequence.SequenceModels.SequencingIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Runs the whole assembly for one discipline: dedup, clustering, dependency graph, cycle
 * resolution, tiered sequencing, quota expansion and the final consistency audit.
 * Every call owns its own id namespace, so disciplines never share state.
 */
@Service
public class CurriculumAssemblyService {
    private static final Logger log = LoggerFactory.getLogger(CurriculumAssemblyService.class);

    private final CurriculumProperties properties;
    private final DisciplineCatalog catalog;
    private final ConceptDeduplicator deduplicator;
    private final ClusterBuilder clusterBuilder;
    private final DependencyGraphBuilder graphBuilder;
    private final CycleResolver cycleResolver;
    private final LevelAwareSequencer sequencer;
    private final QuotaExpander expander;
    private final ConsistencyChecker checker;

    public CurriculumAssemblyService(CurriculumProperties properties,
                                     DisciplineCatalog catalog,
                                     ConceptDeduplicator deduplicator,
                                     ClusterBuilder clusterBuilder,
                                     DependencyGraphBuilder graphBuilder,
                                     CycleResolver cycleResolver,
                                     LevelAwareSequencer sequencer,
                                     QuotaExpander expander,
                                     ConsistencyChecker checker) {
        this.properties = properties;
        this.catalog = catalog;
        this.deduplicator = deduplicator;
        this.clusterBuilder = clusterBuilder;
        this.graphBuilder = graphBuilder;
        this.cycleResolver = cycleResolver;
        this.sequencer = sequencer;
        this.expander = expander;
        this.checker = checker;
    }

    public AssemblyResult assemble(String discipline, List<TopicRecord> records) {
        return assemble(discipline, records, properties.targetFor(discipline));
    }

    public AssemblyResult assemble(String discipline, List<TopicRecord> records, int target) {
        DisciplineProfile profile = catalog.profile(discipline);
        if (records == null) throw new IllegalArgumentException("records must not be null");
        if (target < 0) throw new IllegalArgumentException("target must not be negative: " + target);

        log.info("Assembling {} from {} raw topic records, target {}", profile.name(), records.size(), target);

        DedupResult dedup = deduplicator.dedupe(records, profile);
        List<Cluster> clusters = clusterBuilder.buildClusters(dedup.groups(), profile);
        return assembleClusters(profile, clusters, dedup.skipped(), target);
    }

    /**
     * Assembles from clusters that were built elsewhere, for example with hand-declared
     * prerequisites. Declared prerequisite ids become explicit edges.
     */
    public AssemblyResult assembleClusters(String discipline, List<Cluster> clusters, int target) {
        if (target < 0) throw new IllegalArgumentException("target must not be negative: " + target);
        return assembleClusters(catalog.profile(discipline), clusters, List.of(), target);
    }

    /** Independent runs per discipline, in the map's iteration order. */
    public Map<String, AssemblyResult> assembleAll(Map<String, List<TopicRecord>> recordsByDiscipline) {
        Map<String, AssemblyResult> results = new LinkedHashMap<>();
        recordsByDiscipline.forEach((discipline, records) -> results.put(discipline, assemble(discipline, records)));
        return results;
    }

    private AssemblyResult assembleClusters(DisciplineProfile profile, List<Cluster> clusters,
                                            List<SkippedRecord> skipped, int target) {
        List<String> warnings = new ArrayList<>();
        skipped.forEach(s -> warnings.add(s.code() + ": " + s.message()));

        ClusterGraph built = graphBuilder.buildGraph(clusters, profile);
        CycleResolution clusterResolution = cycleResolver.resolveCycles(built.graph(), clusters.size());
        clusterResolution.forcedRemovals().forEach(e -> warnings.add("FORCED_EDGE_REMOVAL: " + e.key()));
        ClusterGraph clusterGraph = new ClusterGraph(clusterResolution.graph(),
                graphBuilder.withPrerequisitesFrom(clusterResolution.graph(), built.clusters()));

        ClusterSequence ordered = sequencer.sequenceClusters(clusterGraph);
        ordered.issues().forEach(i -> warnings.add(i.code() + ": " + i.message()));

        ExpansionResult expansion = expander.expand(profile, ordered.clusters(), target, new IdNamespace());
        SubtopicGraph linked = graphBuilder.linkSubtopics(expansion.subtopics(), clusterGraph.graph());
        CycleResolution itemResolution = cycleResolver.resolveCycles(linked.graph(), clusters.size());
        List<SubtopicRecord> curriculum = itemResolution.changed()
                ? dropRemovedPrerequisites(linked.subtopics(), itemResolution)
                : linked.subtopics();
        itemResolution.forcedRemovals().forEach(e -> warnings.add("FORCED_EDGE_REMOVAL: " + e.key()));

        ConsistencyReport report = checker.check(profile.name(), profile, curriculum);

        List<DependencyEdge> removed = new ArrayList<>(clusterResolution.removedEdges());
        removed.addAll(clusterResolution.forcedRemovals());
        removed.addAll(itemResolution.removedEdges());
        removed.addAll(itemResolution.forcedRemovals());

        log.info("Assembled {}: {} items from {} clusters, {} edges removed, {} findings",
                profile.name(), curriculum.size(), clusters.size(), removed.size(), report.issues().size());
        return new AssemblyResult(profile.name(), curriculum, ordered.clusters(), clusterGraph.graph(),
                itemResolution.graph(), expansion.quotas(), removed, ordered.issues(), warnings, report);
    }

    private List<SubtopicRecord> dropRemovedPrerequisites(List<SubtopicRecord> items, CycleResolution resolution) {
        DependencyGraph graph = resolution.graph();
        return items.stream()
                .map(s -> new SubtopicRecord(s.id(), s.clusterId(), s.title(), s.parentConcept(), s.educationalTier(),
                        s.cognitiveLevel(), s.variantKind(),
                        s.prerequisites().stream().filter(p -> graph.hasEdge(p, s.id())).toList(),
                        s.questionTypes(), s.learningObjectives(), s.sequenceIndex()))
                .toList();
    }

    /**
     * @param curriculum final items in sequence order
     * @param clusters clusters in sequence order, with effective tiers and resolved prerequisites
     * @param removedEdges every edge dropped while breaking cycles, forced removals included
     */
    public record AssemblyResult(String discipline,
                                 List<SubtopicRecord> curriculum,
                                 List<Cluster> clusters,
                                 DependencyGraph clusterGraph,
                                 DependencyGraph subtopicGraph,
                                 Map<String, Integer> quotas,
                                 List<DependencyEdge> removedEdges,
                                 List<SequencingIssue> sequencingIssues,
                                 List<String> warnings,
                                 ConsistencyReport consistency) {
    }
}
