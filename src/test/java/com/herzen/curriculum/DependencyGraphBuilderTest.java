package com.herzen.curriculum;

import com.herzen.curriculum.config.DisciplineCatalog;
import com.herzen.curriculum.domain.DomainModels.Cluster;
import com.herzen.curriculum.domain.DomainModels.CognitiveLevel;
import com.herzen.curriculum.domain.DomainModels.EducationalTier;
import com.herzen.curriculum.domain.DomainModels.QuestionType;
import com.herzen.curriculum.domain.DomainModels.SubtopicRecord;
import com.herzen.curriculum.domain.DomainModels.VariantKind;
import com.herzen.curriculum.graph.DependencyGraphBuilder;
import com.herzen.curriculum.graph.GraphModels.ClusterGraph;
import com.herzen.curriculum.graph.GraphModels.DependencyEdge;
import com.herzen.curriculum.graph.GraphModels.DependencyGraph;
import com.herzen.curriculum.graph.GraphModels.EdgeProvenance;
import com.herzen.curriculum.graph.GraphModels.SubtopicGraph;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class DependencyGraphBuilderTest {
    @Autowired
    private DependencyGraphBuilder graphBuilder;

    @Autowired
    private DisciplineCatalog catalog;

    @Test
    void addsAreaPrerequisitesAsExplicitEdges() {
        Cluster mechanics = cluster("mech", "Mechanics", 1, List.of("Kinematics", "Vectors"));
        Cluster electromagnetism = cluster("em", "Electromagnetism", 2, List.of("Electromagnetism", "Electric Fields"));
        Cluster modern = cluster("modern", "Modern Physics", 3, List.of("Quantum Mechanics"));

        ClusterGraph result = graphBuilder.buildGraph(List.of(mechanics, electromagnetism, modern), catalog.profile("Physics"));
        DependencyGraph graph = result.graph();

        assertEquals(2, graph.edges().size());
        assertTrue(graph.hasEdge("mech", "em"));
        assertTrue(graph.hasEdge("em", "modern"));
        assertTrue(graph.edges().stream().allMatch(e -> e.provenance() == EdgeProvenance.EXPLICIT && e.strength() == 1.0));
        assertEquals(Set.of("mech"), result.clusters().get(1).prerequisiteClusterIds());
        assertEquals(Set.of("em"), result.clusters().get(2).prerequisiteClusterIds());
    }

    @Test
    void declaredPrerequisitesWinOverPatterns() {
        Cluster kinematics = cluster("kin", "Kinematics", 2, List.of("Kinematics"));
        Cluster dynamics = cluster("dyn", "Dynamics", 2, List.of("Dynamics")).withPrerequisites(Set.of("kin"));

        DependencyGraph graph = graphBuilder.buildGraph(List.of(kinematics, dynamics), catalog.profile("Physics")).graph();

        assertEquals(1, graph.edges().size());
        DependencyEdge edge = graph.edges().get(0);
        assertEquals("kin", edge.prerequisite());
        assertEquals(EdgeProvenance.EXPLICIT, edge.provenance());
    }

    @Test
    void patternEdgesWhenNothingIsDeclared() {
        Cluster kinematics = cluster("kin", "Kinematics", 2, List.of("Kinematics"));
        Cluster dynamics = cluster("dyn", "Dynamics", 2, List.of("Rotational Dynamics"));

        DependencyGraph graph = graphBuilder.buildGraph(List.of(dynamics, kinematics), catalog.profile("Physics")).graph();

        assertEquals(1, graph.edges().size());
        assertEquals(EdgeProvenance.PATTERN_DERIVED, graph.edges().get(0).provenance());
        assertEquals(0.8, graph.edges().get(0).strength());
        assertTrue(graph.hasEdge("kin", "dyn"));
    }

    @Test
    void clusterLabelCountsForPatternMatching() {
        Cluster general = cluster("gen", "General Physics", 1, List.of("Simple Oscillation"));
        Cluster waves = cluster("waves", "Waves", 2, List.of("Standing Patterns"));

        DependencyGraph graph = graphBuilder.buildGraph(List.of(waves, general), catalog.profile("Physics")).graph();

        assertEquals(1, graph.edges().size());
        assertTrue(graph.hasEdge("gen", "waves"));
        assertEquals(EdgeProvenance.PATTERN_DERIVED, graph.edges().get(0).provenance());
    }

    @Test
    void progressionLaddersApplyToAnyDiscipline() {
        Cluster algebra = cluster("alg", "General Economics", 1, List.of("Algebra Review"));
        Cluster calculus = cluster("calc", "General Economics", 2, List.of("Calculus for Economists"));

        DependencyGraph graph = graphBuilder.buildGraph(List.of(algebra, calculus), catalog.profile("Economics")).graph();

        assertEquals(1, graph.edges().size());
        assertTrue(graph.hasEdge("alg", "calc"));
    }

    @Test
    void levelAloneNeverAddsAnEdge() {
        Cluster supply = cluster("supply", "General Economics", 1, List.of("Supply"));
        Cluster demand = cluster("demand", "General Economics", 4, List.of("Demand"));

        DependencyGraph graph = graphBuilder.buildGraph(List.of(supply, demand), catalog.profile("Economics")).graph();

        assertTrue(graph.edges().isEmpty());
    }

    @Test
    void patternsNeverPointFromDeeperLevels() {
        Cluster calculus = cluster("calc", "General Economics", 2, List.of("Calculus"));
        Cluster algebra = cluster("alg", "General Economics", 3, List.of("Algebra"));

        DependencyGraph graph = graphBuilder.buildGraph(List.of(calculus, algebra), catalog.profile("Economics")).graph();

        assertFalse(graph.hasEdge("alg", "calc"));
        assertFalse(graph.hasEdge("calc", "alg"));
    }

    @Test
    void ignoresUnknownAndSelfPrerequisites() {
        Cluster lonely = cluster("lonely", "Mechanics", 1, List.of("Force")).withPrerequisites(Set.of("lonely", "missing"));

        DependencyGraph graph = graphBuilder.buildGraph(List.of(lonely), catalog.profile("Physics")).graph();

        assertTrue(graph.edges().isEmpty());
    }

    @Test
    void linksFoundationalItemsToPrerequisiteClustersOnly() {
        DependencyGraph clusters = new DependencyGraph(Set.of("a", "b"),
                List.of(new DependencyEdge("a", "b", 1.0, EdgeProvenance.EXPLICIT, 0)));
        List<SubtopicRecord> items = List.of(
                item("a1", "a", "Alpha", VariantKind.FOUNDATIONAL, 0),
                item("a2", "a", "Alpha", VariantKind.TEMPLATE, 1),
                item("b1", "b", "Beta", VariantKind.FOUNDATIONAL, 2),
                item("b2", "b", "Beta", VariantKind.TEMPLATE, 3),
                item("b3", "b", "Gamma", VariantKind.FOUNDATIONAL, 4),
                item("b4", "b", "Beta", VariantKind.SPECIALIZED, 5));

        SubtopicGraph linked = graphBuilder.linkSubtopics(items, clusters);

        assertEquals(List.of(), linked.subtopics().get(0).prerequisites());
        assertEquals(List.of("a1"), linked.subtopics().get(1).prerequisites());
        assertEquals(List.of("a1"), linked.subtopics().get(2).prerequisites());
        assertEquals(List.of("b1"), linked.subtopics().get(3).prerequisites());
        assertEquals(List.of("a1"), linked.subtopics().get(4).prerequisites());
        assertEquals(List.of("b1"), linked.subtopics().get(5).prerequisites());
        assertEquals(5, linked.graph().edges().size());
        assertEquals(List.of(0, 1, 2, 3, 4, 5), linked.subtopics().stream().map(SubtopicRecord::sequenceIndex).toList());
    }

    @Test
    void graphRejectsSelfLoopsAndDanglingEdges() {
        assertThrows(IllegalArgumentException.class,
                () -> new DependencyEdge("a", "a", 1.0, EdgeProvenance.EXPLICIT, 0));
        assertThrows(IllegalArgumentException.class,
                () -> new DependencyEdge("a", "b", 0.0, EdgeProvenance.EXPLICIT, 0));
        assertThrows(IllegalArgumentException.class,
                () -> new DependencyGraph(Set.of("a"), List.of(new DependencyEdge("a", "b", 1.0, EdgeProvenance.EXPLICIT, 0))));
    }

    static Cluster cluster(String id, String label, int level, List<String> concepts) {
        return new Cluster(id, label, level, EducationalTier.fromHierarchyLevel(level), level, concepts,
                concepts.size() * 8.0, Set.of(), Set.of());
    }

    private static SubtopicRecord item(String id, String clusterId, String concept, VariantKind kind, int index) {
        return new SubtopicRecord(id, clusterId, concept + " " + kind, concept, EducationalTier.UG_INTRO,
                CognitiveLevel.UNDERSTAND, kind, List.of(), List.of(QuestionType.CONCEPTUAL), List.of(), index);
    }
}
