package com.herzen.curriculum;

import com.herzen.curriculum.cluster.ClusterBuilder;
import com.herzen.curriculum.config.DisciplineCatalog;
import com.herzen.curriculum.config.DisciplineProfile;
import com.herzen.curriculum.dedup.ConceptDeduplicator;
import com.herzen.curriculum.domain.DomainModels.Cluster;
import com.herzen.curriculum.domain.DomainModels.EducationalTier;
import com.herzen.curriculum.domain.DomainModels.TopicRecord;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ClusterBuilderTest {
    @Autowired
    private ClusterBuilder clusterBuilder;

    @Autowired
    private ConceptDeduplicator deduplicator;

    @Autowired
    private DisciplineCatalog catalog;

    @Test
    void partitionsByLevelThenContentArea() {
        DisciplineProfile physics = catalog.profile("Physics");
        List<TopicRecord> records = List.of(
                new TopicRecord("Quantum Tunneling", 3, "src", EducationalTier.UG_ADVANCED, "en"),
                new TopicRecord("Kinematics", 2, "src", EducationalTier.HS_FOUNDATIONS, "en"),
                new TopicRecord("Scientific Notation", 2, "src", EducationalTier.HS_FOUNDATIONS, "en"),
                new TopicRecord("Momentum", 2, "src", EducationalTier.UG_INTRO, "en"),
                new TopicRecord("Heat Transfer", 2, "src", EducationalTier.HS_ADVANCED, "en"));

        List<Cluster> clusters = clusterBuilder.buildClusters(deduplicator.dedupe(records, physics).groups(), physics);

        assertEquals(List.of("Mechanics", "Thermodynamics", "General Physics", "Modern Physics"),
                clusters.stream().map(Cluster::label).toList());
        assertEquals(List.of(2, 2, 2, 3), clusters.stream().map(Cluster::hierarchyLevel).toList());

        Cluster mechanics = clusters.get(0);
        assertEquals(List.of("Kinematics", "Momentum"), mechanics.memberConcepts());
        assertEquals(EducationalTier.HS_FOUNDATIONS, mechanics.tier());
        assertEquals(2 * 8 * 1.2, mechanics.expansionPotential(), 1e-9);
        assertTrue(mechanics.prerequisiteClusterIds().isEmpty());
        assertEquals(4, clusters.stream().map(Cluster::id).distinct().count());
    }

    @Test
    void capsHierarchyLevelAndKeepsPotentialPositive() {
        DisciplineProfile biology = catalog.profile("Biology");
        List<TopicRecord> records = List.of(
                new TopicRecord("Gene Regulation Networks", 9, "src", EducationalTier.GRAD_ADVANCED, "en"),
                new TopicRecord("Cell Membrane", 0, "src", EducationalTier.HS_FOUNDATIONS, "en"));

        List<Cluster> clusters = clusterBuilder.buildClusters(deduplicator.dedupe(records, biology).groups(), biology);

        assertEquals(2, clusters.size());
        assertEquals(1, clusters.get(0).hierarchyLevel());
        assertEquals("Cell Biology", clusters.get(0).label());
        assertEquals(6, clusters.get(1).hierarchyLevel());
        assertEquals("Genetics", clusters.get(1).label());
        assertTrue(clusters.stream().allMatch(c -> c.expansionPotential() > 0));
    }

    @Test
    void levelMultiplierPeaksMidHierarchy() {
        DisciplineProfile generic = catalog.profile("Economics");
        assertTrue(clusterBuilder.expansionPotential(1, 4, generic) > clusterBuilder.expansionPotential(1, 1, generic));
        assertTrue(clusterBuilder.expansionPotential(1, 4, generic) > clusterBuilder.expansionPotential(1, 6, generic));
        assertEquals(0.0, clusterBuilder.expansionPotential(0, 3, generic));
    }

    @Test
    void difficultyReflectsComplexityKeywords() {
        DisciplineProfile mathematics = catalog.profile("Mathematics");
        List<TopicRecord> records = List.of(
                new TopicRecord("Differential Equations", 1, "src", EducationalTier.UG_ADVANCED, "en"));

        Cluster cluster = clusterBuilder.buildClusters(deduplicator.dedupe(records, mathematics).groups(), mathematics).get(0);

        assertEquals(5, cluster.difficulty());
        assertEquals(EducationalTier.UG_ADVANCED, cluster.tier());
    }
}
