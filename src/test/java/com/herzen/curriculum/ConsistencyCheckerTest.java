package com.herzen.curriculum;

import com.herzen.curriculum.config.DisciplineCatalog;
import com.herzen.curriculum.consistency.ConsistencyChecker;
import com.herzen.curriculum.consistency.ConsistencyModels.ConsistencyReport;
import com.herzen.curriculum.domain.DomainModels.CognitiveLevel;
import com.herzen.curriculum.domain.DomainModels.EducationalTier;
import com.herzen.curriculum.domain.DomainModels.QuestionType;
import com.herzen.curriculum.domain.DomainModels.SubtopicRecord;
import com.herzen.curriculum.domain.DomainModels.VariantKind;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ConsistencyCheckerTest {
    @Autowired
    private ConsistencyChecker checker;

    @Autowired
    private DisciplineCatalog catalog;

    @Test
    void cleanSequenceScoresFullQuality() {
        List<SubtopicRecord> sequence = List.of(
                item("s1", "Units and Measurement", EducationalTier.HS_FOUNDATIONS, List.of(), 0),
                item("s2", "Vectors", EducationalTier.HS_FOUNDATIONS, List.of("s1"), 1),
                item("s3", "Projectile Motion", EducationalTier.HS_ADVANCED, List.of("s2"), 2));

        ConsistencyReport report = checker.check("Physics", catalog.profile("Physics"), sequence);

        assertTrue(report.clean());
        assertEquals(1.0, report.prerequisiteSatisfaction());
        assertEquals(1.0, report.qualityScore());
    }

    @Test
    void reportsPrerequisitesThatAreMissingOrLater() {
        List<SubtopicRecord> sequence = List.of(
                item("s1", "Work", EducationalTier.UG_INTRO, List.of("s2"), 0),
                item("s2", "Power", EducationalTier.UG_INTRO, List.of("ghost"), 1));

        ConsistencyReport report = checker.check("Physics", catalog.profile("Physics"), sequence);

        assertEquals(2, report.count(ConsistencyChecker.PREREQUISITE_NOT_EARLIER));
        assertEquals(0.0, report.prerequisiteSatisfaction());
        assertTrue(report.qualityScore() < 1.0);
        assertEquals(List.of("s1", "s2"), report.issues().get(0).subtopicIds());
        assertEquals("Physics", report.issues().get(0).discipline());
    }

    @Test
    void reportsComplexityAndEraInversions() {
        List<SubtopicRecord> sequence = List.of(
                item("calc", "Calculus Basics", EducationalTier.UG_INTRO, List.of(), 0),
                item("alg", "Algebra Review", EducationalTier.UG_INTRO, List.of("calc"), 1),
                item("quantum", "Quantum Tunneling", EducationalTier.UG_INTRO, List.of(), 2),
                item("orbits", "Classical Orbits", EducationalTier.UG_INTRO, List.of("quantum"), 3));

        ConsistencyReport report = checker.check("Physics", catalog.profile("Physics"), sequence);

        assertEquals(1, report.count(ConsistencyChecker.COMPLEXITY_INVERSION));
        assertEquals(1, report.count(ConsistencyChecker.ERA_INVERSION));
        assertEquals(0, report.count(ConsistencyChecker.PREREQUISITE_NOT_EARLIER));
    }

    @Test
    void reportsTierRegressionInSequenceOrder() {
        List<SubtopicRecord> sequence = List.of(
                item("late", "Entropy", EducationalTier.UG_ADVANCED, List.of(), 1),
                item("early", "Temperature", EducationalTier.HS_ADVANCED, List.of(), 0),
                item("back", "Heat", EducationalTier.HS_FOUNDATIONS, List.of(), 2));

        ConsistencyReport report = checker.check("Physics", catalog.profile("Physics"), sequence);

        assertEquals(1, report.count(ConsistencyChecker.TIER_REGRESSION));
        assertEquals(List.of("late", "back"), report.issues().get(0).subtopicIds());
    }

    @Test
    void neverMutatesTheSequence() {
        List<SubtopicRecord> sequence = new ArrayList<>(List.of(
                item("b", "Second", EducationalTier.HS_ADVANCED, List.of("a"), 1),
                item("a", "First", EducationalTier.HS_ADVANCED, List.of(), 0)));
        List<SubtopicRecord> before = List.copyOf(sequence);

        checker.check("Physics", catalog.profile("Physics"), sequence);

        assertEquals(before, sequence);
    }

    private static SubtopicRecord item(String id, String title, EducationalTier tier, List<String> prerequisites, int index) {
        return new SubtopicRecord(id, "cluster", title, title, tier, CognitiveLevel.UNDERSTAND, VariantKind.FOUNDATIONAL,
                prerequisites, List.of(QuestionType.CONCEPTUAL), List.of("Explain the core ideas of " + title), index);
    }
}
