package com.herzen.curriculum;

import com.herzen.curriculum.config.CurriculumProperties;
import com.herzen.curriculum.config.DisciplineCatalog;
import com.herzen.curriculum.config.DisciplineProfile;
import com.herzen.curriculum.domain.IdNamespace;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class CurriculumConfigurationTest {
    @Autowired
    private CurriculumProperties properties;

    @Autowired
    private DisciplineCatalog catalog;

    @Test
    void bindsDefaultsAndOverridesFromApplicationYaml() {
        assertEquals(1000, properties.getTargetSubtopics());
        assertEquals(0.8, properties.getSimilarityThreshold());
        assertEquals(6, properties.getMaxHierarchyLevels());
        assertEquals(3, properties.getCycleIterationFactor());
        assertEquals(800, properties.targetFor("PSYCHOLOGY"));
        assertEquals(1000, properties.targetFor("Physics"));
        assertTrue(properties.getAuthoritativeSources().contains("openstax"));
    }

    @Test
    void looksUpProfilesCaseInsensitively() {
        DisciplineProfile physics = catalog.profile("  physics ");

        assertEquals("Physics", physics.name());
        assertEquals(1.2, physics.disciplineFactor());
        assertEquals("General Physics", physics.generalLabel());
        assertTrue(physics.usesStandardTerminology("Newton's Second Law"));
        assertEquals(4, physics.eraOf("Quantum Theory"));
        assertEquals(0, physics.eraOf("Friction"));
        assertEquals(List.of("Physics", "Chemistry", "Biology", "Psychology", "Mathematics"), catalog.knownDisciplines());
    }

    @Test
    void unknownDisciplinesGetGenericProfile() {
        DisciplineProfile geology = catalog.profile("Geology");

        assertEquals("Geology", geology.name());
        assertEquals(1.0, geology.disciplineFactor());
        assertTrue(geology.contentAreas().isEmpty());
        assertFalse(geology.expansionSuffixes().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> catalog.profile(null));
    }

    @Test
    void idNamespaceSuffixesRepeats() {
        IdNamespace ids = new IdNamespace();

        assertEquals("newtons_laws", IdNamespace.slug("Newton's  Laws!"));
        assertEquals("untitled", IdNamespace.slug("???"));
        assertEquals("x", ids.unique("x"));
        assertEquals("x-2", ids.unique("x"));
        assertEquals("x-3", ids.unique("x"));
    }
}
