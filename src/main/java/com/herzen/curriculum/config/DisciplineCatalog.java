package com.herzen.curriculum.config;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Built-in discipline profiles. Any discipline without a dedicated profile gets a generic one
 * with a single "General" content area and the shared templates.
 */
@Component
public class DisciplineCatalog {
    private static final List<String> COMMON_PREFIXES = List.of(
            "introduction to", "principles of", "fundamentals of", "overview of", "elements of");

    private static final List<List<String>> PROGRESSION_LADDERS = List.of(
            List.of("arithmetic", "algebra", "calculus"),
            List.of("geometry", "trigonometry"),
            List.of("basic", "advanced"),
            List.of("introduction", "intermediate", "advanced"));

    private static final List<String> BASE_SUFFIXES = List.of(
            "Fundamental Principles of %s",
            "Mathematical Framework for %s",
            "Experimental Methods in %s",
            "Applications of %s",
            "Advanced Concepts in %s",
            "Problem-Solving Strategies for %s",
            "Real-World Examples of %s",
            "Historical Development of %s",
            "Current Research in %s",
            "Interdisciplinary Connections of %s");

    private static final Map<String, Integer> MATH_COMPLEXITY = orderedInts(
            "arithmetic", 1,
            "algebra", 2,
            "geometry", 2,
            "trigonometry", 3,
            "statistics", 3,
            "calculus", 4,
            "linear algebra", 4,
            "differential equations", 5);

    private final Map<String, DisciplineProfile> profiles = new LinkedHashMap<>();

    public DisciplineCatalog() {
        register(physics());
        register(chemistry());
        register(biology());
        register(psychology());
        register(mathematics());
    }

    public DisciplineProfile profile(String discipline) {
        if (discipline == null || discipline.isBlank()) {
            throw new IllegalArgumentException("discipline must not be blank");
        }
        DisciplineProfile known = profiles.get(discipline.trim().toLowerCase(Locale.ROOT));
        return known != null ? known : generic(discipline.trim());
    }

    public List<String> knownDisciplines() {
        return profiles.values().stream().map(DisciplineProfile::name).toList();
    }

    private void register(DisciplineProfile profile) {
        profiles.put(profile.name().toLowerCase(Locale.ROOT), profile);
    }

    private DisciplineProfile physics() {
        Map<String, List<String>> areas = new LinkedHashMap<>();
        areas.put("Mechanics", List.of("force", "motion", "energy", "momentum", "mechanics", "dynamics", "kinematics", "newton"));
        areas.put("Thermodynamics", List.of("heat", "temperature", "entropy", "thermodynamics", "thermal"));
        areas.put("Electromagnetism", List.of("electric", "magnetic", "electromagnetic", "charge", "field", "current"));
        areas.put("Waves", List.of("wave", "oscillation", "vibration", "sound", "frequency"));
        areas.put("Optics", List.of("light", "lens", "mirror", "optics", "refraction", "reflection"));
        areas.put("Modern Physics", List.of("quantum", "relativity", "atomic", "nuclear", "particle", "modern"));

        Map<String, List<String>> patterns = new LinkedHashMap<>();
        patterns.put("calculus", List.of("algebra", "trigonometry"));
        patterns.put("dynamics", List.of("kinematics", "vectors"));
        patterns.put("electromagnetism", List.of("vectors", "calculus"));
        patterns.put("waves", List.of("oscillation"));
        patterns.put("quantum", List.of("classical mechanics", "waves", "linear algebra", "probability"));

        Map<String, List<String>> explicit = new LinkedHashMap<>();
        explicit.put("Thermodynamics", List.of("Mechanics"));
        explicit.put("Electromagnetism", List.of("Mechanics"));
        explicit.put("Waves", List.of("Mechanics"));
        explicit.put("Optics", List.of("Waves"));
        explicit.put("Modern Physics", List.of("Electromagnetism", "Waves"));

        Map<String, Integer> eras = orderedInts(
                "classical", 1,
                "newtonian", 1,
                "thermodynamic", 2,
                "electromagnetic", 3,
                "quantum", 4,
                "relativistic", 4,
                "relativity", 4,
                "modern", 4);

        return new DisciplineProfile("Physics", 1.2,
                List.of("energy", "force", "momentum", "acceleration", "velocity",
                        "newton's", "ohm's law", "hooke's law", "coulomb's law", "kepler's"),
                COMMON_PREFIXES, areas, patterns, PROGRESSION_LADDERS, explicit,
                suffixes("Mathematical Derivations in %s", "Laboratory Measurements of %s",
                        "Theoretical Models of %s", "Computational Methods for %s"),
                MATH_COMPLEXITY, eras);
    }

    private DisciplineProfile chemistry() {
        Map<String, List<String>> areas = new LinkedHashMap<>();
        areas.put("Atomic Structure", List.of("atom", "electron", "nucleus", "orbital", "periodic"));
        areas.put("Bonding", List.of("bond", "molecular", "ionic", "covalent", "intermolecular"));
        areas.put("Stoichiometry", List.of("stoichiometry", "mole", "reaction yield", "limiting reagent"));
        areas.put("Thermodynamics", List.of("enthalpy", "entropy", "gibbs", "thermodynamics", "thermochemistry"));
        areas.put("Kinetics", List.of("reaction rate", "rate law", "kinetics", "mechanism", "catalyst", "activation"));
        areas.put("Equilibrium", List.of("equilibrium", "le chatelier"));
        areas.put("Acids and Bases", List.of("acid", "base", "ph scale", "buffer", "titration"));
        areas.put("Organic Chemistry", List.of("organic", "hydrocarbon", "functional group", "polymer"));
        areas.put("Analytical Chemistry", List.of("analysis", "spectroscopy", "chromatography", "analytical"));

        Map<String, List<String>> patterns = new LinkedHashMap<>();
        patterns.put("bonding", List.of("atomic structure", "periodic"));
        patterns.put("organic chemistry", List.of("general chemistry", "bonding"));
        patterns.put("physical chemistry", List.of("thermodynamics", "calculus"));
        patterns.put("equilibrium", List.of("kinetics"));
        patterns.put("kinetics", List.of("reaction rate"));

        Map<String, List<String>> explicit = new LinkedHashMap<>();
        explicit.put("Bonding", List.of("Atomic Structure"));
        explicit.put("Stoichiometry", List.of("Atomic Structure"));
        explicit.put("Equilibrium", List.of("Kinetics"));
        explicit.put("Acids and Bases", List.of("Equilibrium"));
        explicit.put("Organic Chemistry", List.of("Bonding"));

        Map<String, Integer> complexity = new LinkedHashMap<>(MATH_COMPLEXITY);
        complexity.put("stoichiometry", 2);
        complexity.put("quantum", 5);

        return new DisciplineProfile("Chemistry", 1.1,
                List.of("molecule", "atom", "reaction", "bond", "element", "stoichiometry", "le chatelier's"),
                withPrefixes("basic", "general", "inorganic"), areas, patterns, PROGRESSION_LADDERS, explicit,
                suffixes("Molecular Basis of %s", "Thermodynamics of %s",
                        "Kinetics of %s", "Spectroscopic Analysis of %s"),
                complexity, Map.of());
    }

    private DisciplineProfile biology() {
        Map<String, List<String>> areas = new LinkedHashMap<>();
        areas.put("Cell Biology", List.of("cell", "membrane", "organelle", "cytoplasm"));
        areas.put("Genetics", List.of("gene", "dna", "rna", "chromosome", "heredity", "mutation"));
        areas.put("Evolution", List.of("evolution", "natural selection", "adaptation", "species", "darwin"));
        areas.put("Ecology", List.of("ecosystem", "population", "community", "environment", "ecology"));
        areas.put("Physiology", List.of("organ", "homeostasis", "physiology", "anatomy"));
        areas.put("Biochemistry", List.of("enzyme", "protein", "metabolism", "biochemical", "pathway"));
        areas.put("Molecular Biology", List.of("molecular", "transcription", "translation", "replication"));

        Map<String, List<String>> patterns = new LinkedHashMap<>();
        patterns.put("genetics", List.of("cell", "molecular"));
        patterns.put("evolution", List.of("genetics", "heredity"));
        patterns.put("physiology", List.of("anatomy", "cell"));
        patterns.put("molecular biology", List.of("biochemistry", "cell"));

        Map<String, List<String>> explicit = new LinkedHashMap<>();
        explicit.put("Molecular Biology", List.of("Cell Biology", "Biochemistry"));
        explicit.put("Genetics", List.of("Cell Biology", "Molecular Biology"));
        explicit.put("Evolution", List.of("Genetics"));
        explicit.put("Ecology", List.of("Evolution"));

        Map<String, Integer> complexity = new LinkedHashMap<>(MATH_COMPLEXITY);
        complexity.put("biostatistics", 3);

        return new DisciplineProfile("Biology", 1.3,
                List.of("cell", "organism", "gene", "protein", "evolution", "mendel's", "darwin's"),
                withPrefixes("general"), areas, patterns, PROGRESSION_LADDERS, explicit,
                suffixes("Molecular Mechanisms of %s", "Cellular Basis of %s",
                        "Evolutionary Aspects of %s", "Ecological Role of %s"),
                complexity, Map.of());
    }

    private DisciplineProfile psychology() {
        Map<String, List<String>> areas = new LinkedHashMap<>();
        areas.put("Research Methods", List.of("research", "statistics", "experiment", "methodology", "data"));
        areas.put("Biological Psychology", List.of("brain", "neuron", "nervous system", "biological", "neuropsychology"));
        areas.put("Cognitive Psychology", List.of("cognition", "memory", "learning", "thinking", "perception"));
        areas.put("Developmental Psychology", List.of("development", "child", "adolescent", "aging", "lifespan"));
        areas.put("Social Psychology", List.of("social", "group", "attitude", "prejudice", "conformity"));
        areas.put("Abnormal Psychology", List.of("abnormal", "disorder", "mental health", "psychopathology"));

        Map<String, List<String>> patterns = new LinkedHashMap<>();
        patterns.put("cognitive", List.of("perception", "research"));
        patterns.put("abnormal", List.of("biological", "development"));

        Map<String, List<String>> explicit = new LinkedHashMap<>();
        explicit.put("Cognitive Psychology", List.of("Research Methods"));
        explicit.put("Abnormal Psychology", List.of("Biological Psychology"));

        return new DisciplineProfile("Psychology", 1.0,
                List.of("cognition", "behavior", "perception", "memory", "conditioning"),
                COMMON_PREFIXES, areas, patterns, PROGRESSION_LADDERS, explicit,
                suffixes(), MATH_COMPLEXITY, Map.of());
    }

    private DisciplineProfile mathematics() {
        Map<String, List<String>> areas = new LinkedHashMap<>();
        areas.put("Arithmetic", List.of("arithmetic", "fraction", "number"));
        areas.put("Algebra", List.of("algebra", "equation", "polynomial", "inequality"));
        areas.put("Geometry", List.of("geometry", "triangle", "circle", "angle", "trigonometry"));
        areas.put("Calculus", List.of("calculus", "derivative", "integral", "limit", "series"));
        areas.put("Statistics", List.of("statistics", "probability", "distribution", "regression"));

        Map<String, List<String>> patterns = new LinkedHashMap<>();
        patterns.put("calculus", List.of("algebra", "function"));
        patterns.put("differential equations", List.of("calculus"));
        patterns.put("statistics", List.of("probability"));

        Map<String, List<String>> explicit = new LinkedHashMap<>();
        explicit.put("Algebra", List.of("Arithmetic"));
        explicit.put("Calculus", List.of("Algebra", "Geometry"));
        explicit.put("Statistics", List.of("Algebra"));

        return new DisciplineProfile("Mathematics", 1.1,
                List.of("function", "equation", "theorem", "proof", "derivative", "integral"),
                withPrefixes("basic", "elementary", "intermediate", "advanced"), areas, patterns,
                PROGRESSION_LADDERS, explicit, suffixes("Proof Techniques for %s", "Worked Exercises in %s"),
                MATH_COMPLEXITY, Map.of());
    }

    private DisciplineProfile generic(String name) {
        return new DisciplineProfile(name, 1.0, List.of(), COMMON_PREFIXES,
                Map.of(), Map.of(), PROGRESSION_LADDERS, Map.of(), suffixes(), MATH_COMPLEXITY, Map.of());
    }

    private static List<String> suffixes(String... disciplineSpecific) {
        List<String> all = new ArrayList<>(BASE_SUFFIXES);
        all.addAll(List.of(disciplineSpecific));
        return all.size() > 15 ? all.subList(0, 15) : all;
    }

    private static List<String> withPrefixes(String... extra) {
        List<String> all = new ArrayList<>(COMMON_PREFIXES);
        all.addAll(List.of(extra));
        return all;
    }

    private static Map<String, Integer> orderedInts(Object... keyValues) {
        Map<String, Integer> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], (Integer) keyValues[i + 1]);
        }
        return map;
    }
}
