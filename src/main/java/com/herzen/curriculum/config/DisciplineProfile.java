package com.herzen.curriculum.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Static heuristic tables for one discipline. Built once and shared read-only by every stage
 * of a run; content-area order is significant (first matching area wins).
 *
 * @param expansionSuffixes title templates, each with a single {@code %s} for the concept
 * @param explicitAreaPrerequisites content-area label to the labels it declares as prerequisites
 * @param progressionLadders ordered keyword chains, earlier keyword precedes later
 */
public record DisciplineProfile(String name,
                                double disciplineFactor,
                                List<String> standardTerms,
                                List<String> boilerplatePrefixes,
                                Map<String, List<String>> contentAreas,
                                Map<String, List<String>> prerequisitePatterns,
                                List<List<String>> progressionLadders,
                                Map<String, List<String>> explicitAreaPrerequisites,
                                List<String> expansionSuffixes,
                                Map<String, Integer> complexityMap,
                                Map<String, Integer> eraMarkers) {

    public DisciplineProfile {
        standardTerms = List.copyOf(standardTerms);
        boilerplatePrefixes = List.copyOf(boilerplatePrefixes);
        contentAreas = Collections.unmodifiableMap(new LinkedHashMap<>(contentAreas));
        prerequisitePatterns = Collections.unmodifiableMap(new LinkedHashMap<>(prerequisitePatterns));
        progressionLadders = progressionLadders.stream().map(List::copyOf).toList();
        explicitAreaPrerequisites = Collections.unmodifiableMap(new LinkedHashMap<>(explicitAreaPrerequisites));
        expansionSuffixes = List.copyOf(expansionSuffixes);
        complexityMap = Collections.unmodifiableMap(new LinkedHashMap<>(complexityMap));
        eraMarkers = Collections.unmodifiableMap(new LinkedHashMap<>(eraMarkers));
    }

    public String generalLabel() {
        return "General " + name;
    }

    public boolean usesStandardTerminology(String title) {
        String lower = title.toLowerCase(Locale.ROOT);
        return standardTerms.stream().anyMatch(lower::contains);
    }

    /** Highest complexity-map score of any keyword in {@code text}, 1 when nothing matches. */
    public int complexityOf(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return complexityMap.entrySet().stream()
                .filter(e -> lower.contains(e.getKey()))
                .mapToInt(Map.Entry::getValue)
                .max()
                .orElse(1);
    }

    /** Historical era tagged by {@code text}, or 0 when it carries no era marker. */
    public int eraOf(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return eraMarkers.entrySet().stream()
                .filter(e -> lower.contains(e.getKey()))
                .mapToInt(Map.Entry::getValue)
                .max()
                .orElse(0);
    }
}
