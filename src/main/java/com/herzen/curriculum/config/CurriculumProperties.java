package com.herzen.curriculum.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Run-wide knobs for curriculum assembly. Per-discipline tables live in {@link DisciplineCatalog};
 * only the target size can be overridden per discipline here.
 */
@ConfigurationProperties(prefix = "curriculum")
public class CurriculumProperties {

    /** Default number of items in a finished curriculum. */
    private int targetSubtopics = 1000;

    /** Combined title-similarity score at which two headings denote one concept. */
    private double similarityThreshold = 0.8;

    private int maxHierarchyLevels = 6;

    /** Cycle-resolution iterations allowed per cluster before edges are forcibly removed. */
    private int cycleIterationFactor = 3;

    /** Substrings of a source id that mark it as a recognized authority. */
    private List<String> authoritativeSources = new ArrayList<>(List.of(
            "university", "college", "academic", "textbook", "openstax",
            "pearson", "mcgraw", "wiley", "cambridge", "oxford"));

    private List<String> stopWords = new ArrayList<>(List.of(
            "and", "or", "the", "a", "an", "in", "on", "at", "to", "for", "of", "with", "by"));

    private Map<String, DisciplineOverride> disciplines = new LinkedHashMap<>();

    public int targetFor(String discipline) {
        if (discipline != null) {
            for (var entry : disciplines.entrySet()) {
                Integer target = entry.getValue().getTargetSubtopics();
                if (target != null && entry.getKey().toLowerCase(Locale.ROOT).equals(discipline.toLowerCase(Locale.ROOT))) {
                    return target;
                }
            }
        }
        return targetSubtopics;
    }

    public int getTargetSubtopics() {
        return targetSubtopics;
    }

    public void setTargetSubtopics(int targetSubtopics) {
        this.targetSubtopics = targetSubtopics;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public void setSimilarityThreshold(double similarityThreshold) {
        this.similarityThreshold = similarityThreshold;
    }

    public int getMaxHierarchyLevels() {
        return maxHierarchyLevels;
    }

    public void setMaxHierarchyLevels(int maxHierarchyLevels) {
        this.maxHierarchyLevels = maxHierarchyLevels;
    }

    public int getCycleIterationFactor() {
        return cycleIterationFactor;
    }

    public void setCycleIterationFactor(int cycleIterationFactor) {
        this.cycleIterationFactor = cycleIterationFactor;
    }

    public List<String> getAuthoritativeSources() {
        return authoritativeSources;
    }

    public void setAuthoritativeSources(List<String> authoritativeSources) {
        this.authoritativeSources = authoritativeSources;
    }

    public List<String> getStopWords() {
        return stopWords;
    }

    public void setStopWords(List<String> stopWords) {
        this.stopWords = stopWords;
    }

    public Map<String, DisciplineOverride> getDisciplines() {
        return disciplines;
    }

    public void setDisciplines(Map<String, DisciplineOverride> disciplines) {
        this.disciplines = disciplines;
    }

    public static class DisciplineOverride {
        private Integer targetSubtopics;

        public Integer getTargetSubtopics() {
            return targetSubtopics;
        }

        public void setTargetSubtopics(Integer targetSubtopics) {
            this.targetSubtopics = targetSubtopics;
        }
    }
}
