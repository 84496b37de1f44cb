package com.herzen.curriculum.dedup;

import com.herzen.curriculum.config.CurriculumProperties;
import com.herzen.curriculum.config.DisciplineProfile;
import com.herzen.curriculum.dedup.DedupModels.DedupResult;
import com.herzen.curriculum.dedup.DedupModels.SkippedRecord;
import com.herzen.curriculum.domain.DomainModels.ConceptGroup;
import com.herzen.curriculum.domain.DomainModels.TopicRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Groups raw headings that denote the same concept and elects a canonical heading per group.
 * Headings scoring at or above the threshold are joined, directly or through a chain of such
 * pairs, unless the join would put two headings scoring below 0.3 into one group.
 */
@Component
public class ConceptDeduplicator {
    private static final Logger log = LoggerFactory.getLogger(ConceptDeduplicator.class);

    /** Titles scoring below this never share a group, whatever links them. */
    static final double UNRELATED_BELOW = 0.3;

    private final CurriculumProperties properties;
    private final TitleSimilarity similarity;

    public ConceptDeduplicator(CurriculumProperties properties) {
        this.properties = properties;
        this.similarity = new TitleSimilarity(properties.getStopWords());
    }

    public TitleSimilarity similarity() {
        return similarity;
    }

    public DedupResult dedupe(List<TopicRecord> records, DisciplineProfile profile) {
        if (records == null) throw new IllegalArgumentException("records must not be null");

        List<SkippedRecord> skipped = new ArrayList<>();
        List<TopicRecord> accepted = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            TopicRecord r = records.get(i);
            if (r == null || r.title() == null || r.title().isBlank()) {
                skipped.add(new SkippedRecord("SKIPPED_EMPTY_TITLE", "Record has an empty title", i));
                log.warn("Skipping record #{} of {}: empty title", i, profile.name());
            } else if (r.sourceEducationalTier() == null) {
                skipped.add(new SkippedRecord("SKIPPED_MISSING_TIER", "Record has no source tier: " + r.title(), i));
                log.warn("Skipping record #{} of {}: no source tier for '{}'", i, profile.name(), r.title());
            } else {
                accepted.add(r);
            }
        }

        int n = accepted.size();
        String[] normalized = new String[n];
        List<Set<String>> words = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            normalized[i] = similarity.normalize(accepted.get(i).title(), profile);
            words.add(similarity.contentWords(normalized[i]));
        }

        double threshold = properties.getSimilarityThreshold();
        int[] parent = new int[n];
        List<List<Integer>> membersByRoot = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            parent[i] = i;
            membersByRoot.add(new ArrayList<>(List.of(i)));
        }

        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                int ri = find(parent, i);
                int rj = find(parent, j);
                if (ri == rj) continue;
                double overlap = similarity.wordOverlap(words.get(i), words.get(j));
                // ratio <= 1, so the overlap alone caps the score
                if (overlap >= 0 && (1.0 + overlap) / 2.0 < threshold) continue;
                double score = similarity.score(normalized[i], words.get(i), normalized[j], words.get(j));
                if (score < threshold) continue;
                if (hasUnrelatedPair(membersByRoot.get(ri), membersByRoot.get(rj), normalized, words)) {
                    log.debug("Not merging '{}' and '{}': their groups hold unrelated titles",
                            accepted.get(i).title(), accepted.get(j).title());
                    continue;
                }
                union(parent, membersByRoot, ri, rj);
                log.debug("'{}' ~ '{}' ({})", accepted.get(i).title(), accepted.get(j).title(), score);
            }
        }

        Map<Integer, List<TopicRecord>> byRoot = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            byRoot.computeIfAbsent(find(parent, i), k -> new ArrayList<>()).add(accepted.get(i));
        }

        List<ConceptGroup> groups = byRoot.values().stream()
                .map(members -> toGroup(members, profile))
                .toList();

        log.info("Deduplicated {} records of {} into {} concept groups ({} skipped)",
                records.size(), profile.name(), groups.size(), skipped.size());
        return new DedupResult(groups, skipped);
    }

    double canonicalScore(TopicRecord record, DisciplineProfile profile) {
        double score = 0.0;
        if (profile.usesStandardTerminology(record.title())) score += 2.0;
        int wordCount = record.title().trim().split("\\s+").length;
        if (wordCount >= 2 && wordCount <= 6) score += 1.0;
        if (record.hierarchyLevel() > 0) score += 0.5;
        if (isAuthoritative(record.sourceId())) score += 1.0;
        return score;
    }

    private boolean isAuthoritative(String sourceId) {
        if (sourceId == null) return false;
        String lower = sourceId.toLowerCase(Locale.ROOT);
        return properties.getAuthoritativeSources().stream().anyMatch(s -> lower.contains(s.toLowerCase(Locale.ROOT)));
    }

    private ConceptGroup toGroup(List<TopicRecord> members, DisciplineProfile profile) {
        TopicRecord best = members.get(0);
        double bestScore = canonicalScore(best, profile);
        for (TopicRecord candidate : members.subList(1, members.size())) {
            double score = canonicalScore(candidate, profile);
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }

        List<String> notes = new ArrayList<>();
        for (TopicRecord member : members) {
            if (member == best) continue;
            notes.add(String.format("Also titled \"%s\" in %s (%s)",
                    member.title().trim(), member.sourceId(), member.sourceEducationalTier().label()));
        }
        return new ConceptGroup(best, members, notes);
    }

    private int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    /** True when some member of one group scores below the unrelated bound against a member of the other. */
    private boolean hasUnrelatedPair(List<Integer> groupA, List<Integer> groupB, String[] normalized, List<Set<String>> words) {
        for (int a : groupA) {
            for (int b : groupB) {
                double score = similarity.score(normalized[a], words.get(a), normalized[b], words.get(b));
                if (score < UNRELATED_BELOW) return true;
            }
        }
        return false;
    }

    private void union(int[] parent, List<List<Integer>> membersByRoot, int ra, int rb) {
        // root is always the earliest record
        int root = Math.min(ra, rb);
        int child = Math.max(ra, rb);
        parent[child] = root;
        membersByRoot.get(root).addAll(membersByRoot.get(child));
        membersByRoot.get(child).clear();
    }
}
