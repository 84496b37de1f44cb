package com.herzen.curriculum.dedup;

import com.herzen.curriculum.config.DisciplineProfile;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Title comparison used by the deduplicator: the unweighted mean of a character-level
 * matching ratio and the word-overlap ratio of the normalized titles.
 */
public class TitleSimilarity {
    private static final Pattern NUMBERED_HEADING = Pattern.compile(
            "^(chapter|section|unit|part|lesson|module)\\s*\\d+(\\.\\d+)*\\s*[:\\-.]?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\d+(\\.\\d+)*\\.?\\s*");
    private static final Pattern WORD_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final Set<String> stopWords;

    public TitleSimilarity(Collection<String> stopWords) {
        this.stopWords = stopWords.stream().map(w -> w.toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
    }

    public String normalize(String title, DisciplineProfile profile) {
        String normalized = title.trim().replace('’', '\'');
        normalized = NUMBERED_HEADING.matcher(normalized).replaceFirst("");
        normalized = LEADING_NUMBER.matcher(normalized).replaceFirst("");

        String lower = normalized.toLowerCase(Locale.ROOT);
        for (String prefix : profile.boilerplatePrefixes()) {
            String p = prefix.toLowerCase(Locale.ROOT) + " ";
            if (lower.startsWith(p) && lower.length() > p.length()) {
                lower = lower.substring(p.length()).trim();
            }
        }
        return lower.replaceAll("\\s+", " ").trim();
    }

    public Set<String> contentWords(String normalizedTitle) {
        String withoutApostrophes = normalizedTitle.replace("'", "");
        return Arrays.stream(WORD_SPLIT.split(withoutApostrophes))
                .filter(w -> !w.isEmpty())
                .filter(w -> !stopWords.contains(w))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /** Shared words divided by the size of the smaller set; -1 when either set is empty. */
    public double wordOverlap(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) return -1.0;
        long shared = a.stream().filter(b::contains).count();
        return (double) shared / Math.min(a.size(), b.size());
    }

    public double score(String normalizedA, Set<String> wordsA, String normalizedB, Set<String> wordsB) {
        double overlap = wordOverlap(wordsA, wordsB);
        double ratio = characterRatio(normalizedA, normalizedB);
        return overlap < 0 ? ratio : (ratio + overlap) / 2.0;
    }

    public double score(String titleA, String titleB, DisciplineProfile profile) {
        String a = normalize(titleA, profile);
        String b = normalize(titleB, profile);
        return score(a, contentWords(a), b, contentWords(b));
    }

    /** Ratcliff/Obershelp ratio: 2 * matched characters / total characters. */
    public double characterRatio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) return 1.0;
        return 2.0 * matchingCharacters(a, b) / total;
    }

    private int matchingCharacters(String a, String b) {
        int matched = 0;
        Deque<int[]> pending = new ArrayDeque<>();
        pending.push(new int[]{0, a.length(), 0, b.length()});
        while (!pending.isEmpty()) {
            int[] span = pending.pop();
            int[] block = longestCommonBlock(a, span[0], span[1], b, span[2], span[3]);
            int size = block[2];
            if (size == 0) continue;
            matched += size;
            pending.push(new int[]{span[0], block[0], span[2], block[1]});
            pending.push(new int[]{block[0] + size, span[1], block[1] + size, span[3]});
        }
        return matched;
    }

    private int[] longestCommonBlock(String a, int aFrom, int aTo, String b, int bFrom, int bTo) {
        int bestA = aFrom, bestB = bFrom, bestSize = 0;
        int[] previous = new int[bTo - bFrom + 1];
        for (int i = aFrom; i < aTo; i++) {
            int[] current = new int[bTo - bFrom + 1];
            for (int j = bFrom; j < bTo; j++) {
                if (a.charAt(i) == b.charAt(j)) {
                    int run = previous[j - bFrom] + 1;
                    current[j - bFrom + 1] = run;
                    if (run > bestSize) {
                        bestSize = run;
                        bestA = i - run + 1;
                        bestB = j - run + 1;
                    }
                }
            }
            previous = current;
        }
        return new int[]{bestA, bestB, bestSize};
    }
}
