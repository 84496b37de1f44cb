package com.herzen.curriculum.domain;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/** Hands out ids that are unique within one pipeline run. Not shared across disciplines. */
public class IdNamespace {
    private final Set<String> issued = new HashSet<>();

    public String unique(String base) {
        String candidate = base;
        int suffix = 2;
        while (!issued.add(candidate)) {
            candidate = base + "-" + suffix++;
        }
        return candidate;
    }

    public static String slug(String value) {
        String slug = value.toLowerCase(Locale.ROOT)
                .replace("'", "")
                .replaceAll("[^\\p{L}\\p{N}]+", "_")
                .replaceAll("^_+|_+$", "");
        return slug.isEmpty() ? "untitled" : slug;
    }
}
