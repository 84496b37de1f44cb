package com.herzen.curriculum.dedup;

import com.herzen.curriculum.domain.DomainModels.ConceptGroup;

import java.util.List;

public class DedupModels {
    public record DedupResult(List<ConceptGroup> groups, List<SkippedRecord> skipped) {}

    public record SkippedRecord(String code, String message, int inputIndex) {}
}
