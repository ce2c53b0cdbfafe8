package com.jay.aurora.model;

import com.jay.aurora.model.enums.FundamentalsClassification;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Composite business-quality read. A {@code STRONG} classification never carries cautionary notes.
 */
@Value
@Builder
public class FundamentalsInsight {
    FundamentalsClassification classification;
    int qualityScore;           // 0 – 100
    @Builder.Default
    List<String> drivers = List.of();
    @Builder.Default
    List<String> cautionaryNotes = List.of();
}
