package com.jay.aurora.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AnalysisOptions {
    @Builder.Default
    int horizonMonths = 3;

    public static AnalysisOptions defaults() {
        return AnalysisOptions.builder().build();
    }
}
