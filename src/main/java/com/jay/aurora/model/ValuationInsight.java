package com.jay.aurora.model;

import com.jay.aurora.model.enums.ValuationClassification;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ValuationInsight {
    ValuationClassification classification;
    int valuationScore;         // 0 – 100
    String commentary;
    Double pegRatio;
    PegAssessment pegAssessment;
    Double earningsYieldPct;
    Double freeCashFlowYieldPct;
    Double dividendYieldPct;
    @Builder.Default
    List<String> drivers = List.of();
    @Builder.Default
    List<String> cautionaryNotes = List.of();
}
