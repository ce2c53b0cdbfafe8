package com.jay.aurora.model;

import com.jay.aurora.model.enums.ConcentrationLevel;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ConcentrationRisk {
    ConcentrationLevel level;
    @Builder.Default
    List<String> warnings = List.of();
    @Builder.Default
    List<PositionWeight> largestPositions = List.of();

    public record PositionWeight(String ticker, double weightPct) {}
}
