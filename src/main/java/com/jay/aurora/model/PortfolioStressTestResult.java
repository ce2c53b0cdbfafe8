package com.jay.aurora.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PortfolioStressTestResult {
    double currentValue;
    double bullValue;
    double baseValue;
    double bearValue;
    double bullChangePct;
    double baseChangePct;
    double bearChangePct;
    @Builder.Default
    List<Entry> entries = List.of();

    public static PortfolioStressTestResult empty() {
        return PortfolioStressTestResult.builder().build();
    }

    public record Entry(String ticker, double currentValue, double bullValue, double baseValue, double bearValue) {}
}
