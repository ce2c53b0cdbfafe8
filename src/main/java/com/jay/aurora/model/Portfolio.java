package com.jay.aurora.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class Portfolio {
    String id;
    String name;
    @Builder.Default
    List<PortfolioHolding> holdings = List.of();
    Instant createdAt;
    Instant updatedAt;
}
