package com.jay.aurora.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class PortfolioHolding {
    String ticker;
    double shares;
    double averageCostBasis;
    LocalDate purchaseDate;
}
