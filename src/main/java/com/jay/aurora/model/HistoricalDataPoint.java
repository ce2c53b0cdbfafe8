package com.jay.aurora.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
@AllArgsConstructor
public class HistoricalDataPoint {
    LocalDate date;
    Double price;
    Double volume;
}
