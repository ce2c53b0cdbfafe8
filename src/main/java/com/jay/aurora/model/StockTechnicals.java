package com.jay.aurora.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class StockTechnicals {
    Double price;
    Double price52wHigh;
    Double price52wLow;
    Double sma20;
    Double sma50;
    Double sma200;
    Double rsi14;
    Double volume;
    Double avgVolume;
}
