package com.jay.aurora.layer1_data;

public class TickerNotFoundException extends MarketDataException {

    private final String ticker;

    public TickerNotFoundException(String ticker) {
        super("Ticker not found: " + ticker);
        this.ticker = ticker;
    }

    public String getTicker() {
        return ticker;
    }
}
