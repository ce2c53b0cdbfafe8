package com.jay.aurora.model;

/** Inclusive expected-return range in percent, low end first. */
public record ReturnRange(double low, double high) {

    public double midpoint() {
        return (low + high) / 2;
    }

    public double width() {
        return high - low;
    }
}
