package com.goldtracker.acquisition;

/**
 * Markets tracked per acquisition cycle. INTERNATIONAL is the benchmark every other market depends on.
 */
public enum Market {
    INTERNATIONAL("International", "USD"),
    VIETNAM("Vietnam", "VND"),
    CHINA("China", "CNY"),
    RUSSIA("Russia", "RUB"),
    INDIA("India", "INR");

    private final String displayName;
    private final String currency;

    Market(String displayName, String currency) {
        this.displayName = displayName;
        this.currency = currency;
    }

    public String displayName() {
        return displayName;
    }

    public String currency() {
        return currency;
    }

    public boolean isBenchmark() {
        return this == INTERNATIONAL;
    }
}
