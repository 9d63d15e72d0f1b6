package com.example.nexusmods.model;

/**
 * Time window accepted by the updated-mods endpoint.
 */
public enum UpdatePeriod {
    DAY("1d"),
    WEEK("1w"),
    MONTH("1m");

    private final String queryValue;

    UpdatePeriod(String queryValue) {
        this.queryValue = queryValue;
    }

    public String queryValue() {
        return queryValue;
    }
}
