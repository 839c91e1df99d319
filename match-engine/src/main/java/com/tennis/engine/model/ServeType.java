package com.tennis.engine.model;

public enum ServeType {
    FIRST("1st"),
    SECOND("2nd");

    private final String label;

    ServeType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
