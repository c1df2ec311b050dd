package com.returnlint;

public enum Severity {
    STYLE("style"),
    WARNING("warning");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
