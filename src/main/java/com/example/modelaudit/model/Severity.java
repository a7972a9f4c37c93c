package com.example.modelaudit.model;

public enum Severity {
    CRITICAL("Critical"),
    HIGH("High"),
    MEDIUM("Medium");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
