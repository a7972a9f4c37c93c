package com.example.modelaudit.model;

public enum IssueType {
    EXTERNAL_LINK("External Link", "external-link"),
    CALCULATION_ERROR("Calculation Error", "calculation-error"),
    HARDCODED_PLUG("Hard-coded Plug", "hardcoded-plug"),
    ACCOUNTING_MISMATCH("Accounting Mismatch", "accounting-mismatch"),
    CIRCULAR_REFERENCE("Circular Reference", "circular-reference");

    private final String label;
    private final String key;

    IssueType(String label, String key) {
        this.label = label;
        this.key = key;
    }

    public String getLabel() {
        return label;
    }

    public String getKey() {
        return key;
    }
}
