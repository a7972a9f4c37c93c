package com.example.modelaudit.model;

import java.util.Objects;

public record Issue(Severity severity,
                    IssueType type,
                    String location,
                    String detail,
                    String why,
                    String cause,
                    String fix) {

    public Issue {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(type, "type");
        location = location == null ? "" : location;
        detail = detail == null ? "" : detail;
        why = why == null ? "" : why;
        cause = cause == null ? "" : cause;
        fix = fix == null ? "" : fix;
    }
}
