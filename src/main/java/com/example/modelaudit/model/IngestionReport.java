package com.example.modelaudit.model;

import java.util.List;

public record IngestionReport(int totalSheets, List<String> sheetNames, List<String> errors) {

    public IngestionReport {
        sheetNames = List.copyOf(sheetNames);
        errors = List.copyOf(errors);
    }

    public String status() {
        return errors.isEmpty() ? "Success" : "Partial Success";
    }
}
