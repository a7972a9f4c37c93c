package com.example.modelaudit.model;

public record IngestedModel(String modelName, WorkbookTables tables, IngestionReport report) {
}
