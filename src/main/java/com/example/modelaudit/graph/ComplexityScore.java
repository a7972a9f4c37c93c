package com.example.modelaudit.graph;

public record ComplexityScore(int score, String rationale) {
}
