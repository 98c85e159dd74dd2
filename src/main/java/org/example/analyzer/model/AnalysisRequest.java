package org.example.analyzer.model;

public record AnalysisRequest(String text) {
}
