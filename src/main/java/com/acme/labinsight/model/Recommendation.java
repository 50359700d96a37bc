package com.acme.labinsight.model;

public record Recommendation(String category, String recommendation, String rationale) {}
