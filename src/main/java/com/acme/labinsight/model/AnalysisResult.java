package com.acme.labinsight.model;

import com.acme.labinsight.model.Enums.RiskLevel;

import java.util.List;

public record AnalysisResult(
        String narrative,
        List<ParameterFinding> findings,
        List<Recommendation> lifestyleRecommendations,
        List<Recommendation> dietaryRecommendations,
        List<SpecialistReferral> suggestedSpecialists,
        RiskLevel correctedRiskLevel,
        int correctedRiskScore
) {}
