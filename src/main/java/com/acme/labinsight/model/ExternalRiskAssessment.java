package com.acme.labinsight.model;

import com.acme.labinsight.model.Enums.RiskLevel;

/** Output of the statistical predictor. Consumed as-is; never validated here. */
public record ExternalRiskAssessment(RiskLevel riskLevel, int riskScore) {

    public ExternalRiskAssessment {
        if (riskLevel == null) riskLevel = RiskLevel.LOW;
    }

    public static ExternalRiskAssessment of(String level, int score) {
        return new ExternalRiskAssessment(RiskLevel.fromLabel(level), score);
    }
}
