package com.acme.labinsight.util;

import com.acme.labinsight.model.ClassificationCounts;
import com.acme.labinsight.model.Enums.RiskLevel;
import com.acme.labinsight.model.ExternalRiskAssessment;
import com.acme.labinsight.model.RiskVerdict;

/**
 * Risk fusion. The clinical verdict comes from the first matching count rule;
 * the fused verdict is the per-field maximum of clinical and external, so the
 * predictor can escalate but never lower what the rules found.
 */
public final class ScoreUtil {
    private ScoreUtil() {}

    public static final int MAX_SCORE = 100;

    public static RiskVerdict clinical(ClassificationCounts c) {
        int abnormal = c.abnormal();
        int borderline = c.borderline();
        int urgent = c.urgentReferrals();
        int soon = c.soonReferrals();

        if (urgent > 0 || abnormal >= 3) {
            return new RiskVerdict(RiskLevel.HIGH, Math.min(MAX_SCORE, 75 + abnormal * 5 + urgent * 10));
        }
        if (soon > 0 || abnormal >= 2) {
            return new RiskVerdict(RiskLevel.MODERATE, Math.min(MAX_SCORE, 50 + abnormal * 5 + soon * 5));
        }
        if (abnormal >= 1 || borderline >= 2) {
            return new RiskVerdict(RiskLevel.MODERATE, Math.min(MAX_SCORE, 40 + abnormal * 3 + borderline * 2));
        }
        if (borderline >= 1) return new RiskVerdict(RiskLevel.LOW, 25 + borderline * 2);
        return new RiskVerdict(RiskLevel.LOW, 15);
    }

    public static RiskVerdict fuse(ExternalRiskAssessment external, RiskVerdict clinical) {
        RiskLevel level = worst(external.riskLevel(), clinical.level());
        int score = Math.min(MAX_SCORE, Math.max(external.riskScore(), clinical.score()));
        return new RiskVerdict(level, score);
    }

    public static RiskLevel worst(RiskLevel a, RiskLevel b) {
        return RiskLevel.fromRank(Math.max(a.rank(), b.rank()));
    }

    /** Which side decided the fused level: "ML", "Clinical" or "Both". */
    public static String source(RiskLevel external, RiskLevel clinical) {
        int fused = Math.max(external.rank(), clinical.rank());
        if (fused == external.rank() && fused > clinical.rank()) return "ML";
        if (fused == clinical.rank() && fused > external.rank()) return "Clinical";
        return "Both";
    }
}
