/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Lab Insight Rules Engine
 */

package com.acme.labinsight.panels;

import com.acme.labinsight.model.AnalysisResult;
import com.acme.labinsight.model.ClassificationCounts;
import com.acme.labinsight.model.Enums.Status;
import com.acme.labinsight.model.Enums.Urgency;
import com.acme.labinsight.model.ParameterFinding;
import com.acme.labinsight.model.RiskVerdict;
import com.acme.labinsight.recommend.RecommendationList;
import com.acme.labinsight.recommend.ReferralList;

import java.util.*;

public final class AnalysisResultBuilder {
    private final List<ParameterFinding> findings = new ArrayList<>();
    private final RecommendationList lifestyle = new RecommendationList();
    private final RecommendationList dietary = new RecommendationList();
    private final ReferralList referrals = new ReferralList();
    private String narrative = "";
    private RiskVerdict correctedRisk;

    public void addFinding(ParameterFinding f) { if (f != null) findings.add(f); }

    public RecommendationList lifestyle() { return lifestyle; }
    public RecommendationList dietary() { return dietary; }
    public ReferralList referrals() { return referrals; }

    public void narrative(String text) { this.narrative = text == null ? "" : text; }
    public void correctedRisk(RiskVerdict verdict) { this.correctedRisk = verdict; }

    /** Status of a classified parameter; parameters never classified read as normal. */
    public Status statusOf(String parameter) {
        for (ParameterFinding f : findings) {
            if (f.parameter().equals(parameter)) return f.status();
        }
        return Status.NORMAL;
    }

    public List<String> parametersWith(Status status) {
        List<String> out = new ArrayList<>();
        for (ParameterFinding f : findings) {
            if (f.status() == status) out.add(f.parameter());
        }
        return out;
    }

    public ClassificationCounts counts() {
        int abnormal = 0;
        int borderline = 0;
        for (ParameterFinding f : findings) {
            if (f.status() == Status.ABNORMAL) abnormal++;
            else if (f.status() == Status.BORDERLINE) borderline++;
        }
        return new ClassificationCounts(abnormal, borderline,
                referrals.count(Urgency.URGENT), referrals.count(Urgency.SOON));
    }

    public AnalysisResult build() {
        RiskVerdict risk = Objects.requireNonNull(correctedRisk, "corrected risk not set");
        return new AnalysisResult(narrative, List.copyOf(findings), lifestyle.toList(), dietary.toList(),
                referrals.toList(), risk.level(), risk.score());
    }
}
