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

import com.acme.labinsight.AnalysisContext;
import com.acme.labinsight.model.ClassificationCounts;
import com.acme.labinsight.model.RiskVerdict;
import com.acme.labinsight.model.SpecialistReferral;
import com.acme.labinsight.util.ScoreUtil;

import java.util.Map;

/**
 * Fixed pipeline for panels with a classification table:
 * normalize, classify, fuse risk, recommend, fall back to a GP referral, narrate.
 */
public abstract class ClinicalPanelAnalyzer<V extends PanelValues> implements PanelAnalyzer {

    static final String GENERAL_PRACTITIONER = "General Practitioner";

    protected abstract V normalize(Map<String, Object> raw);

    protected abstract void classify(V values, AnalysisResultBuilder out);

    protected abstract void recommend(V values, AnalysisContext ctx, ClassificationCounts counts, AnalysisResultBuilder out);

    protected abstract String fallbackReason();

    protected abstract String narrate(V values, AnalysisContext ctx, ClassificationCounts counts, RiskVerdict fused,
                                      AnalysisResultBuilder out);

    @Override
    public final void run(AnalysisContext ctx, AnalysisResultBuilder out) {
        V values = normalize(ctx.values);
        ctx.listener.onValuesNormalized(type(), values.asMap());

        classify(values, out);

        // routine referrals added later never change these counts
        ClassificationCounts counts = out.counts();
        RiskVerdict clinical = ScoreUtil.clinical(counts);
        RiskVerdict fused = ScoreUtil.fuse(ctx.externalRisk, clinical);
        ctx.listener.onRiskFused(type(), ctx.externalRisk, clinical, fused);
        out.correctedRisk(fused);

        recommend(values, ctx, counts, out);
        out.referrals().fallback(SpecialistReferral.routine(GENERAL_PRACTITIONER, fallbackReason()));

        out.narrative(narrate(values, ctx, counts, fused, out));
    }
}
