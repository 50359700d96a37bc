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
import com.acme.labinsight.model.Enums.PanelType;
import com.acme.labinsight.model.Enums.Status;
import com.acme.labinsight.model.RiskVerdict;
import com.acme.labinsight.model.SpecialistReferral;
import com.acme.labinsight.narrative.NarrativeComposer;
import com.acme.labinsight.rules.ParameterRule;
import com.acme.labinsight.util.FormatUtil;

import java.util.Map;

public final class LipidPanelAnalyzer extends ClinicalPanelAnalyzer<LipidValues> {

    public static final String CHOLESTEROL = "Total Cholesterol";
    public static final String LDL = "LDL Cholesterol (Bad)";
    public static final String HDL = "HDL Cholesterol (Good)";
    public static final String TRIGLYCERIDES = "Triglycerides";

    static final String CARDIOLOGIST = "Cardiologist";

    private static String mgdl(double v) { return FormatUtil.fixed(v, 0) + " mg/dL"; }

    static final ParameterRule<Double> CHOLESTEROL_RULE = ParameterRule.<Double>of(CHOLESTEROL, "<200 mg/dL (Desirable)")
            .display(LipidPanelAnalyzer::mgdl)
            .when(v -> v >= 240, Status.ABNORMAL,
                    "High total cholesterol significantly increases risk of heart disease and stroke. Plaque buildup in arteries can lead to cardiovascular events. Requires aggressive management.")
            .refer(SpecialistReferral.soon(CARDIOLOGIST,
                    "High cholesterol requires cardiovascular risk assessment and potential medication management"))
            .when(v -> v >= 200, Status.BORDERLINE,
                    "Borderline high cholesterol indicates moderate cardiovascular risk. Lifestyle modifications can prevent progression to high cholesterol levels.")
            .otherwise("Total cholesterol is at desirable level, indicating good overall cholesterol balance.");

    static final ParameterRule<Double> LDL_RULE = ParameterRule.<Double>of(LDL, "<100 mg/dL (Optimal)")
            .display(LipidPanelAnalyzer::mgdl)
            .when(v -> v >= 160, Status.ABNORMAL,
                    "High LDL (bad cholesterol) promotes plaque buildup in arteries, significantly increasing heart attack and stroke risk. This level requires medical intervention.")
            .refer(SpecialistReferral.soon(CARDIOLOGIST, "High LDL cholesterol management and cardiovascular risk reduction"))
            .when(v -> v >= 130, Status.BORDERLINE,
                    "Borderline high LDL cholesterol increases cardiovascular risk. Diet and exercise modifications recommended to lower levels.")
            .when(v -> v >= 100, Status.NORMAL,
                    "LDL cholesterol is near optimal. Maintaining healthy habits will keep it in this favorable range.")
            .otherwise("LDL cholesterol is at optimal level, minimizing risk of arterial plaque formation.");

    static final ParameterRule<Double> HDL_RULE = ParameterRule.<Double>of(HDL, "≥40 mg/dL (men), ≥50 mg/dL (women)")
            .display(LipidPanelAnalyzer::mgdl)
            .when(v -> v < 40, Status.ABNORMAL,
                    "Low HDL (good cholesterol) is a major risk factor for heart disease. HDL removes cholesterol from arteries. Low levels increase cardiovascular risk even if other values are normal.")
            .refer(SpecialistReferral.soon(CARDIOLOGIST, "Low HDL cholesterol requires cardiovascular risk evaluation"))
            .when(v -> v >= 60, Status.NORMAL,
                    "Optimal HDL cholesterol provides strong protection against heart disease. This high level is considered a negative risk factor.")
            .otherwise("HDL cholesterol is at desirable level, providing protective cardiovascular benefits.");

    static final ParameterRule<Double> TRIGLYCERIDES_RULE = ParameterRule.<Double>of(TRIGLYCERIDES, "<150 mg/dL")
            .display(LipidPanelAnalyzer::mgdl)
            .when(v -> v >= 200, Status.ABNORMAL,
                    "High triglycerides increase risk of pancreatitis, heart disease, and metabolic syndrome. Often associated with obesity, diabetes, and excessive alcohol or sugar intake.")
            .refer(SpecialistReferral.soon(CARDIOLOGIST, "High triglycerides management and metabolic syndrome evaluation"))
            .when(v -> v >= 150, Status.BORDERLINE,
                    "Borderline high triglycerides suggest need for lifestyle modifications. Reducing sugars and refined carbs can lower levels.")
            .otherwise("Triglyceride level is normal, indicating healthy fat metabolism and low pancreatitis risk.");

    @Override public PanelType type() { return PanelType.LIPID; }

    @Override
    protected LipidValues normalize(Map<String, Object> raw) { return LipidValues.from(raw); }

    @Override
    protected void classify(LipidValues v, AnalysisResultBuilder out) {
        var referrals = out.referrals();
        out.addFinding(CHOLESTEROL_RULE.classify(v.cholesterol(), referrals));
        out.addFinding(LDL_RULE.classify(v.ldl(), referrals));
        out.addFinding(HDL_RULE.classify(v.hdl(), referrals));
        out.addFinding(TRIGLYCERIDES_RULE.classify(v.triglycerides(), referrals));
    }

    @Override
    protected void recommend(LipidValues v, AnalysisContext ctx, ClassificationCounts counts, AnalysisResultBuilder out) {
        LipidRecommendations.apply(v, counts, out);
    }

    @Override
    protected String fallbackReason() { return "Regular checkup and cardiovascular health monitoring"; }

    @Override
    protected String narrate(LipidValues v, AnalysisContext ctx, ClassificationCounts counts, RiskVerdict fused,
                             AnalysisResultBuilder out) {
        if (counts.allNormal()) return NarrativeComposer.lipidAllNormal(v);
        return NarrativeComposer.lipidFindings(counts, out.parametersWith(Status.ABNORMAL),
                out.parametersWith(Status.BORDERLINE), fused, out.referrals().first());
    }
}
