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
import com.acme.labinsight.model.Enums.RiskLevel;
import com.acme.labinsight.model.Enums.Status;
import com.acme.labinsight.model.RiskVerdict;
import com.acme.labinsight.model.SpecialistReferral;
import com.acme.labinsight.narrative.NarrativeComposer;
import com.acme.labinsight.rules.ParameterRule;
import com.acme.labinsight.util.FormatUtil;

import java.util.Map;

import static com.acme.labinsight.util.FormatUtil.plain;

public final class UrinalysisPanelAnalyzer extends ClinicalPanelAnalyzer<UrinalysisValues> {

    public static final String PH = "Urine pH";
    public static final String COLOR = "Color";
    public static final String CLARITY = "Transparency/Clarity";
    public static final String SPECIFIC_GRAVITY = "Specific Gravity";
    public static final String PROTEIN = "Protein";
    public static final String GLUCOSE = "Sugar/Glucose";
    public static final String PUS_CELLS = "Pus Cells (WBC)";
    public static final String RED_CELLS = "Red Cells (RBC)";
    public static final String BACTERIA = "Bacteria";

    static final String NEPHROLOGIST = "Nephrologist";
    static final String UROLOGIST = "Urologist";

    private static String perHpf(double v) { return FormatUtil.fixed(v, 0) + "/HPF"; }

    static final ParameterRule<Double> PH_RULE = ParameterRule.<Double>of(PH, "4.5-8.0")
            .display(v -> FormatUtil.fixed(v, 1))
            .when(v -> v < 4.5, Status.ABNORMAL,
                    "Very acidic urine may indicate metabolic acidosis, diabetes, dehydration, or high-protein diet. Can increase kidney stone risk (uric acid stones).")
            .refer(SpecialistReferral.soon(NEPHROLOGIST, "Abnormally acidic urine requires kidney function evaluation"))
            .when(v -> v > 8.0, Status.ABNORMAL,
                    "Very alkaline urine may suggest urinary tract infection, kidney disease, or vegetarian diet. Can increase risk of calcium phosphate stones.")
            .refer(SpecialistReferral.soon(NEPHROLOGIST, "Abnormally alkaline urine requires evaluation for UTI or kidney issues"))
            .when(v -> v < 5.5, Status.BORDERLINE, v -> "Acidic urine (pH " + FormatUtil.fixed(v, 1)
                    + ") is at the lower end of normal range. This may indicate dietary factors (high protein intake), mild dehydration, or early metabolic changes. While not critically abnormal, monitoring is recommended. Consider increasing hydration and alkaline foods (fruits, vegetables).")
            .when(v -> v > 7.5, Status.BORDERLINE,
                    "Urine pH is slightly alkaline but within normal range. May be due to dietary factors or normal variation.")
            .otherwise("Urine pH is within normal range, indicating balanced acid-base metabolism.");

    // Color alone never moves the status.
    static final ParameterRule<String> COLOR_RULE = ParameterRule.<String>of(COLOR, "Yellow to Amber")
            .display(FormatUtil::capitalize)
            .otherwise(c -> "Urine color is " + c + ", which is normal. Color variations can indicate hydration status or presence of substances.");

    static final ParameterRule<String> CLARITY_RULE = ParameterRule.<String>of(CLARITY, "Clear")
            .display(FormatUtil::capitalize)
            .when(c -> c.contains("hazy") || c.contains("cloudy"), Status.BORDERLINE,
                    "Urine appears hazy/cloudy, which may indicate presence of cells, bacteria, crystals, or mucus. Often associated with urinary tract infections or dehydration.")
            .when(c -> c.contains("turbid"), Status.ABNORMAL,
                    "Urine is turbid (very cloudy), suggesting significant presence of cells, bacteria, or other particles. This warrants investigation for infection or other conditions.")
            .otherwise("Urine is clear, indicating no suspended particles or cloudiness.");

    static final ParameterRule<Double> SPECIFIC_GRAVITY_RULE = ParameterRule.<Double>of(SPECIFIC_GRAVITY, "1.005-1.030")
            .display(v -> FormatUtil.fixed(v, 3))
            .when(v -> v < 1.005, Status.ABNORMAL,
                    "Low specific gravity may indicate excessive fluid intake or impaired kidney concentrating ability (e.g., diabetes insipidus, chronic kidney disease).")
            .refer(SpecialistReferral.soon(NEPHROLOGIST, "Low specific gravity requires evaluation for kidney concentrating ability"))
            .when(v -> v > 1.030, Status.ABNORMAL,
                    "High specific gravity may indicate dehydration, fever, or presence of high concentrations of solutes like glucose or protein. Suggests concentrated urine.")
            .refer(SpecialistReferral.soon(NEPHROLOGIST, "High specific gravity requires evaluation for dehydration or other causes"))
            .otherwise("Urine specific gravity is within normal range, indicating adequate kidney concentration ability.");

    static final ParameterRule<String> PROTEIN_RULE = ParameterRule.<String>of(PROTEIN, "Negative")
            .display(FormatUtil::capitalize)
            .when("positive"::equals, Status.ABNORMAL,
                    "Protein in urine (proteinuria) indicates kidney damage or dysfunction. May result from diabetes, hypertension, kidney disease, or urinary tract infection. Requires immediate evaluation.")
            .refer(SpecialistReferral.urgent(NEPHROLOGIST,
                    "Proteinuria requires comprehensive kidney function evaluation and potential biopsy"))
            .when("trace"::equals, Status.BORDERLINE,
                    "Trace protein may be normal variation from exercise, dehydration, or fever. Persistent trace protein requires follow-up to rule out early kidney disease.")
            .refer(SpecialistReferral.routine(NEPHROLOGIST, "Trace protein warrants repeat testing and kidney function monitoring"))
            .otherwise("No protein detected in urine, indicating healthy kidney filtration.");

    static final ParameterRule<Double> GLUCOSE_RULE = ParameterRule.<Double>of(GLUCOSE, "Negative")
            .display(v -> v > 0 ? "Positive" : "Negative")
            .when(v -> v > 0, Status.ABNORMAL,
                    "Glucose present in urine (glycosuria) typically indicates diabetes mellitus or other conditions causing elevated blood sugar. Requires immediate medical evaluation.")
            .refer(SpecialistReferral.soon("Endocrinologist", "Glucose in urine requires diabetes screening and blood sugar evaluation"))
            .otherwise("No glucose detected in urine, indicating normal blood sugar levels and kidney filtration.");

    static final ParameterRule<Double> PUS_CELLS_RULE = ParameterRule.<Double>of(PUS_CELLS, "0-5/HPF")
            .display(UrinalysisPanelAnalyzer::perHpf)
            .when(v -> v > 15, Status.ABNORMAL, v -> "High pus cell count (" + plain(v)
                    + "/HPF) strongly indicates urinary tract infection (UTI). White blood cells fight infection. This level requires antibiotic treatment and urine culture to identify bacteria.")
            .refer(v -> SpecialistReferral.urgent(UROLOGIST,
                    "High pus cells (" + plain(v) + "/HPF) indicate urinary tract infection requiring treatment"), NEPHROLOGIST)
            .when(v -> v >= 6, Status.BORDERLINE, v -> "Elevated pus cells (" + plain(v)
                    + "/HPF) suggest possible urinary tract infection or inflammation. Normal is 0-5/HPF. Recommend repeat test and clinical correlation with symptoms (burning, frequency, urgency).")
            .refer(v -> SpecialistReferral.soon(UROLOGIST,
                    "Elevated pus cells (" + plain(v) + "/HPF) warrant evaluation for possible UTI"))
            .otherwise("Pus cells (white blood cells) are within normal range, indicating no urinary tract infection.");

    static final ParameterRule<Double> RED_CELLS_RULE = ParameterRule.<Double>of(RED_CELLS, "0-3/HPF")
            .display(UrinalysisPanelAnalyzer::perHpf)
            .when(v -> v > 15, Status.ABNORMAL, v -> "High red cell count (" + plain(v)
                    + "/HPF) indicates hematuria (blood in urine). Causes include urinary tract infection, kidney stones, bladder inflammation, or more serious conditions. Requires immediate medical evaluation.")
            .refer(v -> SpecialistReferral.urgent(UROLOGIST, "Blood in urine (" + plain(v)
                    + " RBC/HPF) requires investigation to rule out stones, infection, or other conditions"), NEPHROLOGIST)
            .when(v -> v >= 4, Status.BORDERLINE, v -> "Elevated red cells (" + plain(v)
                    + "/HPF) indicate microscopic hematuria. Normal is 0-3/HPF. May result from infection, minor trauma, or kidney issues. Warrants follow-up testing and evaluation.")
            .refer(v -> SpecialistReferral.soon(UROLOGIST, "Microscopic hematuria (" + plain(v) + " RBC/HPF) needs evaluation"))
            .otherwise("Red blood cells are within normal range, indicating no bleeding in urinary tract.");

    static final ParameterRule<String> BACTERIA_RULE = ParameterRule.<String>of(BACTERIA, "Negative")
            .display(FormatUtil::capitalize)
            .when(b -> b.equals("many") || b.equals("moderate"), Status.ABNORMAL, b -> FormatUtil.capitalize(b)
                    + " bacteria present in urine strongly supports urinary tract infection diagnosis. Requires antibiotic treatment and urine culture.")
            .when("few"::equals, Status.BORDERLINE,
                    "Few bacteria present may indicate contamination during collection or early infection. Clinical correlation needed. If symptomatic, may support UTI diagnosis.")
            .otherwise("No bacteria detected, indicating sterile urine and no infection.");

    @Override public PanelType type() { return PanelType.URINALYSIS; }

    @Override
    protected UrinalysisValues normalize(Map<String, Object> raw) { return UrinalysisValues.from(raw); }

    @Override
    protected void classify(UrinalysisValues v, AnalysisResultBuilder out) {
        var referrals = out.referrals();
        out.addFinding(PH_RULE.classify(v.ph(), referrals));
        out.addFinding(COLOR_RULE.classify(v.color(), referrals));
        out.addFinding(CLARITY_RULE.classify(v.clarity(), referrals));
        out.addFinding(SPECIFIC_GRAVITY_RULE.classify(v.specificGravity(), referrals));
        out.addFinding(PROTEIN_RULE.classify(v.protein(), referrals));
        out.addFinding(GLUCOSE_RULE.classify(v.glucose(), referrals));
        out.addFinding(PUS_CELLS_RULE.classify(v.pusCells(), referrals));
        out.addFinding(RED_CELLS_RULE.classify(v.redCells(), referrals));
        out.addFinding(BACTERIA_RULE.classify(v.bacteria(), referrals));
    }

    @Override
    protected void recommend(UrinalysisValues v, AnalysisContext ctx, ClassificationCounts counts,
                             AnalysisResultBuilder out) {
        UrinalysisRecommendations.apply(v, counts, ctx.externalRisk.riskLevel(), out);
    }

    @Override
    protected String fallbackReason() { return "Routine urinalysis review and kidney health monitoring"; }

    @Override
    protected String narrate(UrinalysisValues v, AnalysisContext ctx, ClassificationCounts counts, RiskVerdict fused,
                             AnalysisResultBuilder out) {
        if (counts.allNormal() && ctx.externalRisk.riskLevel() == RiskLevel.LOW) {
            return NarrativeComposer.urinalysisAllNormal(v);
        }
        if (counts.abnormal() == 0 && counts.borderline() > 0) {
            return NarrativeComposer.urinalysisBorderline(v, counts, out.parametersWith(Status.BORDERLINE), fused);
        }
        return NarrativeComposer.urinalysisFindings(v, counts, out.parametersWith(Status.ABNORMAL),
                out.parametersWith(Status.BORDERLINE), fused, out.referrals().first());
    }
}
