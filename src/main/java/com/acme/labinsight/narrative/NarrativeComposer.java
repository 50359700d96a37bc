/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Lab Insight Rules Engine
 */

package com.acme.labinsight.narrative;

import com.acme.labinsight.model.ClassificationCounts;
import com.acme.labinsight.model.ExternalRiskAssessment;
import com.acme.labinsight.model.RiskVerdict;
import com.acme.labinsight.model.SpecialistReferral;
import com.acme.labinsight.panels.CbcValues;
import com.acme.labinsight.panels.LipidValues;
import com.acme.labinsight.panels.UrinalysisValues;

import java.util.List;

import static com.acme.labinsight.util.FormatUtil.fixed;
import static com.acme.labinsight.util.FormatUtil.plain;

/**
 * Summary paragraphs. Every method is a pure function of its arguments.
 */
public final class NarrativeComposer {
    private NarrativeComposer() {}

    public static String cbcAllNormal(CbcValues v) {
        return "Excellent news! Your CBC results show all parameters within healthy ranges. Your white blood cell count ("
                + plain(v.wbc()) + " K/uL), red blood cell count (" + plain(v.rbc()) + " M/uL), hemoglobin ("
                + plain(v.hemoglobin()) + " g/dL), hematocrit (" + plain(v.hematocrit()) + "%), and platelet count ("
                + plain(v.platelets()) + " K/uL) are all optimal. This indicates a healthy immune system, good oxygen-carrying capacity, and proper blood clotting function. Continue your current lifestyle and health maintenance practices.";
    }

    public static String cbcFindings(ClassificationCounts counts, List<String> abnormal, List<String> borderline,
                                     RiskVerdict fused, SpecialistReferral firstReferral) {
        StringBuilder sb = new StringBuilder();
        sb.append("Your Complete Blood Count (CBC) reveals ").append(counts.abnormal()).append(" abnormal parameter(s)")
                .append(borderlineTail(counts)).append(" that require attention. ");
        appendLists(sb, "Abnormal findings include: ", abnormal, borderline);
        sb.append("These results suggest ").append(fused.level().label()).append(" health risk and warrant ")
                .append("consultation with ").append(firstReferral.type())
                .append(". The recommended lifestyle and dietary changes below can help improve these values and support overall blood health.");
        return sb.toString();
    }

    public static String lipidAllNormal(LipidValues v) {
        return "Outstanding! Your lipid profile shows excellent cardiovascular health. Total cholesterol ("
                + plain(v.cholesterol()) + " mg/dL), LDL cholesterol (" + plain(v.ldl()) + " mg/dL), HDL cholesterol ("
                + plain(v.hdl()) + " mg/dL), and triglycerides (" + plain(v.triglycerides()) + " mg/dL) are all at optimal levels. This significantly reduces your risk of heart disease, stroke, and other cardiovascular conditions. Your heart-healthy lifestyle is clearly paying off. Continue these positive habits to maintain your excellent cardiovascular health.";
    }

    public static String lipidFindings(ClassificationCounts counts, List<String> abnormal, List<String> borderline,
                                       RiskVerdict fused, SpecialistReferral firstReferral) {
        StringBuilder sb = new StringBuilder();
        sb.append("Your Lipid Profile reveals ").append(counts.abnormal()).append(" abnormal parameter(s)")
                .append(borderlineTail(counts)).append(" indicating ").append(fused.level().label())
                .append(" cardiovascular risk. ");
        appendLists(sb, "Abnormal findings include: ", abnormal, borderline);
        sb.append("These results indicate increased risk for atherosclerosis, heart disease, and stroke. Immediate lifestyle modifications including diet, exercise, and stress management are essential. ");
        sb.append("Medical consultation with ").append(firstReferral.type())
                .append(" is recommended for comprehensive cardiovascular risk assessment and potential medication therapy.");
        return sb.toString();
    }

    public static String urinalysisAllNormal(UrinalysisValues v) {
        return "Great news! Your urinalysis shows completely normal results. pH (" + plain(v.ph())
                + "), specific gravity (" + plain(v.specificGravity()) + "), protein (" + v.protein()
                + "), and all other parameters are within healthy ranges. This indicates excellent kidney function, proper hydration, and no signs of urinary tract infection or other urinary system issues. Your kidneys are efficiently filtering waste and maintaining proper fluid balance. Continue your healthy lifestyle to maintain optimal kidney and urinary tract health.";
    }

    public static String urinalysisBorderline(UrinalysisValues v, ClassificationCounts counts, List<String> borderline,
                                              RiskVerdict fused) {
        StringBuilder sb = new StringBuilder();
        sb.append("Your urinalysis shows ").append(counts.borderline()).append(" borderline finding(s): ")
                .append(String.join(", ", borderline))
                .append(". While technically within normal ranges, these values are at the edges and warrant attention. ");
        if (v.ph() < 5.5) {
            sb.append("Your acidic urine pH (").append(fixed(v.ph(), 1))
                    .append(") may increase risk of uric acid kidney stones and could indicate dietary imbalances or early metabolic changes. ");
        }
        sb.append("The AI analysis indicates ").append(fused.level().label()).append(" risk (score: ")
                .append(fused.score()).append("/100). These borderline values suggest the need for lifestyle adjustments, particularly regarding hydration and diet. Follow the recommendations below to optimize your urinary health and prevent progression to more concerning levels.");
        return sb.toString();
    }

    public static String urinalysisFindings(UrinalysisValues v, ClassificationCounts counts, List<String> abnormal,
                                            List<String> borderline, RiskVerdict fused,
                                            SpecialistReferral firstReferral) {
        StringBuilder sb = new StringBuilder();
        sb.append("Your Urinalysis reveals ").append(counts.abnormal()).append(" abnormal finding(s)")
                .append(borderlineTail(counts)).append(" indicating ").append(fused.level().label())
                .append(" kidney health risk. ");
        appendLists(sb, "Abnormal findings: ", abnormal, borderline);
        sb.append("These results may indicate kidney stress, damage, or dysfunction. ");
        if (!v.protein().equals(UrinalysisValues.NEGATIVE)) {
            sb.append("Protein in urine is particularly concerning as it often signals kidney disease or damage from conditions like diabetes or hypertension. ");
        }
        sb.append("Immediate consultation with ").append(firstReferral.type())
                .append(" is essential for comprehensive kidney function testing (creatinine, GFR, albumin) and treatment planning.");
        sb.append(" Early intervention can prevent progression to chronic kidney disease.");
        return sb.toString();
    }

    public static String generic(ExternalRiskAssessment external) {
        return "Your lab results have been processed with a " + external.riskLevel().label()
                + " risk assessment (score: " + external.riskScore()
                + "/100). All extracted values are available for review. For comprehensive interpretation and personalized recommendations specific to this lab type, please consult with a qualified healthcare professional who can consider your complete medical history, current medications, and overall health status.";
    }

    private static String borderlineTail(ClassificationCounts counts) {
        return counts.borderline() > 0 ? " and " + counts.borderline() + " borderline value(s)" : "";
    }

    private static void appendLists(StringBuilder sb, String abnormalLead, List<String> abnormal, List<String> borderline) {
        if (!abnormal.isEmpty()) sb.append(abnormalLead).append(String.join(", ", abnormal)).append(". ");
        if (!borderline.isEmpty()) sb.append("Borderline values: ").append(String.join(", ", borderline)).append(". ");
    }
}
