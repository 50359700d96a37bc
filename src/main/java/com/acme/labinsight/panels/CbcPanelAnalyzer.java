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

public final class CbcPanelAnalyzer extends ClinicalPanelAnalyzer<CbcValues> {

    public static final String WBC = "White Blood Cell Count (WBC)";
    public static final String RBC = "Red Blood Cell Count (RBC)";
    public static final String HEMOGLOBIN = "Hemoglobin";
    public static final String HEMATOCRIT = "Hematocrit";
    public static final String PLATELETS = "Platelet Count";
    public static final String NEUTROPHILS = "Neutrophils (Segmenters)";
    public static final String LYMPHOCYTES = "Lymphocytes";
    public static final String MONOCYTES = "Monocytes";
    public static final String EOSINOPHILS = "Eosinophils";
    public static final String BASOPHILS = "Basophils";
    public static final String STAB_CELLS = "Stab Cells (Bands)";

    static final String HEMATOLOGIST = "Hematologist";

    static final ParameterRule<Double> WBC_RULE = ParameterRule.<Double>of(WBC, "4.5-11.0 K/uL")
            .display(v -> FormatUtil.fixed(v, 1) + " K/uL")
            .when(v -> v < 4.5, Status.ABNORMAL,
                    "Low white blood cell count (leukopenia) may indicate a weakened immune system, bone marrow disorders, or certain medications. This requires medical evaluation.")
            .refer(SpecialistReferral.soon(HEMATOLOGIST,
                    "Low white blood cell count requires evaluation for potential bone marrow disorders or immune system issues"))
            .when(v -> v > 11.0, Status.ABNORMAL,
                    "Elevated white blood cell count (leukocytosis) suggests infection, inflammation, stress, or potentially blood disorders. Further investigation needed.")
            .refer(SpecialistReferral.soon("Internal Medicine",
                    "Elevated WBC requires investigation to determine underlying cause (infection, inflammation, or blood disorder)"))
            .otherwise("White blood cell count is within normal range, indicating healthy immune function.");

    static final ParameterRule<Double> RBC_RULE = ParameterRule.<Double>of(RBC, "4.2-5.9 M/uL")
            .display(v -> FormatUtil.fixed(v, 2) + " M/uL")
            .when(v -> v < 4.2, Status.ABNORMAL,
                    "Low red blood cell count (anemia) may result from blood loss, nutritional deficiencies (iron, B12, folate), or chronic diseases. Can cause fatigue and weakness.")
            .refer(SpecialistReferral.soon(HEMATOLOGIST, "Low RBC count requires evaluation for anemia and underlying causes"))
            .when(v -> v > 5.9, Status.ABNORMAL,
                    "Elevated red blood cell count (polycythemia) may indicate dehydration, lung disease, or bone marrow disorders. Increases risk of blood clots.")
            .refer(SpecialistReferral.soon(HEMATOLOGIST, "Elevated RBC requires evaluation for polycythemia or secondary causes"))
            .otherwise("Red blood cell count is within normal range, supporting adequate oxygen delivery to tissues.");

    static final ParameterRule<Double> HEMOGLOBIN_RULE = ParameterRule.<Double>of(HEMOGLOBIN, "12.0-17.5 g/dL")
            .display(v -> FormatUtil.fixed(v, 1) + " g/dL")
            .when(v -> v < 12.0, Status.ABNORMAL,
                    "Low hemoglobin (anemia) reduces oxygen delivery to organs and tissues, causing fatigue, weakness, shortness of breath, and pale skin. Requires treatment.")
            .refer(SpecialistReferral.soon(HEMATOLOGIST, "Anemia evaluation and treatment planning"))
            .when(v -> v > 17.5, Status.ABNORMAL,
                    "Elevated hemoglobin may indicate dehydration, lung disease, or polycythemia. Can increase blood viscosity and clotting risk.")
            .refer(SpecialistReferral.soon(HEMATOLOGIST, "Elevated hemoglobin evaluation"))
            .otherwise("Hemoglobin level is within normal range, ensuring adequate oxygen-carrying capacity of blood.");

    static final ParameterRule<Double> HEMATOCRIT_RULE = ParameterRule.<Double>of(HEMATOCRIT, "Approx. 36-50%")
            .display(v -> FormatUtil.fixed(v, 1) + "%")
            .when(v -> v < 36, Status.ABNORMAL,
                    "Low hematocrit suggests anemia, possibly due to iron deficiency, blood loss, or other underlying conditions. Reduced oxygen transport capacity.")
            .refer(SpecialistReferral.soon(HEMATOLOGIST, "Low hematocrit requires evaluation for anemia"))
            .when(v -> v > 50, Status.ABNORMAL,
                    "High hematocrit may indicate dehydration, polycythemia, or other conditions. Increases blood viscosity and potential for clotting.")
            .refer(SpecialistReferral.soon(HEMATOLOGIST, "High hematocrit requires evaluation for polycythemia or dehydration"))
            .otherwise("Hematocrit level is within normal range, indicating appropriate red blood cell volume in blood.");

    static final ParameterRule<Double> PLATELETS_RULE = ParameterRule.<Double>of(PLATELETS, "150-400 K/uL")
            .display(v -> FormatUtil.fixed(v, 0) + " K/uL")
            .when(v -> v < 150, Status.ABNORMAL,
                    "Low platelet count (thrombocytopenia) increases bleeding risk. May result from bone marrow disorders, autoimmune conditions, or medications.")
            .refer(SpecialistReferral.urgent(HEMATOLOGIST, "Low platelet count evaluation for bleeding disorders"))
            .when(v -> v > 400, Status.ABNORMAL,
                    "Elevated platelet count (thrombocytosis) may increase clotting risk. Can result from inflammation, iron deficiency, or bone marrow disorders.")
            .refer(SpecialistReferral.soon(HEMATOLOGIST, "Elevated platelet count evaluation"))
            .otherwise("Platelet count is within normal range, supporting proper blood clotting function.");

    static final ParameterRule<Double> NEUTROPHILS_RULE = ParameterRule.<Double>of(NEUTROPHILS, "54-70%")
            .display(FormatUtil::percent)
            .when(v -> v < 0.40, Status.ABNORMAL,
                    "Low neutrophils (neutropenia) may indicate bone marrow suppression, viral infection, or autoimmune disorders. Increases infection risk.")
            .when(v -> v > 0.75, Status.ABNORMAL,
                    "Elevated neutrophils suggest bacterial infection, inflammation, stress response, or tissue damage. Further evaluation needed.")
            .when(v -> v < 0.54, Status.BORDERLINE,
                    "Neutrophils are slightly below normal range. Monitor for signs of infection or immune system issues.")
            .when(v -> v > 0.70, Status.BORDERLINE,
                    "Neutrophils are slightly elevated, possibly indicating mild infection or stress response.")
            .otherwise("Neutrophil percentage is within normal range, indicating healthy infection-fighting capability.");

    static final ParameterRule<Double> LYMPHOCYTES_RULE = ParameterRule.<Double>of(LYMPHOCYTES, "20-40%")
            .display(FormatUtil::percent)
            .when(v -> v < 0.15, Status.ABNORMAL,
                    "Low lymphocytes (lymphopenia) may indicate viral infection, immunodeficiency, or bone marrow disorders. Weakens immune response.")
            .when(v -> v > 0.45, Status.ABNORMAL,
                    "Elevated lymphocytes suggest viral infection, chronic inflammation, or lymphoproliferative disorders. Further testing recommended.")
            .when(v -> v < 0.20, Status.BORDERLINE,
                    "Lymphocytes are slightly low. Monitor immune function and consider further evaluation if symptoms present.")
            .when(v -> v > 0.40, Status.BORDERLINE,
                    "Lymphocytes are slightly elevated, possibly indicating recent viral infection or immune response.")
            .otherwise("Lymphocyte percentage is within normal range, supporting healthy immune function.");

    // A reading of exactly zero is borderline on purpose, with its own wording.
    static final ParameterRule<Double> MONOCYTES_RULE = ParameterRule.<Double>of(MONOCYTES, "2-8%")
            .display(FormatUtil::percent)
            .when(v -> v < 0.02 && v > 0, Status.BORDERLINE,
                    "Monocytes are slightly below normal range. This is often not clinically significant if other values are normal and may occur during stress or natural variation.")
            .when(v -> v == 0, Status.BORDERLINE,
                    "Monocytes are at the lower limit. This is typically not dangerous if all other CBC values are normal and can occur naturally or during mild stress/infection. No immediate concern.")
            .when(v -> v > 0.12, Status.ABNORMAL,
                    "Elevated monocytes suggest chronic infection, inflammation, or recovery phase from acute infection. May warrant follow-up.")
            .when(v -> v > 0.08, Status.BORDERLINE,
                    "Monocytes are slightly elevated, possibly indicating ongoing immune response or inflammation.")
            .otherwise("Monocyte percentage is within normal range, supporting healthy immune surveillance.");

    static final ParameterRule<Double> EOSINOPHILS_RULE = ParameterRule.<Double>of(EOSINOPHILS, "0-5%")
            .display(FormatUtil::percent)
            .when(v -> v > 0.08, Status.ABNORMAL,
                    "Elevated eosinophils suggest allergic conditions, parasitic infection, or autoimmune disorders. Further evaluation recommended.")
            .when(v -> v > 0.05, Status.BORDERLINE,
                    "Eosinophils are slightly elevated, possibly indicating mild allergic response or environmental sensitivity.")
            .otherwise("Eosinophil percentage is within normal range, indicating no allergic or parasitic conditions.");

    static final ParameterRule<Double> BASOPHILS_RULE = ParameterRule.<Double>of(BASOPHILS, "0-1%")
            .display(FormatUtil::percent)
            .when(v -> v > 0.02, Status.ABNORMAL,
                    "Elevated basophils may indicate allergic conditions, chronic inflammation, or rare blood disorders. Further evaluation needed.")
            .when(v -> v > 0.01, Status.BORDERLINE,
                    "Basophils are slightly elevated, possibly indicating mild allergic response.")
            .otherwise("Basophil percentage is within normal range.");

    static final ParameterRule<Double> STAB_CELLS_RULE = ParameterRule.<Double>of(STAB_CELLS, "0-5%")
            .display(FormatUtil::percent)
            .when(v -> v > 0.10, Status.ABNORMAL,
                    "Elevated stab cells (left shift) indicate acute bacterial infection or bone marrow response. Suggests active infection requiring treatment.")
            .when(v -> v > 0.05, Status.BORDERLINE,
                    "Slightly elevated stab cells may indicate early infection or immune response.")
            .otherwise("Stab cells (immature neutrophils) are within normal range.");

    @Override public PanelType type() { return PanelType.CBC; }

    @Override
    protected CbcValues normalize(Map<String, Object> raw) { return CbcValues.from(raw); }

    @Override
    protected void classify(CbcValues v, AnalysisResultBuilder out) {
        var referrals = out.referrals();
        out.addFinding(WBC_RULE.classify(v.wbc(), referrals));
        out.addFinding(RBC_RULE.classify(v.rbc(), referrals));
        out.addFinding(HEMOGLOBIN_RULE.classify(v.hemoglobin(), referrals));
        out.addFinding(HEMATOCRIT_RULE.classify(v.hematocrit(), referrals));
        out.addFinding(v.plateletsAdequate()
                ? PLATELETS_RULE.classify(v.platelets(), "Adequate", referrals)
                : PLATELETS_RULE.classify(v.platelets(), referrals));
        out.addFinding(NEUTROPHILS_RULE.classify(v.neutrophils(), referrals));
        out.addFinding(LYMPHOCYTES_RULE.classify(v.lymphocytes(), referrals));
        out.addFinding(MONOCYTES_RULE.classify(v.monocytes(), referrals));
        out.addFinding(EOSINOPHILS_RULE.classify(v.eosinophils(), referrals));
        out.addFinding(BASOPHILS_RULE.classify(v.basophils(), referrals));
        if (v.stabCells() > 0) out.addFinding(STAB_CELLS_RULE.classify(v.stabCells(), referrals));
    }

    @Override
    protected void recommend(CbcValues v, AnalysisContext ctx, ClassificationCounts counts, AnalysisResultBuilder out) {
        CbcRecommendations.apply(v, counts, out);
    }

    @Override
    protected String fallbackReason() { return "Regular health checkup and blood test review"; }

    @Override
    protected String narrate(CbcValues v, AnalysisContext ctx, ClassificationCounts counts, RiskVerdict fused,
                             AnalysisResultBuilder out) {
        if (counts.allNormal()) return NarrativeComposer.cbcAllNormal(v);
        return NarrativeComposer.cbcFindings(counts, out.parametersWith(Status.ABNORMAL),
                out.parametersWith(Status.BORDERLINE), fused, out.referrals().first());
    }
}
