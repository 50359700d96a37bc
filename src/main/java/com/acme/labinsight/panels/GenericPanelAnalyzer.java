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
import com.acme.labinsight.model.Enums.PanelType;
import com.acme.labinsight.model.ParameterFinding;
import com.acme.labinsight.model.RiskVerdict;
import com.acme.labinsight.narrative.NarrativeComposer;
import com.acme.labinsight.util.FormatUtil;

import java.util.Locale;
import java.util.Map;

/** Pass-through for panels without a classification table. The external risk is reported unchanged. */
public final class GenericPanelAnalyzer implements PanelAnalyzer {

    @Override public PanelType type() { return PanelType.GENERIC; }

    @Override
    public void run(AnalysisContext ctx, AnalysisResultBuilder out) {
        ctx.listener.onValuesNormalized(type(), ctx.values);

        for (Map.Entry<String, Object> e : ctx.values.entrySet()) {
            String key = e.getKey();
            out.addFinding(ParameterFinding.normal(
                    key.toUpperCase(Locale.ROOT),
                    FormatUtil.plain(e.getValue()),
                    "Varies",
                    key + " value recorded. Please consult with your healthcare provider for detailed interpretation of this parameter."));
        }

        out.lifestyle().add("General Health",
                "Maintain regular physical activity, healthy sleep patterns, and stress management practices",
                "General health maintenance supports optimal lab values and overall well-being");
        out.dietary().add("Balanced Diet",
                "Follow a balanced diet rich in fruits, vegetables, whole grains, and lean proteins",
                "Nutritious, varied diet supports overall metabolic health and optimal lab results");

        out.correctedRisk(new RiskVerdict(ctx.externalRisk.riskLevel(), ctx.externalRisk.riskScore()));
        out.narrative(NarrativeComposer.generic(ctx.externalRisk));
    }
}
