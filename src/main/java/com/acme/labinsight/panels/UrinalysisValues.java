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

import com.acme.labinsight.util.NormalizeUtil;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Urinalysis readings. Protein and bacteria are reduced to their vocabularies;
 * color and clarity keep the reported wording, lower-cased.
 */
public record UrinalysisValues(
        double ph,
        double specificGravity,
        String protein,
        double glucose,
        double pusCells,
        double redCells,
        String bacteria,
        String color,
        String clarity
) implements PanelValues {

    public static final String NEGATIVE = "negative";

    static final double DEFAULT_PH = 6.0;
    static final double DEFAULT_SPECIFIC_GRAVITY = 1.015;

    static final Set<String> PROTEIN_TERMS = Set.of("positive", "trace");
    static final Set<String> BACTERIA_TERMS = Set.of("few", "moderate", "many");

    public static UrinalysisValues from(Map<String, Object> raw) {
        return new UrinalysisValues(
                NormalizeUtil.number(raw, DEFAULT_PH, "ph"),
                NormalizeUtil.number(raw, DEFAULT_SPECIFIC_GRAVITY, "specific_gravity", "specificGravity"),
                NormalizeUtil.vocabulary(NormalizeUtil.text(raw, NEGATIVE, "protein"), PROTEIN_TERMS, NEGATIVE),
                glucose(NormalizeUtil.firstPresent(raw, "glucose")),
                NormalizeUtil.number(raw, 0, "pus_cells", "pusCells", "wbc_urine", "leukocyte_esterase"),
                NormalizeUtil.number(raw, 0, "red_cells", "redCells", "rbc_urine", "blood"),
                NormalizeUtil.vocabulary(NormalizeUtil.text(raw, NEGATIVE, "bacteria"), BACTERIA_TERMS, NEGATIVE),
                NormalizeUtil.text(raw, "yellow", "color"),
                NormalizeUtil.text(raw, "clear", "clarity"));
    }

    /** Numeric readings pass through; "positive" reads as 1 and any other word as 0. */
    static double glucose(Object raw) {
        var parsed = NormalizeUtil.parseLeading(raw);
        if (parsed.isPresent()) return parsed.getAsDouble();
        return NormalizeUtil.mentions(raw, "positive") ? 1 : 0;
    }

    @Override
    public Map<String, Object> asMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("ph", ph);
        m.put("specific_gravity", specificGravity);
        m.put("protein", protein);
        m.put("glucose", glucose);
        m.put("pus_cells", pusCells);
        m.put("red_cells", redCells);
        m.put("bacteria", bacteria);
        m.put("color", color);
        m.put("clarity", clarity);
        return m;
    }
}
