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

/** Lipid readings in mg/dL. */
public record LipidValues(double cholesterol, double hdl, double ldl, double triglycerides) implements PanelValues {

    static final double DEFAULT_CHOLESTEROL = 180;
    static final double DEFAULT_HDL = 55;
    static final double DEFAULT_LDL = 100;
    static final double DEFAULT_TRIGLYCERIDES = 140;

    public static LipidValues from(Map<String, Object> raw) {
        return new LipidValues(
                NormalizeUtil.number(raw, DEFAULT_CHOLESTEROL, "cholesterol"),
                NormalizeUtil.number(raw, DEFAULT_HDL, "hdl"),
                NormalizeUtil.number(raw, DEFAULT_LDL, "ldl"),
                NormalizeUtil.number(raw, DEFAULT_TRIGLYCERIDES, "triglycerides"));
    }

    @Override
    public Map<String, Object> asMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("cholesterol", cholesterol);
        m.put("hdl", hdl);
        m.put("ldl", ldl);
        m.put("triglycerides", triglycerides);
        return m;
    }
}
