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

/**
 * CBC readings. Differential counts are fractions of 1 (0.60 for 60%) and are
 * taken as delivered by the extraction step.
 */
public record CbcValues(
        double wbc,
        double rbc,
        double hemoglobin,
        double hematocrit,
        double platelets,
        boolean plateletsAdequate,
        double neutrophils,
        double stabCells,
        double lymphocytes,
        double monocytes,
        double eosinophils,
        double basophils
) implements PanelValues {

    static final double DEFAULT_WBC = 7.5;
    static final double DEFAULT_RBC = 4.7;
    static final double DEFAULT_HEMOGLOBIN = 14.0;
    static final double DEFAULT_HEMATOCRIT = 42.0;
    static final double DEFAULT_PLATELETS = 250;
    static final double DEFAULT_NEUTROPHILS = 0.60;
    static final double DEFAULT_STAB_CELLS = 0;
    static final double DEFAULT_LYMPHOCYTES = 0.30;
    static final double DEFAULT_MONOCYTES = 0.05;
    static final double DEFAULT_EOSINOPHILS = 0.03;
    static final double DEFAULT_BASOPHILS = 0.01;

    /** Stand-in count for a platelet report that only says "adequate". */
    static final double ADEQUATE_PLATELETS = 250;

    public static CbcValues from(Map<String, Object> raw) {
        boolean adequate = NormalizeUtil.mentions(raw.get("platelets"), "adequate");
        double platelets = adequate
                ? ADEQUATE_PLATELETS
                : NormalizeUtil.number(raw, DEFAULT_PLATELETS, "platelets");

        return new CbcValues(
                NormalizeUtil.number(raw, DEFAULT_WBC, "wbc"),
                NormalizeUtil.number(raw, DEFAULT_RBC, "rbc"),
                NormalizeUtil.number(raw, DEFAULT_HEMOGLOBIN, "hemoglobin"),
                NormalizeUtil.number(raw, DEFAULT_HEMATOCRIT, "hematocrit"),
                platelets,
                adequate,
                NormalizeUtil.number(raw, DEFAULT_NEUTROPHILS, "neutrophils"),
                NormalizeUtil.number(raw, DEFAULT_STAB_CELLS, "stab_cells"),
                NormalizeUtil.number(raw, DEFAULT_LYMPHOCYTES, "lymphocytes"),
                NormalizeUtil.number(raw, DEFAULT_MONOCYTES, "monocytes"),
                NormalizeUtil.number(raw, DEFAULT_EOSINOPHILS, "eosinophils"),
                NormalizeUtil.number(raw, DEFAULT_BASOPHILS, "basophils"));
    }

    @Override
    public Map<String, Object> asMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("wbc", wbc);
        m.put("rbc", rbc);
        m.put("hemoglobin", hemoglobin);
        m.put("hematocrit", hematocrit);
        m.put("platelets", platelets);
        m.put("platelets_adequate", plateletsAdequate);
        m.put("neutrophils", neutrophils);
        m.put("stab_cells", stabCells);
        m.put("lymphocytes", lymphocytes);
        m.put("monocytes", monocytes);
        m.put("eosinophils", eosinophils);
        m.put("basophils", basophils);
        return m;
    }
}
