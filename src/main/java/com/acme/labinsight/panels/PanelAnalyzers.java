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

import com.acme.labinsight.model.Enums.PanelType;

public final class PanelAnalyzers {
    private PanelAnalyzers() {}

    public static PanelAnalyzer forType(PanelType type) {
        return switch (type) {
            case CBC        -> new CbcPanelAnalyzer();
            case LIPID      -> new LipidPanelAnalyzer();
            case URINALYSIS -> new UrinalysisPanelAnalyzer();
            default         -> new GenericPanelAnalyzer();
        };
    }
}
