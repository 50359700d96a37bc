/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Lab Insight Rules Engine
 */

package com.acme.labinsight;

import com.acme.labinsight.log.AnalysisListener;
import com.acme.labinsight.model.Enums.PanelType;
import com.acme.labinsight.model.ExternalRiskAssessment;
import com.acme.labinsight.model.RawPanel;

import java.util.Map;

public final class AnalysisContext {
    public final PanelType panelType;
    public final Map<String, Object> values;
    public final ExternalRiskAssessment externalRisk;
    public final AnalysisListener listener;

    public AnalysisContext(RawPanel panel, ExternalRiskAssessment externalRisk, AnalysisListener listener) {
        this.panelType = panel.type();
        this.values = panel.values();
        this.externalRisk = externalRisk;
        this.listener = (listener == null) ? AnalysisListener.NOOP : listener;
    }
}
