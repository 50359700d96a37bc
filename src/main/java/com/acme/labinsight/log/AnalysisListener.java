/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Lab Insight Rules Engine
 */

package com.acme.labinsight.log;

import com.acme.labinsight.model.Enums.PanelType;
import com.acme.labinsight.model.ExternalRiskAssessment;
import com.acme.labinsight.model.RiskVerdict;

import java.util.Map;

/**
 * Side-channel observer of an analysis. Implementations must not affect the
 * result; {@link #NOOP} ignores every event.
 */
public interface AnalysisListener {

    AnalysisListener NOOP = new AnalysisListener() {};

    default void onValuesNormalized(PanelType panel, Map<String, Object> normalized) {}

    default void onRiskFused(PanelType panel, ExternalRiskAssessment external, RiskVerdict clinical, RiskVerdict fused) {}
}
