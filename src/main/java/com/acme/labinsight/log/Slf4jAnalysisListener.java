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
import com.acme.labinsight.util.ScoreUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

public final class Slf4jAnalysisListener implements AnalysisListener {

    private final Logger log;

    public Slf4jAnalysisListener() {
        this(LoggerFactory.getLogger(Slf4jAnalysisListener.class));
    }

    public Slf4jAnalysisListener(Logger log) {
        this.log = log;
    }

    @Override
    public void onValuesNormalized(PanelType panel, Map<String, Object> normalized) {
        log.debug("[{} Analysis] Using values: {}", panel.displayName(), normalized);
    }

    @Override
    public void onRiskFused(PanelType panel, ExternalRiskAssessment external, RiskVerdict clinical, RiskVerdict fused) {
        log.info("[Risk Assessment - {}] ML: {}({}) | Clinical: {}({}) => Final: {}({}) [Source: {}]",
                panel.displayName(),
                external.riskLevel().label(), external.riskScore(),
                clinical.level().label(), clinical.score(),
                fused.level().label(), fused.score(),
                ScoreUtil.source(external.riskLevel(), clinical.level()));
    }
}
