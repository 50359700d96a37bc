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
import com.acme.labinsight.log.Slf4jAnalysisListener;
import com.acme.labinsight.model.AnalysisResult;
import com.acme.labinsight.model.ExternalRiskAssessment;
import com.acme.labinsight.model.RawPanel;
import com.acme.labinsight.panels.AnalysisResultBuilder;
import com.acme.labinsight.panels.PanelAnalyzer;
import com.acme.labinsight.panels.PanelAnalyzers;

import java.util.Objects;

/**
 * Entry point for a single panel analysis. Stateless apart from the listener;
 * the same input always yields an equal result.
 */
public final class LabRulesEngine {
    private final AnalysisListener listener;

    public LabRulesEngine() { this(new Slf4jAnalysisListener()); }

    public LabRulesEngine(AnalysisListener listener) {
        this.listener = (listener == null) ? AnalysisListener.NOOP : listener;
    }

    public AnalysisResult analyze(RawPanel panel, ExternalRiskAssessment externalRisk) {
        Objects.requireNonNull(panel, "panel");
        Objects.requireNonNull(externalRisk, "externalRisk");

        AnalysisContext ctx = new AnalysisContext(panel, externalRisk, listener);
        AnalysisResultBuilder builder = new AnalysisResultBuilder();
        PanelAnalyzer analyzer = PanelAnalyzers.forType(ctx.panelType);
        analyzer.run(ctx, builder);
        return builder.build();
    }
}
