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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.acme.labinsight.LabRulesEngine;
import com.acme.labinsight.model.ExternalRiskAssessment;
import com.acme.labinsight.model.RawPanel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class Slf4jAnalysisListenerTest {

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attach() {
        logger = (Logger) LoggerFactory.getLogger("lab-insight.listener-test");
        logger.setLevel(Level.DEBUG);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
        appender.stop();
    }

    @Test
    void logsNormalizedValuesAndFusedRisk() {
        LabRulesEngine engine = new LabRulesEngine(new Slf4jAnalysisListener(logger));
        engine.analyze(new RawPanel("cbc", Map.of("wbc", 3.0)), ExternalRiskAssessment.of("low", 10));

        assertThat(appender.list).hasSize(2);
        ILoggingEvent values = appender.list.get(0);
        assertThat(values.getLevel()).isEqualTo(Level.DEBUG);
        assertThat(values.getFormattedMessage()).startsWith("[CBC Analysis] Using values: {wbc=3.0, rbc=4.7");

        ILoggingEvent risk = appender.list.get(1);
        assertThat(risk.getLevel()).isEqualTo(Level.INFO);
        assertThat(risk.getFormattedMessage()).isEqualTo(
                "[Risk Assessment - CBC] ML: low(10) | Clinical: moderate(60) => Final: moderate(60) [Source: Clinical]");
    }

    @Test
    void genericPanelLogsValuesButNoFusion() {
        LabRulesEngine engine = new LabRulesEngine(new Slf4jAnalysisListener(logger));
        engine.analyze(new RawPanel("thyroid", Map.of("tsh", 2.5)), ExternalRiskAssessment.of("high", 80));

        assertThat(appender.list).singleElement()
                .satisfies(e -> assertThat(e.getFormattedMessage()).isEqualTo("[Generic Analysis] Using values: {tsh=2.5}"));
    }
}
