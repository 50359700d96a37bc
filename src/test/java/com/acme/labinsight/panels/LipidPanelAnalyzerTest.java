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

import com.acme.labinsight.model.AnalysisResult;
import com.acme.labinsight.model.Enums.RiskLevel;
import com.acme.labinsight.model.Enums.Status;
import com.acme.labinsight.model.ParameterFinding;
import com.acme.labinsight.model.Recommendation;
import com.acme.labinsight.model.SpecialistReferral;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.acme.labinsight.panels.PanelFixtures.analyze;
import static com.acme.labinsight.panels.PanelFixtures.finding;
import static com.acme.labinsight.panels.PanelFixtures.statusAt;
import static org.assertj.core.api.Assertions.assertThat;

class LipidPanelAnalyzerTest {

    @Nested
    @DisplayName("every value abnormal with a high external assessment")
    class AllAbnormal {

        private final AnalysisResult result = analyze("lipid",
                Map.of("cholesterol", 250, "ldl", 170, "hdl", 30, "triglycerides", 220), "high", 90);

        @Test
        void fusedRiskIsHighNinetyFive() {
            assertThat(result.correctedRiskLevel()).isEqualTo(RiskLevel.HIGH);
            assertThat(result.correctedRiskScore()).isEqualTo(95);
        }

        @Test
        void cardiologistIsReferredOnce() {
            assertThat(result.suggestedSpecialists()).extracting(SpecialistReferral::type).containsExactly("Cardiologist");
            assertThat(result.suggestedSpecialists().get(0).reason()).startsWith("High cholesterol");
        }

        @Test
        void findingsAreAbnormalInTableOrder() {
            assertThat(result.findings()).extracting(ParameterFinding::parameter)
                    .containsExactly(LipidPanelAnalyzer.CHOLESTEROL, LipidPanelAnalyzer.LDL,
                            LipidPanelAnalyzer.HDL, LipidPanelAnalyzer.TRIGLYCERIDES);
            assertThat(result.findings()).allMatch(f -> f.status() == Status.ABNORMAL);
            assertThat(finding(result, LipidPanelAnalyzer.CHOLESTEROL).value()).isEqualTo("250 mg/dL");
        }

        @Test
        void interventionRecommendationsQuoteTheValues() {
            assertThat(result.dietaryRecommendations()).extracting(Recommendation::category)
                    .contains("Reduce Saturated Fats (Priority)", "Increase Omega-3 Fatty Acids (Critical)",
                            "Boost HDL with Healthy Fats", "Eliminate Simple Sugars (Critical)");
            assertThat(result.dietaryRecommendations())
                    .filteredOn(r -> r.category().equals("Increase Omega-3 Fatty Acids (Critical)"))
                    .singleElement()
                    .satisfies(r -> assertThat(r.rationale()).contains("target: 154-165 mg/dL"));
            assertThat(result.lifestyleRecommendations())
                    .filteredOn(r -> r.category().equals("Strict Alcohol Limitation"))
                    .singleElement()
                    .satisfies(r -> assertThat(r.recommendation()).startsWith("Complete alcohol abstinence"));
            assertThat(result.lifestyleRecommendations()).extracting(Recommendation::category)
                    .contains("Intensive Aerobic Exercise", "Comprehensive Stress Management", "Tobacco Cessation (Critical)");
        }

        @Test
        void narrativeEnumeratesFindingsAndNamesCardiologist() {
            assertThat(result.narrative())
                    .startsWith("Your Lipid Profile reveals 4 abnormal parameter(s) indicating high cardiovascular risk.")
                    .contains("Medical consultation with Cardiologist");
        }
    }

    @Test
    void defaultsAreAllNormal() {
        AnalysisResult result = analyze("Lipid Profile", Map.of(), "low", 12);

        assertThat(result.correctedRiskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(result.correctedRiskScore()).isEqualTo(15);
        assertThat(result.narrative()).startsWith("Outstanding!");
        assertThat(result.dietaryRecommendations()).extracting(Recommendation::category)
                .contains("Maintain Heart-Healthy Fats", "Continue Heart-Healthy Diet");
        assertThat(result.suggestedSpecialists()).containsExactly(SpecialistReferral.routine("General Practitioner",
                "Annual lipid panel check to continue monitoring your excellent cardiovascular health"));
    }

    @Test
    void nearOptimalLdlAndHighHdlAreNormal() {
        AnalysisResult result = analyze("lipid", Map.of("ldl", 120, "hdl", 65), "low", 0);

        assertThat(finding(result, LipidPanelAnalyzer.LDL).status()).isEqualTo(Status.NORMAL);
        assertThat(finding(result, LipidPanelAnalyzer.LDL).interpretation()).contains("near optimal");
        assertThat(finding(result, LipidPanelAnalyzer.HDL).interpretation()).startsWith("Optimal HDL");
    }

    @Test
    void borderlineCholesterolFallsBackToGeneralPractitioner() {
        AnalysisResult result = analyze("lipid", Map.of("cholesterol", 210), "low", 5);

        assertThat(finding(result, LipidPanelAnalyzer.CHOLESTEROL).status()).isEqualTo(Status.BORDERLINE);
        assertThat(result.correctedRiskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(result.correctedRiskScore()).isEqualTo(27);
        assertThat(result.suggestedSpecialists()).containsExactly(SpecialistReferral.routine("General Practitioner",
                "Regular checkup and cardiovascular health monitoring"));
        assertThat(result.lifestyleRecommendations()).extracting(Recommendation::category)
                .contains("Moderate Aerobic Exercise");
        assertThat(result.narrative()).contains("Borderline values: Total Cholesterol.")
                .endsWith("Medical consultation with General Practitioner is recommended for comprehensive cardiovascular risk assessment and potential medication therapy.");
    }

    @Nested
    @DisplayName("cut points")
    class Boundaries {

        private Status at(String key, int value, String parameter) {
            return statusAt("lipid", key, value, parameter);
        }

        @Test
        void totalCholesterol() {
            String p = LipidPanelAnalyzer.CHOLESTEROL;
            assertThat(at("cholesterol", 199, p)).isEqualTo(Status.NORMAL);
            assertThat(at("cholesterol", 200, p)).isEqualTo(Status.BORDERLINE);
            assertThat(at("cholesterol", 239, p)).isEqualTo(Status.BORDERLINE);
            assertThat(at("cholesterol", 240, p)).isEqualTo(Status.ABNORMAL);
        }

        @Test
        void ldl() {
            String p = LipidPanelAnalyzer.LDL;
            assertThat(at("ldl", 129, p)).isEqualTo(Status.NORMAL);
            assertThat(at("ldl", 130, p)).isEqualTo(Status.BORDERLINE);
            assertThat(at("ldl", 159, p)).isEqualTo(Status.BORDERLINE);
            assertThat(at("ldl", 160, p)).isEqualTo(Status.ABNORMAL);
        }

        @Test
        void hdl() {
            assertThat(at("hdl", 39, LipidPanelAnalyzer.HDL)).isEqualTo(Status.ABNORMAL);
            assertThat(at("hdl", 40, LipidPanelAnalyzer.HDL)).isEqualTo(Status.NORMAL);
        }

        @Test
        void triglycerides() {
            String p = LipidPanelAnalyzer.TRIGLYCERIDES;
            assertThat(at("triglycerides", 149, p)).isEqualTo(Status.NORMAL);
            assertThat(at("triglycerides", 150, p)).isEqualTo(Status.BORDERLINE);
            assertThat(at("triglycerides", 199, p)).isEqualTo(Status.BORDERLINE);
            assertThat(at("triglycerides", 200, p)).isEqualTo(Status.ABNORMAL);
        }
    }
}
