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
import com.acme.labinsight.model.Enums.Urgency;
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

class CbcPanelAnalyzerTest {

    @Nested
    @DisplayName("all values at defaults")
    class Healthy {

        private final AnalysisResult result = analyze("cbc", Map.of(), "low", 15);

        @Test
        void staysLowAtExternalScore() {
            assertThat(result.correctedRiskLevel()).isEqualTo(RiskLevel.LOW);
            assertThat(result.correctedRiskScore()).isEqualTo(15);
        }

        @Test
        void tenNormalFindingsWithoutStabCells() {
            assertThat(result.findings()).hasSize(10)
                    .allMatch(f -> f.status() == Status.NORMAL);
            assertThat(result.findings()).extracting(ParameterFinding::parameter).doesNotContain(CbcPanelAnalyzer.STAB_CELLS);
        }

        @Test
        void positiveNarrativeAndSingleRoutineCheckup() {
            assertThat(result.narrative()).startsWith("Excellent news!")
                    .contains("white blood cell count (7.5 K/uL)")
                    .contains("platelet count (250 K/uL)");
            assertThat(result.suggestedSpecialists()).containsExactly(SpecialistReferral.routine("General Practitioner",
                    "Annual health check-up to monitor and maintain your healthy blood values"));
        }

        @Test
        void maintenanceRecommendations() {
            assertThat(result.lifestyleRecommendations()).extracting(Recommendation::category)
                    .contains("Sleep Maintenance", "Stress Management", "Regular Exercise", "Continue Healthy Habits");
            assertThat(result.dietaryRecommendations()).extracting(Recommendation::category)
                    .contains("Antioxidant-Rich Foods", "Hydration", "Protein Quality", "Balanced Nutrition");
        }
    }

    @Nested
    @DisplayName("white cell count")
    class WhiteCells {

        @Test
        void lowCountRefersToHematologistSoon() {
            AnalysisResult result = analyze("cbc", Map.of("wbc", 3.0), "low", 10);

            assertThat(finding(result, CbcPanelAnalyzer.WBC).status()).isEqualTo(Status.ABNORMAL);
            assertThat(finding(result, CbcPanelAnalyzer.WBC).value()).isEqualTo("3.0 K/uL");
            assertThat(result.suggestedSpecialists()).extracting(SpecialistReferral::type).containsExactly("Hematologist");
            // one abnormal value plus one soon referral
            assertThat(result.correctedRiskLevel()).isEqualTo(RiskLevel.MODERATE);
            assertThat(result.correctedRiskScore()).isEqualTo(60);
            assertThat(result.narrative()).contains("consultation with Hematologist");
        }

        @Test
        void boundariesAreInclusiveOfNormal() {
            assertThat(finding(analyze("cbc", Map.of("wbc", 4.5), "low", 0), CbcPanelAnalyzer.WBC).status())
                    .isEqualTo(Status.NORMAL);
            assertThat(finding(analyze("cbc", Map.of("wbc", 11.0), "low", 0), CbcPanelAnalyzer.WBC).status())
                    .isEqualTo(Status.NORMAL);
        }

        @Test
        void highCountRefersToInternalMedicine() {
            AnalysisResult result = analyze("cbc", Map.of("wbc", "11.1 K/uL"), "low", 0);
            assertThat(finding(result, CbcPanelAnalyzer.WBC).status()).isEqualTo(Status.ABNORMAL);
            assertThat(result.suggestedSpecialists()).extracting(SpecialistReferral::type).containsExactly("Internal Medicine");
        }
    }

    @Test
    void hematologistIsReferredOnceWithTheFirstReason() {
        AnalysisResult result = analyze("cbc", Map.of("wbc", 3.0, "hemoglobin", 10.0), "low", 0);

        assertThat(result.suggestedSpecialists()).hasSize(1);
        assertThat(result.suggestedSpecialists().get(0).reason()).startsWith("Low white blood cell count");
        assertThat(result.correctedRiskScore()).isEqualTo(65);
        assertThat(result.dietaryRecommendations()).extracting(Recommendation::category)
                .contains("Vitamin C", "Folate & B12", "Hydration Enhancement");
    }

    @Test
    void lowPlateletsAreUrgent() {
        AnalysisResult result = analyze("cbc", Map.of("platelets", 100), "low", 0);

        assertThat(result.suggestedSpecialists()).singleElement()
                .satisfies(r -> assertThat(r.urgency()).isEqualTo(Urgency.URGENT));
        assertThat(result.correctedRiskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(result.correctedRiskScore()).isEqualTo(90);
    }

    @Test
    void adequatePlateletReportIsShownVerbatim() {
        AnalysisResult result = analyze("cbc", Map.of("platelets", "Adequate"), "low", 0);

        assertThat(finding(result, CbcPanelAnalyzer.PLATELETS).value()).isEqualTo("Adequate");
        assertThat(finding(result, CbcPanelAnalyzer.PLATELETS).status()).isEqualTo(Status.NORMAL);
    }

    @Nested
    @DisplayName("monocytes")
    class Monocytes {

        @Test
        void exactZeroIsBorderlineWithItsOwnWording() {
            AnalysisResult result = analyze("cbc", Map.of("monocytes", 0), "low", 10);

            assertThat(finding(result, CbcPanelAnalyzer.MONOCYTES).status()).isEqualTo(Status.BORDERLINE);
            assertThat(finding(result, CbcPanelAnalyzer.MONOCYTES).interpretation()).contains("lower limit");
            assertThat(result.correctedRiskLevel()).isEqualTo(RiskLevel.LOW);
            assertThat(result.correctedRiskScore()).isEqualTo(27);
            assertThat(result.suggestedSpecialists()).containsExactly(SpecialistReferral.routine("General Practitioner",
                    "Regular health checkup and blood test review"));
        }

        @Test
        void slightlyLowIsBorderline() {
            AnalysisResult result = analyze("cbc", Map.of("monocytes", 0.01), "low", 0);
            assertThat(finding(result, CbcPanelAnalyzer.MONOCYTES).interpretation()).contains("slightly below");
        }

        @Test
        void highIsAbnormal() {
            AnalysisResult result = analyze("cbc", Map.of("monocytes", 0.15), "low", 0);
            assertThat(finding(result, CbcPanelAnalyzer.MONOCYTES).status()).isEqualTo(Status.ABNORMAL);
            assertThat(finding(result, CbcPanelAnalyzer.MONOCYTES).value()).isEqualTo("15%");
        }
    }

    @Test
    void stabCellsAreOnlyReportedWhenPresent() {
        AnalysisResult result = analyze("cbc", Map.of("stab_cells", 0.12), "low", 0);
        assertThat(finding(result, CbcPanelAnalyzer.STAB_CELLS).status()).isEqualTo(Status.ABNORMAL);
        assertThat(result.findings()).hasSize(11);
    }

    @Test
    void unparseableValuesFallBackToDefaults() {
        AnalysisResult result = analyze("cbc", Map.of("wbc", "pending", "rbc", ""), "low", 15);
        assertThat(finding(result, CbcPanelAnalyzer.WBC).value()).isEqualTo("7.5 K/uL");
        assertThat(finding(result, CbcPanelAnalyzer.RBC).value()).isEqualTo("4.70 M/uL");
        assertThat(result.correctedRiskScore()).isEqualTo(15);
    }

    @Nested
    @DisplayName("cut points")
    class Boundaries {

        private Status at(String key, double value, String parameter) {
            return statusAt("cbc", key, value, parameter);
        }

        @Test
        void neutrophils() {
            String p = CbcPanelAnalyzer.NEUTROPHILS;
            assertThat(at("neutrophils", 0.39, p)).isEqualTo(Status.ABNORMAL);
            assertThat(at("neutrophils", 0.40, p)).isEqualTo(Status.BORDERLINE);
            assertThat(at("neutrophils", 0.54, p)).isEqualTo(Status.NORMAL);
            assertThat(at("neutrophils", 0.70, p)).isEqualTo(Status.NORMAL);
            assertThat(at("neutrophils", 0.75, p)).isEqualTo(Status.BORDERLINE);
            assertThat(at("neutrophils", 0.76, p)).isEqualTo(Status.ABNORMAL);
        }

        @Test
        void lymphocytes() {
            String p = CbcPanelAnalyzer.LYMPHOCYTES;
            assertThat(at("lymphocytes", 0.14, p)).isEqualTo(Status.ABNORMAL);
            assertThat(at("lymphocytes", 0.15, p)).isEqualTo(Status.BORDERLINE);
            assertThat(at("lymphocytes", 0.20, p)).isEqualTo(Status.NORMAL);
            assertThat(at("lymphocytes", 0.40, p)).isEqualTo(Status.NORMAL);
            assertThat(at("lymphocytes", 0.45, p)).isEqualTo(Status.BORDERLINE);
            assertThat(at("lymphocytes", 0.46, p)).isEqualTo(Status.ABNORMAL);
        }

        @Test
        void monocytes() {
            String p = CbcPanelAnalyzer.MONOCYTES;
            assertThat(at("monocytes", 0.019, p)).isEqualTo(Status.BORDERLINE);
            assertThat(at("monocytes", 0.02, p)).isEqualTo(Status.NORMAL);
            assertThat(at("monocytes", 0.08, p)).isEqualTo(Status.NORMAL);
            assertThat(at("monocytes", 0.09, p)).isEqualTo(Status.BORDERLINE);
            assertThat(at("monocytes", 0.12, p)).isEqualTo(Status.BORDERLINE);
            assertThat(at("monocytes", 0.13, p)).isEqualTo(Status.ABNORMAL);
        }

        @Test
        void eosinophilsAndBasophils() {
            assertThat(at("eosinophils", 0.05, CbcPanelAnalyzer.EOSINOPHILS)).isEqualTo(Status.NORMAL);
            assertThat(at("eosinophils", 0.08, CbcPanelAnalyzer.EOSINOPHILS)).isEqualTo(Status.BORDERLINE);
            assertThat(at("eosinophils", 0.09, CbcPanelAnalyzer.EOSINOPHILS)).isEqualTo(Status.ABNORMAL);
            assertThat(at("basophils", 0.01, CbcPanelAnalyzer.BASOPHILS)).isEqualTo(Status.NORMAL);
            assertThat(at("basophils", 0.02, CbcPanelAnalyzer.BASOPHILS)).isEqualTo(Status.BORDERLINE);
            assertThat(at("basophils", 0.03, CbcPanelAnalyzer.BASOPHILS)).isEqualTo(Status.ABNORMAL);
        }

        @Test
        void stabCells() {
            String p = CbcPanelAnalyzer.STAB_CELLS;
            assertThat(at("stab_cells", 0.05, p)).isEqualTo(Status.NORMAL);
            assertThat(at("stab_cells", 0.06, p)).isEqualTo(Status.BORDERLINE);
            assertThat(at("stab_cells", 0.10, p)).isEqualTo(Status.BORDERLINE);
            assertThat(at("stab_cells", 0.11, p)).isEqualTo(Status.ABNORMAL);
        }

        @Test
        void redCellIndicesAreInclusiveOfNormal() {
            assertThat(at("rbc", 4.1, CbcPanelAnalyzer.RBC)).isEqualTo(Status.ABNORMAL);
            assertThat(at("rbc", 4.2, CbcPanelAnalyzer.RBC)).isEqualTo(Status.NORMAL);
            assertThat(at("rbc", 5.9, CbcPanelAnalyzer.RBC)).isEqualTo(Status.NORMAL);
            assertThat(at("rbc", 6.0, CbcPanelAnalyzer.RBC)).isEqualTo(Status.ABNORMAL);
            assertThat(at("hemoglobin", 11.9, CbcPanelAnalyzer.HEMOGLOBIN)).isEqualTo(Status.ABNORMAL);
            assertThat(at("hemoglobin", 12.0, CbcPanelAnalyzer.HEMOGLOBIN)).isEqualTo(Status.NORMAL);
            assertThat(at("hemoglobin", 17.5, CbcPanelAnalyzer.HEMOGLOBIN)).isEqualTo(Status.NORMAL);
            assertThat(at("hemoglobin", 17.6, CbcPanelAnalyzer.HEMOGLOBIN)).isEqualTo(Status.ABNORMAL);
            assertThat(at("hematocrit", 35.9, CbcPanelAnalyzer.HEMATOCRIT)).isEqualTo(Status.ABNORMAL);
            assertThat(at("hematocrit", 36.0, CbcPanelAnalyzer.HEMATOCRIT)).isEqualTo(Status.NORMAL);
            assertThat(at("hematocrit", 50.0, CbcPanelAnalyzer.HEMATOCRIT)).isEqualTo(Status.NORMAL);
            assertThat(at("hematocrit", 50.1, CbcPanelAnalyzer.HEMATOCRIT)).isEqualTo(Status.ABNORMAL);
        }

        @Test
        void platelets() {
            String p = CbcPanelAnalyzer.PLATELETS;
            assertThat(at("platelets", 149, p)).isEqualTo(Status.ABNORMAL);
            assertThat(at("platelets", 150, p)).isEqualTo(Status.NORMAL);
            assertThat(at("platelets", 400, p)).isEqualTo(Status.NORMAL);
            assertThat(at("platelets", 401, p)).isEqualTo(Status.ABNORMAL);
        }
    }
}
