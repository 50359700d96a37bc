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

import com.acme.labinsight.model.ClassificationCounts;
import com.acme.labinsight.model.Enums.Status;
import com.acme.labinsight.model.SpecialistReferral;
import com.acme.labinsight.recommend.RecommendationList;

import static com.acme.labinsight.panels.CbcPanelAnalyzer.*;

final class CbcRecommendations {
    private CbcRecommendations() {}

    static void apply(CbcValues v, ClassificationCounts counts, AnalysisResultBuilder out) {
        RecommendationList lifestyle = out.lifestyle();
        RecommendationList dietary = out.dietary();

        Status wbc = out.statusOf(WBC);
        Status rbc = out.statusOf(RBC);
        Status hb = out.statusOf(HEMOGLOBIN);
        Status plt = out.statusOf(PLATELETS);

        if (v.rbc() < 4.2) {
            dietary.add("Iron-Rich Foods",
                    "Consume iron-rich foods daily: red meat, chicken liver, spinach, lentils, fortified cereals, and pumpkin seeds",
                    "Iron is essential for red blood cell production. Dietary iron helps correct anemia and restore healthy RBC levels.");
        } else if (v.rbc() > 5.9) {
            lifestyle.add("Hydration",
                    "Increase water intake to 8-10 glasses daily, especially if dehydration suspected",
                    "Dehydration concentrates blood cells. Proper hydration helps normalize RBC count if elevated due to fluid loss.");
        }

        if (v.hemoglobin() < 12.0) {
            dietary.add("Vitamin C",
                    "Consume vitamin C with iron sources: citrus fruits, bell peppers, strawberries, tomatoes",
                    "Vitamin C enhances iron absorption by up to 300%, helping to correct low hemoglobin levels more effectively.");
            dietary.add("Folate & B12",
                    "Include folate-rich foods (leafy greens, beans) and B12 sources (eggs, dairy, fortified foods)",
                    "Folate and vitamin B12 are essential for red blood cell formation and hemoglobin synthesis.");
        }

        if (wbc != Status.NORMAL || rbc != Status.NORMAL) {
            lifestyle.add("Sleep Optimization",
                    "Prioritize 8-9 hours of quality sleep nightly. Maintain consistent sleep/wake times, even on weekends. Create a dark, cool bedroom environment",
                    "Your " + (wbc != Status.NORMAL ? "white" : "red") + " blood cell levels indicate need for enhanced sleep. Deep sleep stages are when bone marrow produces most blood cells. Quality sleep can improve cell production by 20-30%.");
        } else {
            lifestyle.add("Sleep Maintenance",
                    "Maintain consistent sleep schedule of 7-9 hours per night with regular bedtime routine",
                    "Continue supporting healthy blood cell production through quality sleep. Your current levels suggest good sleep habits.");
        }

        if (wbc == Status.ABNORMAL || rbc == Status.ABNORMAL || plt == Status.ABNORMAL) {
            lifestyle.add("Stress Reduction (Critical)",
                    "Practice daily stress management: 20-30 minutes meditation, progressive muscle relaxation, or gentle yoga. Consider stress counseling if chronic stress present",
                    "Your abnormal blood cell levels may be stress-related. Chronic stress elevates cortisol which suppresses bone marrow. Stress reduction can improve blood cell counts by 15-25% within 4-6 weeks.");
            lifestyle.add("Avoid Environmental Toxins",
                    "Minimize exposure to chemicals, pollutants, and toxins. Use natural cleaning products, avoid pesticides, ensure good ventilation at home/work",
                    "Abnormal blood cell levels can result from environmental toxin exposure. Reducing toxic exposure protects bone marrow and supports healthy cell production.");
        } else {
            lifestyle.add("Stress Management",
                    "Continue stress reduction practices: 10-15 minutes daily meditation, deep breathing, or relaxation exercises",
                    "Maintain balanced blood cell levels through ongoing stress management. Your current values suggest effective stress control.");
        }

        if (rbc != Status.NORMAL || hb != Status.NORMAL) {
            lifestyle.add("Moderate Exercise",
                    "Engage in 30-45 minutes moderate aerobic exercise 4-5 days/week: brisk walking, swimming, cycling. Avoid overexertion until levels normalize",
                    "Your " + (rbc != Status.NORMAL ? "low red blood cell" : "low hemoglobin") + " levels may cause fatigue. Moderate exercise stimulates red blood cell production while avoiding exhaustion. Gradual increase improves oxygen capacity.");
        } else {
            lifestyle.add("Regular Exercise",
                    "Maintain regular physical activity: 150 minutes moderate aerobic exercise weekly, plus 2-3 strength training sessions",
                    "Continue supporting healthy blood cell levels through exercise. Your current values indicate good cardiovascular fitness.");
        }

        dietary.add("Antioxidant-Rich Foods",
                "Consume antioxidant-rich foods daily: berries (blueberries, strawberries), dark leafy greens, nuts, seeds, colorful vegetables, green tea",
                "Antioxidants protect blood cells from oxidative damage and support healthy cell production. Regular intake improves cell lifespan and function.");

        // "Hydration Enhancement" is the escalated tier, not a duplicate of "Hydration"
        if (counts.abnormal() > 0) {
            dietary.add("Hydration Enhancement",
                    "Increase water intake to 10-12 glasses daily. Add electrolyte-rich foods: coconut water, fresh fruits, vegetables",
                    "Your abnormal blood cell levels require enhanced hydration. Proper hydration optimizes blood volume, nutrient delivery, and waste removal. Dehydration concentrates blood cells artificially.");
        } else {
            dietary.add("Hydration",
                    "Maintain adequate hydration: 8-10 glasses of water daily, more if exercising or in hot weather",
                    "Continue supporting optimal blood volume and nutrient transport through proper hydration. Your current levels indicate good hydration status.");
        }

        dietary.add("Protein Quality",
                "Consume high-quality lean proteins: fish, chicken, turkey, eggs, Greek yogurt, legumes. Aim for 0.8-1.0g per kg body weight daily",
                "Protein provides amino acids essential for blood cell production and hemoglobin synthesis. Quality protein supports healthy blood cell turnover and immune function.");

        if (counts.allNormal()) {
            lifestyle.add("Continue Healthy Habits",
                    "Maintain 7-9 hours of quality sleep per night, engage in 150 minutes of moderate aerobic activity weekly, and practice stress management",
                    "Your healthy blood counts reflect good overall wellness. Consistent healthy habits will help maintain these optimal levels.");
            dietary.add("Balanced Nutrition",
                    "Continue eating a variety of colorful fruits and vegetables, lean proteins, whole grains, and healthy fats",
                    "Nutritious, varied diet supports overall health and optimal blood cell production");
            out.referrals().add(SpecialistReferral.routine(ClinicalPanelAnalyzer.GENERAL_PRACTITIONER,
                    "Annual health check-up to monitor and maintain your healthy blood values"));
        }
    }
}
