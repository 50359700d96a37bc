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

import static com.acme.labinsight.panels.LipidPanelAnalyzer.*;
import static com.acme.labinsight.util.FormatUtil.plain;

final class LipidRecommendations {
    private LipidRecommendations() {}

    static void apply(LipidValues v, ClassificationCounts counts, AnalysisResultBuilder out) {
        RecommendationList lifestyle = out.lifestyle();
        RecommendationList dietary = out.dietary();

        Status chol = out.statusOf(CHOLESTEROL);
        Status ldl = out.statusOf(LDL);
        Status hdl = out.statusOf(HDL);
        Status tg = out.statusOf(TRIGLYCERIDES);

        String cholText = plain(v.cholesterol());
        String ldlText = plain(v.ldl());
        String hdlText = plain(v.hdl());
        String tgText = plain(v.triglycerides());

        if (chol != Status.NORMAL || ldl != Status.NORMAL || tg != Status.NORMAL) {
            String driver = chol != Status.NORMAL ? "total cholesterol (" + cholText + " mg/dL)"
                    : ldl != Status.NORMAL ? "LDL (" + ldlText + " mg/dL)"
                    : "triglycerides (" + tgText + " mg/dL)";
            dietary.add("Reduce Saturated Fats (Priority)",
                    "Limit saturated fats to <7% of daily calories (about 15g/day for 2000 cal diet): minimize red meat to 1-2x/week, eliminate butter/cheese/full-fat dairy, choose lean proteins",
                    "Your " + driver + " will benefit from saturated fat reduction. Each 1% reduction in saturated fat intake lowers LDL by 1-2 mg/dL. Target reduction: 10-20 mg/dL improvement.");
            dietary.add("Increase Omega-3 Fatty Acids (Critical)",
                    "Consume fatty fish 3-4 times weekly (salmon, mackerel, sardines, herring) OR take high-quality fish oil: 2000-3000mg EPA+DHA daily",
                    "Your triglycerides (" + tgText + " mg/dL) require omega-3 intervention. Clinical studies show 2-3g EPA+DHA daily can lower triglycerides by 25-35% (target: "
                            + Math.round(v.triglycerides() * 0.7) + "-" + Math.round(v.triglycerides() * 0.75) + " mg/dL). Also raises HDL by 5-10%.");
            dietary.add("Soluble Fiber (Essential)",
                    "Consume 15-30g soluble fiber daily: start day with oatmeal (5g), add beans to meals (6-8g), eat apples/citrus (3-4g), include barley/psyllium supplements",
                    "Your LDL (" + ldlText + " mg/dL) needs fiber intervention. Every 10g soluble fiber daily reduces LDL by 5-7 mg/dL. Target: bring your LDL to optimal <100 mg/dL (current reduction needed: "
                            + plain(v.ldl() - 100) + " mg/dL).");
            dietary.add("Eliminate Trans Fats (Immediate)",
                    "Zero tolerance for trans fats: check all food labels for \"partially hydrogenated oil\", avoid all fried fast foods, commercial baked goods, microwave popcorn, margarine",
                    "Trans fats raise your LDL while lowering HDL - the worst combination. Complete elimination can improve your cholesterol ratio by 15-20% within 4-6 weeks.");
        } else {
            dietary.add("Maintain Heart-Healthy Fats",
                    "Continue consuming healthy fats: fatty fish 2-3x/week, nuts (1-2 oz daily), olive oil, avocados",
                    "Your optimal lipid levels indicate excellent dietary fat choices. Omega-3s and monounsaturated fats support ongoing cardiovascular health.");
        }

        if (hdl == Status.ABNORMAL) {
            dietary.add("Boost HDL with Healthy Fats",
                    "Increase monounsaturated fats: use olive oil exclusively (3-4 Tbsp/day), eat avocado daily, consume raw nuts (almonds, walnuts) 1.5-2 oz/day",
                    "Your low HDL (" + hdlText + " mg/dL) needs targeted intervention. Monounsaturated fats can raise HDL by 8-12% (target: bring you to optimal ≥60 mg/dL). Every 1 Tbsp olive oil daily can raise HDL by 1-2 mg/dL.");
            dietary.add("Purple & Red Foods for HDL",
                    "Eat anthocyanin-rich foods daily: blueberries, blackberries, red grapes, red cabbage, eggplant - 1-2 cups daily",
                    "Your HDL (" + hdlText + " mg/dL) benefits from anthocyanins which increase HDL by 5-8%. These antioxidants also improve HDL functionality, making it more effective at removing cholesterol from arteries.");
        }

        if (tg != Status.NORMAL) {
            dietary.add("Eliminate Simple Sugars (Critical)",
                    "Zero added sugars: no soda, juice, candy, pastries, sweetened coffee drinks. Read labels - avoid anything with >5g sugar. Choose whole fruits only (limit to 2-3 servings/day)",
                    "Your triglycerides (" + tgText + " mg/dL) are directly raised by sugar. Each 25g sugar eliminated can lower triglycerides by 20-30 mg/dL. Your target reduction: "
                            + plain(Math.max(0, v.triglycerides() - 150)) + " mg/dL to reach normal <150 mg/dL.");
            dietary.add("Replace Refined Carbs",
                    "Switch all refined grains to whole grains: brown rice, quinoa, 100% whole wheat bread, steel-cut oats. Limit total carbs to 40-45% of calories",
                    "Refined carbs spike your triglycerides (current: " + tgText + " mg/dL). Whole grain substitution can lower triglycerides by 15-20%. The fiber slows digestion, preventing triglyceride surges.");
            lifestyle.add("Strict Alcohol Limitation",
                    v.triglycerides() >= 200
                            ? "Complete alcohol abstinence until triglycerides normalize to <150 mg/dL"
                            : "Maximum 1 drink every 3-4 days. Completely avoid if triglycerides worsen",
                    "Your triglycerides (" + tgText + " mg/dL) are highly sensitive to alcohol. The liver prioritizes alcohol metabolism, converting it directly to triglycerides. Abstinence can lower levels by 30-40% within 2-4 weeks.");
        }

        if (chol == Status.ABNORMAL || ldl == Status.ABNORMAL) {
            lifestyle.add("Intensive Aerobic Exercise",
                    "Perform 200-250 minutes moderate-vigorous aerobic activity weekly: brisk walking, jogging, cycling, swimming. Include 2-3 high-intensity interval training (HIIT) sessions",
                    "Your high cholesterol/LDL (Total: " + cholText + " mg/dL, LDL: " + ldlText + " mg/dL) requires intensive exercise intervention. This volume can lower LDL by 10-15%, raise HDL by 8-12%, and reduce cardiovascular risk by 25-30%.");
        } else if (chol == Status.BORDERLINE || ldl == Status.BORDERLINE) {
            lifestyle.add("Moderate Aerobic Exercise",
                    "Maintain 150-180 minutes moderate aerobic activity weekly: brisk walking, cycling, swimming, dancing. Gradually increase intensity",
                    "Your borderline cholesterol levels respond well to moderate exercise. This can prevent progression to high cholesterol and improve lipid profile by 8-10%.");
        } else {
            lifestyle.add("Exercise Maintenance",
                    "Continue 150+ minutes moderate aerobic activity weekly plus 2-3 strength sessions. Vary activities for sustained benefits",
                    "Your optimal cholesterol levels indicate effective exercise habits. Continue current regimen to maintain cardiovascular health.");
        }

        if (ldl != Status.NORMAL || chol != Status.NORMAL || tg != Status.NORMAL) {
            lifestyle.add("Weight Optimization (Priority)",
                    "Target 1-2 lbs weight loss weekly through calorie reduction (500 cal/day deficit) and exercise until BMI 18.5-24.9. Track progress weekly",
                    "Your lipid abnormalities strongly correlate with excess weight. Every 10 lbs lost can: reduce LDL by 5-8 mg/dL, increase HDL by 2-3 mg/dL, lower triglycerides by 20-30 mg/dL.");
        } else if (hdl == Status.ABNORMAL) {
            lifestyle.add("Weight Management",
                    "Maintain healthy BMI 18.5-24.9. If overweight, target 5-10% weight loss over 3-6 months",
                    "Low HDL improves significantly with weight loss. Even 5-10% reduction can raise HDL by 5-8 mg/dL and improve cholesterol ratio.");
        }

        if (chol != Status.NORMAL || ldl != Status.NORMAL || hdl != Status.NORMAL) {
            lifestyle.add("Tobacco Cessation (Critical)",
                    "Quit all tobacco products immediately. Join cessation program, use nicotine replacement therapy, seek counseling support",
                    "Smoking worsens your lipid profile. Quitting can: increase HDL by 10-15% within 8 weeks, improve arterial function, reduce heart disease risk by 50% within 1 year.");
        }

        if (tg != Status.NORMAL) {
            lifestyle.add("Evening Exercise",
                    "Add 20-30 minute evening walk after dinner, 5-7 days weekly. This helps metabolize post-meal triglycerides",
                    "Your elevated triglycerides benefit from evening activity. Post-dinner exercise can lower triglycerides by 15-20% and improve fat metabolism overnight.");
        }

        if (counts.abnormal() >= 2 || (counts.abnormal() >= 1 && counts.borderline() >= 1)) {
            lifestyle.add("Comprehensive Stress Management",
                    "Practice 30 minutes daily stress reduction: mindfulness meditation, yoga, tai chi, or progressive relaxation. Consider stress counseling",
                    "Multiple lipid abnormalities indicate chronic stress impact. Stress elevates cortisol which worsens cholesterol. Consistent stress management can improve lipid profile by 8-12% within 8-12 weeks.");
        } else {
            lifestyle.add("Stress Management",
                    "Maintain daily stress reduction practices: 15-20 minutes meditation, deep breathing, or relaxation exercises",
                    "Continue supporting healthy lipid metabolism through stress management. Chronic stress negatively affects cholesterol levels.");
        }

        if (chol != Status.NORMAL || ldl != Status.NORMAL) {
            lifestyle.add("Sleep Quality",
                    "Prioritize 7-8 hours quality sleep nightly. Maintain consistent sleep schedule, dark cool room, no screens 1 hour before bed",
                    "Poor sleep raises LDL and triglycerides while lowering HDL. Quality sleep can improve lipid profile by 5-8% and reduce cardiovascular risk.");
        }

        if (counts.allNormal()) {
            lifestyle.add("Maintain Heart-Healthy Lifestyle",
                    "Continue regular cardiovascular exercise (150 minutes moderate or 75 minutes vigorous per week), maintain healthy weight, and avoid smoking",
                    "Your optimal lipid levels reflect excellent cardiovascular habits. Consistency is key to long-term heart health.");
            dietary.add("Continue Heart-Healthy Diet",
                    "Keep up your balanced diet rich in fruits, vegetables, whole grains, lean proteins, and healthy fats (omega-3s, nuts, olive oil)",
                    "Your dietary choices are clearly supporting optimal cholesterol levels and cardiovascular health.");
            out.referrals().add(SpecialistReferral.routine(ClinicalPanelAnalyzer.GENERAL_PRACTITIONER,
                    "Annual lipid panel check to continue monitoring your excellent cardiovascular health"));
        }
    }
}
