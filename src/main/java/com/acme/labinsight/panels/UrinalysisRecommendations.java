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
import com.acme.labinsight.model.Enums.RiskLevel;
import com.acme.labinsight.model.Enums.Status;
import com.acme.labinsight.model.SpecialistReferral;
import com.acme.labinsight.recommend.RecommendationList;
import com.acme.labinsight.util.FormatUtil;

import static com.acme.labinsight.panels.UrinalysisPanelAnalyzer.*;
import static com.acme.labinsight.util.FormatUtil.plain;

final class UrinalysisRecommendations {
    private UrinalysisRecommendations() {}

    static void apply(UrinalysisValues v, ClassificationCounts counts, RiskLevel externalLevel,
                      AnalysisResultBuilder out) {
        RecommendationList lifestyle = out.lifestyle();
        RecommendationList dietary = out.dietary();

        Status ph = out.statusOf(PH);
        Status clarity = out.statusOf(CLARITY);
        Status sg = out.statusOf(SPECIFIC_GRAVITY);
        Status protein = out.statusOf(PROTEIN);
        Status pus = out.statusOf(PUS_CELLS);
        Status red = out.statusOf(RED_CELLS);

        String pusText = plain(v.pusCells());
        String redText = plain(v.redCells());
        String phText = FormatUtil.fixed(v.ph(), 1);
        String sgText = FormatUtil.fixed(v.specificGravity(), 3);

        if (pus == Status.ABNORMAL || red == Status.ABNORMAL) {
            dietary.add("Cranberry & UTI Prevention (Critical)",
                    "Drink 100% pure cranberry juice (8-16 oz daily) or take cranberry supplements (500mg twice daily). Avoid sweetened versions.",
                    "Your high pus cells (" + pusText + "/HPF) and red cells (" + redText
                            + "/HPF) indicate UTI. Cranberries contain proanthocyanidins that prevent bacteria from adhering to urinary tract walls, reducing infection by 35-40%. Start immediately alongside antibiotics.");
            dietary.add("Aggressive Hydration for UTI (Priority)",
                    "Drink 12-14 glasses (96-112 oz) water daily, spreading intake evenly. Urinate every 2-3 hours even if not urgent. Add lemon to water for antibacterial benefit.",
                    "Your UTI (pus " + pusText + "/HPF, RBC " + redText
                            + "/HPF) requires flushing bacteria from bladder. Aggressive hydration dilutes urine, reduces bacterial concentration by 60%, and helps eliminate infection faster. Critical for recovery.");
            dietary.add("Vitamin C Supplementation",
                    "Take 500-1000mg vitamin C daily. Eat citrus fruits, bell peppers, kiwi, strawberries throughout day.",
                    "Vitamin C acidifies urine, creating hostile environment for bacteria. Can reduce UTI recurrence by 50% and support immune system fighting current infection.");
            dietary.add("Avoid Bladder Irritants (Critical)",
                    "Eliminate: caffeine (coffee, tea, soda), alcohol, spicy foods, artificial sweeteners, citrus juices (except cranberry). These worsen UTI symptoms.",
                    "Your elevated pus/red cells indicate active infection. Bladder irritants increase inflammation by 40%, worsen burning/frequency, and slow healing. Elimination provides symptom relief within 24-48 hours.");
            lifestyle.add("UTI Hygiene Protocol (Essential)",
                    "Wipe front to back after bathroom use. Urinate immediately after sexual activity. Wear cotton underwear. Avoid tight clothing. Change underwear daily.",
                    "Your UTI requires strict hygiene to prevent reinfection. These measures reduce bacterial entry into urethra by 70%. Critical for preventing chronic recurrent UTIs.");
            lifestyle.add("Complete Antibiotic Course",
                    "Take full course of antibiotics as prescribed, even when symptoms improve. Do NOT stop early. Set phone reminders for doses.",
                    "Your high WBC count (" + pusText
                            + "/HPF) requires complete bacterial eradication. Stopping antibiotics early allows resistant bacteria to survive, causing recurrent infection in 40% of cases. Complete course prevents resistance.");
            lifestyle.add("Rest and Immune Support",
                    "Get 8-9 hours sleep nightly during infection. Avoid strenuous exercise temporarily. Use heating pad on lower abdomen for pain relief (20 min sessions).",
                    "Sleep boosts immune system by 60%, helping fight infection faster. Rest allows body to focus energy on healing. Heat increases blood flow to bladder, reducing pain and supporting recovery.");
        } else if (pus == Status.BORDERLINE || red == Status.BORDERLINE || clarity != Status.NORMAL) {
            dietary.add("Enhanced Hydration",
                    "Increase water intake to 10-12 glasses (80-96 oz) daily. Monitor urine color - aim for pale yellow.",
                    "Your borderline findings (pus " + pusText + "/HPF, RBC " + redText + "/HPF, " + v.clarity()
                            + " urine) benefit from enhanced hydration to flush urinary tract and prevent infection progression.");
            dietary.add("Cranberry Prevention",
                    "Consider daily cranberry supplement (500mg) or 6-8 oz pure cranberry juice as preventive measure.",
                    "Borderline urinary findings suggest need for prevention. Cranberry reduces UTI risk by 35% through bacterial anti-adhesion properties.");
        }

        if (protein == Status.ABNORMAL) {
            dietary.add("Strict Sodium Restriction (Critical)",
                    "Limit sodium to 1,500mg daily maximum: no processed foods, no restaurant meals, cook all food fresh. Track sodium in food diary. Use herbs/spices instead of salt",
                    "Your protein in urine (" + v.protein()
                            + ") indicates kidney stress. High sodium worsens proteinuria by 30-40%. Every 1000mg sodium reduction can decrease protein excretion by 15-20%. This is your #1 dietary priority for kidney protection.");
            dietary.add("Precise Protein Management",
                    "Calculate exact protein needs: 0.6-0.8g per kg ideal body weight daily. If 70kg = 42-56g protein/day. Choose high-biological-value proteins: eggs (6g each), fish (20g/serving), chicken breast (25g/serving)",
                    "Your proteinuria (" + v.protein()
                            + ") requires protein restriction. Excess protein forces kidneys to work 50% harder. Reducing to 0.8g/kg can decrease protein in urine by 20-30% and slow kidney damage progression by 40%.");
            dietary.add("Kidney-Protective Foods (Priority)",
                    "Daily kidney support: red bell peppers (high in vitamins, low potassium), cabbage, cauliflower, onions, apples, cranberries. Avoid bananas, oranges, tomatoes, potatoes (high potassium)",
                    "Proteinuria damages kidneys. These specific foods reduce oxidative stress on kidneys by 25-30% while avoiding high-potassium foods that stressed kidneys can't handle. Target: normalize protein in urine.");
            dietary.add("Phosphorus Control",
                    "Limit phosphorus to 800-1000mg daily: avoid dairy, nuts, beans, dark sodas, processed foods with phosphate additives. Check labels for ingredients ending in \"phosphate\"",
                    "Kidney damage from proteinuria impairs phosphorus excretion. High phosphorus accelerates kidney disease by 35%. Controlling it protects remaining kidney function.");
        } else if (protein == Status.BORDERLINE) {
            dietary.add("Moderate Sodium Reduction",
                    "Reduce sodium to 2,000-2,300mg daily: minimize processed foods, don't add salt at table, use low-sodium products",
                    "Your trace protein in urine suggests early kidney stress. Moderate sodium restriction (2,000mg) can prevent progression to proteinuria and reduce kidney workload by 15-20%.");
            dietary.add("Balanced Protein",
                    "Maintain protein at 0.8-1.0g per kg body weight. Mix plant and animal proteins: fish, poultry, legumes, tofu",
                    "Trace protein indicates need for kidney-conscious eating. This protein level supports nutrition while preventing kidney stress that could worsen proteinuria.");
        } else {
            dietary.add("Kidney-Healthy Nutrition",
                    "Continue balanced diet: moderate sodium (<2,300mg), adequate protein (0.8-1.0g/kg), plenty of fruits and vegetables",
                    "Your normal urine protein indicates healthy kidney function. Maintain these habits to prevent future kidney issues.");
        }

        if (ph == Status.ABNORMAL) {
            if (v.ph() < 4.5) {
                dietary.add("Alkalinizing Foods (Critical)",
                        "Increase alkaline foods aggressively: eat 6-8 servings vegetables daily, 3-4 servings fruits, minimize animal protein to 1 serving/day temporarily. Focus on: spinach, kale, cucumber, broccoli, avocado",
                        "Your very acidic urine pH (" + phText
                                + ") increases uric acid kidney stone risk by 300%. Alkaline diet can raise pH by 0.8-1.2 units within 1-2 weeks, reducing stone formation risk to normal levels. Target pH: 6.0-7.0.");
                dietary.add("Citrate Supplementation",
                        "Drink 8 oz lemon water or lime water 3-4 times daily. Add 2 Tbsp lemon juice to each glass. Alternatively: potassium citrate supplement (consult doctor)",
                        "Your pH " + phText
                                + " needs citrate. Citrate raises urine pH and prevents stone formation by binding calcium. Can increase pH by 0.5-0.8 units and reduce stone risk by 60-70%.");
            } else {
                dietary.add("Acidifying Foods",
                        "Increase protein slightly: add lean meats, fish, eggs to meals. Include whole grains. Reduce very alkaline foods temporarily",
                        "Your alkaline urine pH (" + phText
                                + ") may increase calcium phosphate stone risk. Moderate protein intake can lower pH by 0.4-0.6 units to optimal range, reducing stone formation.");
            }
        } else if (v.ph() < 5.0 || v.ph() > 7.5) {
            dietary.add("pH Balance",
                    v.ph() < 5.5 ? "Add more vegetables and fruits to each meal to gently raise pH"
                            : "Include moderate protein with meals for pH balance",
                    "Your borderline pH (" + phText
                            + ") benefits from dietary adjustment. Small changes can optimize pH and reduce any stone formation risk.");
        }

        if (sg == Status.ABNORMAL) {
            if (v.specificGravity() > 1.030) {
                dietary.add("Aggressive Hydration & Electrolytes",
                        "Drink 12-14 glasses (96-112 oz) water daily, spread evenly. Add electrolyte drinks (no sugar): coconut water, diluted sports drinks. Eat water-rich foods: watermelon, cucumber, celery",
                        "Your high specific gravity (" + sgText
                                + ") indicates dehydration. This concentrates toxins, stresses kidneys, increases stone risk by 200%. Aggressive hydration can normalize SG to 1.010-1.020 within 24-48 hours.");
            } else {
                dietary.add("Electrolyte Optimization",
                        "Add electrolytes to water: pinch of sea salt, coconut water, or electrolyte tablets. Don't over-hydrate - aim for balanced intake based on thirst",
                        "Your low specific gravity (" + sgText
                                + ") suggests dilute urine. While hydration is good, ensure adequate electrolyte balance for optimal kidney function.");
            }
        }

        if (protein == Status.ABNORMAL) {
            lifestyle.add("Intensive Hydration",
                    "Increase water intake to 10-12 glasses (80-96 oz) daily. Drink consistently throughout day, not all at once. Monitor urine color - aim for pale yellow",
                    "Your protein in urine (" + v.protein()
                            + ") requires enhanced hydration to flush kidneys. Adequate fluid intake can reduce protein excretion by 15-20% and prevent kidney stone formation.");
        } else if (protein == Status.BORDERLINE || ph != Status.NORMAL || sg != Status.NORMAL) {
            lifestyle.add("Enhanced Hydration",
                    "Drink 8-10 glasses (64-80 oz) water daily, spread evenly throughout day. Add lemon for pH balance if needed",
                    "Your borderline findings benefit from consistent hydration. Proper fluid intake supports kidney filtration and helps normalize urine parameters.");
        } else {
            lifestyle.add("Hydration Maintenance",
                    "Maintain 8-10 glasses (64-80 oz) of water daily, adjusting for exercise and climate",
                    "Continue supporting healthy kidney function through adequate hydration. Your normal results indicate good fluid intake.");
        }

        if (protein != Status.NORMAL) {
            lifestyle.add("Blood Pressure Monitoring (Critical)",
                    "Check blood pressure daily at same time. Keep log. Target <120/80 mmHg through DASH diet, exercise, stress reduction, and medication if prescribed",
                    "Proteinuria indicates kidney stress often from high blood pressure. Every 10 mmHg BP reduction can decrease protein excretion by 20-30% and slow kidney disease progression by 40%.");
            lifestyle.add("Eliminate Nephrotoxic Substances",
                    "Completely avoid NSAIDs (ibuprofen, naproxen, aspirin) unless prescribed by doctor. Stop all tobacco use. Eliminate alcohol consumption",
                    "Your protein in urine indicates kidney damage. NSAIDs reduce kidney blood flow by 20%, tobacco decreases filtration by 15%, alcohol causes direct kidney cell damage. Elimination is critical for kidney recovery.");
            lifestyle.add("Gentle Exercise Only",
                    "Perform 20-30 minutes low-impact exercise daily: walking, swimming, gentle yoga. Avoid intense workouts until protein normalizes",
                    "Intense exercise temporarily increases protein in urine. Gentle activity supports kidney health and blood pressure control without stressing kidneys further.");
        } else {
            lifestyle.add("Regular Exercise",
                    "Maintain 30-45 minutes moderate exercise most days: brisk walking, swimming, cycling",
                    "Regular activity supports kidney health, controls blood pressure/blood sugar, and reduces kidney disease risk factors.");
        }

        if (ph == Status.ABNORMAL || protein != Status.NORMAL || sg != Status.NORMAL) {
            lifestyle.add("Blood Sugar Control",
                    "Monitor blood glucose if diabetic. Maintain HbA1c <7%. Check fasting glucose quarterly even if not diabetic",
                    "Abnormal urine parameters often indicate early diabetes impact on kidneys. Tight glucose control can prevent kidney disease progression by 50-60%.");
        }

        if (protein == Status.ABNORMAL) {
            lifestyle.add("Sleep Optimization for Kidney Repair",
                    "Prioritize 8-9 hours quality sleep nightly. Sleep on back with slight elevation. Maintain consistent sleep schedule",
                    "Kidney repair occurs primarily during deep sleep. Quality sleep reduces proteinuria by 10-15% and supports kidney cell regeneration.");
        }

        if (ph != Status.NORMAL) {
            boolean acidic = v.ph() < 5.5;
            lifestyle.add("Dietary pH Management",
                    acidic ? "Increase alkaline foods to balance pH: more vegetables, fruits, nuts. Reduce animal protein temporarily"
                            : "Balance diet with appropriate protein and whole grains to normalize pH",
                    "Your urine pH (" + phText + ") " + (acidic
                            ? "is too acidic, increasing kidney stone risk. Alkaline foods can raise pH by 0.5-1.0 units"
                            : "needs balanced nutrition to normalize. Diet significantly influences urine pH") + ".");
        }

        if (counts.allNormal() && externalLevel == RiskLevel.LOW) {
            lifestyle.add("Maintain Kidney Health",
                    "Continue adequate daily hydration (8-10 glasses water), maintain healthy weight, and engage in regular physical activity",
                    "Your healthy urinalysis reflects good kidney function and hydration. These habits support long-term renal health.");
            dietary.add("Kidney-Friendly Diet",
                    "Continue balanced diet with moderate protein, plenty of fruits and vegetables, and limited processed foods",
                    "Your current dietary patterns support optimal kidney function and urinary health.");
            out.referrals().add(SpecialistReferral.routine(ClinicalPanelAnalyzer.GENERAL_PRACTITIONER,
                    "Annual urinalysis to continue monitoring your excellent kidney and urinary tract health"));
        }
    }
}
