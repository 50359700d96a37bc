/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Lab Insight Rules Engine
 */

package com.acme.labinsight.recommend;

import com.acme.labinsight.model.Recommendation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Insertion-ordered recommendations keyed by category. Adding a category that
 * is already present is a no-op; the first entry wins.
 */
public final class RecommendationList {
    private final Map<String, Recommendation> byCategory = new LinkedHashMap<>();

    public boolean add(Recommendation r) {
        if (r == null) return false;
        return byCategory.putIfAbsent(r.category(), r) == null;
    }

    public boolean add(String category, String recommendation, String rationale) {
        return add(new Recommendation(category, recommendation, rationale));
    }

    public List<Recommendation> toList() { return List.copyOf(byCategory.values()); }
}
