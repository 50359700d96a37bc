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
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RecommendationListTest {

    @Test
    void firstEntryPerCategoryWins() {
        RecommendationList list = new RecommendationList();
        assertThat(list.add("Hydration", "Drink water", "first")).isTrue();
        assertThat(list.add("Hydration", "Drink more water", "second")).isFalse();

        assertThat(list.toList()).containsExactly(new Recommendation("Hydration", "Drink water", "first"));
    }

    @Test
    void insertionOrderIsKept() {
        RecommendationList list = new RecommendationList();
        list.add("B", "b", "b");
        list.add("A", "a", "a");
        list.add("C", "c", "c");

        assertThat(list.toList()).extracting(Recommendation::category).containsExactly("B", "A", "C");
    }

    @Test
    void nullIsIgnored() {
        RecommendationList list = new RecommendationList();
        assertThat(list.add(null)).isFalse();
        assertThat(list.toList()).isEmpty();
    }
}
