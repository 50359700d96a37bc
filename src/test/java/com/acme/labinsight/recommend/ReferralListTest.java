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

import com.acme.labinsight.model.Enums.Urgency;
import com.acme.labinsight.model.SpecialistReferral;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReferralListTest {

    @Test
    void specialistIsReferredOnce() {
        ReferralList list = new ReferralList();
        list.add(SpecialistReferral.soon("Hematologist", "low WBC"));
        list.add(SpecialistReferral.urgent("Hematologist", "low platelets"));

        assertThat(list.toList()).containsExactly(SpecialistReferral.soon("Hematologist", "low WBC"));
        assertThat(list.count(Urgency.URGENT)).isZero();
        assertThat(list.count(Urgency.SOON)).isEqualTo(1);
    }

    @Test
    void coveringSpecialistSuppressesReferral() {
        ReferralList list = new ReferralList();
        list.add(SpecialistReferral.urgent("Nephrologist", "proteinuria"));

        assertThat(list.add(SpecialistReferral.urgent("Urologist", "pus cells"), "Nephrologist")).isFalse();
        assertThat(list.add(SpecialistReferral.soon("Endocrinologist", "glucose"), "Cardiologist")).isTrue();
        assertThat(list.toList()).extracting(SpecialistReferral::type)
                .containsExactly("Nephrologist", "Endocrinologist");
    }

    @Test
    void fallbackOnlyFillsAnEmptyList() {
        ReferralList empty = new ReferralList();
        assertThatThrownBy(empty::first).isInstanceOf(IllegalStateException.class);
        assertThat(empty.fallback(SpecialistReferral.routine("General Practitioner", "checkup"))).isTrue();
        assertThat(empty.first().type()).isEqualTo("General Practitioner");

        ReferralList filled = new ReferralList();
        filled.add(SpecialistReferral.soon("Cardiologist", "LDL"));
        assertThat(filled.fallback(SpecialistReferral.routine("General Practitioner", "checkup"))).isFalse();
        assertThat(filled.toList()).hasSize(1);
        assertThat(filled.first().type()).isEqualTo("Cardiologist");
    }
}
