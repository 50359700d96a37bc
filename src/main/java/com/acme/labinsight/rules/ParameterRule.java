/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Lab Insight Rules Engine
 */

package com.acme.labinsight.rules;

import com.acme.labinsight.model.Enums.Status;
import com.acme.labinsight.model.ParameterFinding;
import com.acme.labinsight.model.SpecialistReferral;
import com.acme.labinsight.recommend.ReferralList;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One row of a classification table: an ordered list of bands, tested top to
 * bottom, most severe first. The first matching band decides status and
 * interpretation and may refer to a specialist; no match means normal.
 *
 * @param <T> normalized value type (a double or a vocabulary word)
 */
public final class ParameterRule<T> {

    private record Band<T>(Predicate<T> test, Status status, Function<T, String> interpretation,
                           Function<T, SpecialistReferral> referral, String[] coveredBy) {}

    private final String parameter;
    private final String normalRange;
    private final Function<T, String> display;
    private final List<Band<T>> bands;
    private final Function<T, String> normalInterpretation;

    private ParameterRule(Builder<T> b) {
        this.parameter = b.parameter;
        this.normalRange = b.normalRange;
        this.display = b.display;
        this.bands = List.copyOf(b.bands);
        this.normalInterpretation = b.normalInterpretation;
    }

    public ParameterFinding classify(T value, ReferralList referrals) {
        return classify(value, display.apply(value), referrals);
    }

    public ParameterFinding classify(T value, String shownValue, ReferralList referrals) {
        Band<T> band = match(value);
        if (band == null) {
            return new ParameterFinding(parameter, shownValue, normalRange, Status.NORMAL, normalInterpretation.apply(value));
        }
        if (band.referral() != null && referrals != null) {
            referrals.add(band.referral().apply(value), band.coveredBy());
        }
        return new ParameterFinding(parameter, shownValue, normalRange, band.status(), band.interpretation().apply(value));
    }

    private Band<T> match(T value) {
        for (Band<T> b : bands) {
            if (b.test().test(value)) return b;
        }
        return null;
    }

    public static <T> Builder<T> of(String parameter, String normalRange) {
        return new Builder<>(parameter, normalRange);
    }

    public static final class Builder<T> {
        private final String parameter;
        private final String normalRange;
        private Function<T, String> display = String::valueOf;
        private final List<Band<T>> bands = new ArrayList<>();
        private Function<T, String> normalInterpretation;

        private Builder(String parameter, String normalRange) {
            this.parameter = Objects.requireNonNull(parameter);
            this.normalRange = Objects.requireNonNull(normalRange);
        }

        public Builder<T> display(Function<T, String> display) {
            this.display = display;
            return this;
        }

        public Builder<T> when(Predicate<T> test, Status status, String interpretation) {
            return when(test, status, v -> interpretation);
        }

        public Builder<T> when(Predicate<T> test, Status status, Function<T, String> interpretation) {
            bands.add(new Band<>(test, status, interpretation, null, new String[0]));
            return this;
        }

        /** Attaches a referral to the band added last. */
        public Builder<T> refer(SpecialistReferral referral) {
            return refer(v -> referral);
        }

        /**
         * Attaches a referral to the band added last, skipped when its type or
         * any of {@code coveredBy} is already referred.
         */
        public Builder<T> refer(Function<T, SpecialistReferral> referral, String... coveredBy) {
            if (bands.isEmpty()) throw new IllegalStateException("refer() before any when() for " + parameter);
            Band<T> last = bands.remove(bands.size() - 1);
            bands.add(new Band<>(last.test(), last.status(), last.interpretation(), referral, coveredBy));
            return this;
        }

        public ParameterRule<T> otherwise(String interpretation) {
            return otherwise(v -> interpretation);
        }

        public ParameterRule<T> otherwise(Function<T, String> interpretation) {
            this.normalInterpretation = Objects.requireNonNull(interpretation);
            return new ParameterRule<>(this);
        }
    }
}
