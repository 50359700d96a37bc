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

import java.util.ArrayList;
import java.util.List;

/**
 * Specialist referrals for one analysis. A specialist type is referred at most
 * once; the first referral of a type keeps its reason and urgency.
 */
public final class ReferralList {
    private final List<SpecialistReferral> referrals = new ArrayList<>();

    public boolean add(SpecialistReferral r) {
        return add(r, new String[0]);
    }

    /**
     * Adds {@code r} unless its own type, or any of {@code coveredBy}, has
     * already been referred.
     */
    public boolean add(SpecialistReferral r, String... coveredBy) {
        if (r == null || contains(r.type())) return false;
        for (String t : coveredBy) {
            if (contains(t)) return false;
        }
        referrals.add(r);
        return true;
    }

    /** Appends {@code r} only when nothing has been referred yet. */
    public boolean fallback(SpecialistReferral r) {
        if (!referrals.isEmpty()) return false;
        return add(r);
    }

    public boolean contains(String type) {
        return referrals.stream().anyMatch(s -> s.type().equals(type));
    }

    public int count(Urgency urgency) {
        return (int) referrals.stream().filter(s -> s.urgency() == urgency).count();
    }

    /** Earliest referral. Clinical panels always hold one once the fallback has run. */
    public SpecialistReferral first() {
        if (referrals.isEmpty()) throw new IllegalStateException("No specialist has been referred yet");
        return referrals.get(0);
    }

    public List<SpecialistReferral> toList() { return List.copyOf(referrals); }
}
