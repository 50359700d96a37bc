package com.acme.labinsight.model;

public record ClassificationCounts(int abnormal, int borderline, int urgentReferrals, int soonReferrals) {
    public boolean allNormal() { return abnormal == 0 && borderline == 0; }
}
