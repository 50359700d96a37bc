package com.acme.labinsight.model;

import com.acme.labinsight.model.Enums.Urgency;

public record SpecialistReferral(String type, String reason, Urgency urgency) {
    public static SpecialistReferral routine(String t, String r) { return new SpecialistReferral(t, r, Urgency.ROUTINE); }
    public static SpecialistReferral soon(String t, String r) { return new SpecialistReferral(t, r, Urgency.SOON); }
    public static SpecialistReferral urgent(String t, String r) { return new SpecialistReferral(t, r, Urgency.URGENT); }
}
