package com.acme.labinsight.model;

import com.acme.labinsight.model.Enums.Status;

public record ParameterFinding(String parameter, String value, String normalRange, Status status, String interpretation) {
    public static ParameterFinding normal(String p, String v, String r, String i) { return new ParameterFinding(p, v, r, Status.NORMAL, i); }
    public static ParameterFinding borderline(String p, String v, String r, String i) { return new ParameterFinding(p, v, r, Status.BORDERLINE, i); }
    public static ParameterFinding abnormal(String p, String v, String r, String i) { return new ParameterFinding(p, v, r, Status.ABNORMAL, i); }
}
