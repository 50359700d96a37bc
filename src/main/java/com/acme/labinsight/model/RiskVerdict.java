package com.acme.labinsight.model;

import com.acme.labinsight.model.Enums.RiskLevel;

public record RiskVerdict(RiskLevel level, int score) {}
