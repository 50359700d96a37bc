/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Lab Insight Rules Engine
 */

package com.acme.labinsight;

import com.acme.labinsight.model.AnalysisResult;
import com.acme.labinsight.model.ExternalRiskAssessment;
import com.acme.labinsight.model.ParameterFinding;
import com.acme.labinsight.model.RawPanel;
import com.acme.labinsight.model.Recommendation;
import com.acme.labinsight.model.SpecialistReferral;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Instant;
import java.util.*;

@CommandLine.Command(
        name = "lab-insight",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "Rule-based interpretation of a lab panel (CBC, Lipid Profile, Urinalysis) fused with an external risk assessment.",
        sortOptions = false
)
public class LabInsightApp implements java.util.concurrent.Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(LabInsightApp.class);

    static final int EXIT_BAD_REQUEST = 3;

    @CommandLine.Option(names = "--input", description = "JSON request file: {\"panel_type\", \"values\", \"risk\": {\"risk_level\", \"risk_score\"}}.")
    private Path input;

    @CommandLine.Option(names = "--panel-type", description = "Panel type tag (cbc, lipid, urinalysis; anything else is analysed generically).")
    private String panelType;

    @CommandLine.Option(names = "--value", description = "Lab value as key=value. Repeatable.")
    private Map<String, String> values = new LinkedHashMap<>();

    @CommandLine.Option(names = "--risk-level", description = "External risk level: low, moderate or high.")
    private String riskLevel;

    @CommandLine.Option(names = "--risk-score", description = "External risk score, 0-100.")
    private Integer riskScore;

    @CommandLine.Option(names = "--out", description = "Output JSON report path. Default: standard output.")
    private Path out;

    @CommandLine.Option(names = "--compact", defaultValue = "false", description = "Write single-line JSON. Default: ${DEFAULT-VALUE}")
    private boolean compact;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public static void main(String[] args) {
        int exitCode = new CommandLine(new LabInsightApp()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        Request request;
        try {
            request = readRequest();
        } catch (IOException | IllegalArgumentException e) {
            log.error("Cannot read analysis request: {}", e.getMessage());
            return EXIT_BAD_REQUEST;
        }

        AnalysisResult result = new LabRulesEngine().analyze(request.panel(), request.risk());
        Map<String, Object> report = toReport(request, result);

        var writer = compact ? MAPPER.writer() : MAPPER.writerWithDefaultPrettyPrinter();
        if (out != null) {
            writer.writeValue(out.toFile(), report);
            log.info("Report written to {}", out);
        } else {
            PrintWriter stdout = spec.commandLine().getOut();
            stdout.println(writer.writeValueAsString(report));
            stdout.flush();
        }

        return switch (result.correctedRiskLevel()) {
            case LOW      -> 0;
            case MODERATE -> 1;
            case HIGH     -> 2;
        };
    }

    record Request(RawPanel panel, ExternalRiskAssessment risk) {}

    /** File first, then options on top. A panel type is the only required field. */
    Request readRequest() throws IOException {
        String type = null;
        Map<String, Object> vals = new LinkedHashMap<>();
        String level = null;
        int score = 0;

        if (input != null) {
            JsonNode root = MAPPER.readTree(input.toFile());
            if (root == null || !root.isObject()) {
                throw new IllegalArgumentException("request file " + input + " does not hold a JSON object");
            }
            type = root.path("panel_type").asText(null);
            JsonNode v = root.path("values");
            if (v.isObject()) {
                vals.putAll(MAPPER.convertValue(v, new TypeReference<Map<String, Object>>() {}));
            }
            JsonNode risk = root.path("risk");
            level = risk.path("risk_level").asText(null);
            score = risk.path("risk_score").asInt(0);
        }

        if (panelType != null) type = panelType;
        vals.putAll(values);
        if (riskLevel != null) level = riskLevel;
        if (riskScore != null) score = riskScore;

        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("panel type missing (use --panel-type or \"panel_type\" in --input)");
        }
        return new Request(new RawPanel(type, vals), ExternalRiskAssessment.of(level, score));
    }

    static Map<String, Object> toReport(Request request, AnalysisResult result) {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("timestamp_utc", Instant.now());
        report.put("tool", ordered("name", "lab_insight", "version", "java-1.0.0"));

        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("panel_type", request.panel().panelType());
        inputs.put("resolved_panel", request.panel().type().displayName());
        inputs.put("values", request.panel().values());
        inputs.put("external_risk", ordered(
                "level", request.risk().riskLevel().label(),
                "score", request.risk().riskScore()));
        report.put("inputs", inputs);

        report.put("risk", ordered("level", result.correctedRiskLevel().label(), "score", result.correctedRiskScore()));
        report.put("detailed_findings", result.narrative());

        List<Map<String, Object>> breakdown = new ArrayList<>();
        for (ParameterFinding f : result.findings()) {
            Map<String, Object> o = new LinkedHashMap<>();
            o.put("parameter", f.parameter());
            o.put("value", f.value());
            o.put("normal_range", f.normalRange());
            o.put("status", f.status().label());
            o.put("interpretation", f.interpretation());
            breakdown.add(o);
        }
        report.put("lab_value_breakdown", breakdown);
        report.put("lifestyle_recommendations", recommendations(result.lifestyleRecommendations()));
        report.put("dietary_recommendations", recommendations(result.dietaryRecommendations()));

        List<Map<String, Object>> specialists = new ArrayList<>();
        for (SpecialistReferral r : result.suggestedSpecialists()) {
            Map<String, Object> o = new LinkedHashMap<>();
            o.put("type", r.type());
            o.put("reason", r.reason());
            o.put("urgency", r.urgency().label());
            specialists.add(o);
        }
        report.put("suggested_specialists", specialists);
        return report;
    }

    private static Map<String, Object> ordered(String k1, Object v1, String k2, Object v2) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(k1, v1);
        m.put(k2, v2);
        return m;
    }

    private static List<Map<String, Object>> recommendations(List<Recommendation> recs) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (Recommendation r : recs) {
            Map<String, Object> o = new LinkedHashMap<>();
            o.put("category", r.category());
            o.put("recommendation", r.recommendation());
            o.put("rationale", r.rationale());
            out.add(o);
        }
        return out;
    }
}
