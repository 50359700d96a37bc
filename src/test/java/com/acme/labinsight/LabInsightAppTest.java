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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class LabInsightAppTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    @TempDir
    Path tmp;

    private static int run(String... args) {
        return new CommandLine(new LabInsightApp()).execute(args);
    }

    @Test
    void optionsOnlyRequestWritesReport() throws Exception {
        Path out = tmp.resolve("report.json");

        int exit = run("--panel-type", "cbc", "--value", "wbc=3.0", "--risk-level", "low", "--risk-score", "10",
                "--out", out.toString());

        assertThat(exit).isEqualTo(1);
        JsonNode report = JSON.readTree(out.toFile());
        assertThat(report.path("timestamp_utc").isTextual()).isTrue();
        assertThat(report.path("tool").path("name").asText()).isEqualTo("lab_insight");
        assertThat(report.path("inputs").path("resolved_panel").asText()).isEqualTo("CBC");
        assertThat(report.path("risk").path("level").asText()).isEqualTo("moderate");
        assertThat(report.path("risk").path("score").asInt()).isEqualTo(60);
        assertThat(report.path("lab_value_breakdown").get(0).path("status").asText()).isEqualTo("abnormal");
        assertThat(report.path("suggested_specialists").get(0).path("type").asText()).isEqualTo("Hematologist");
        assertThat(report.path("suggested_specialists").get(0).path("urgency").asText()).isEqualTo("soon");
        assertThat(report.path("detailed_findings").asText()).contains("consultation with Hematologist");
    }

    @Test
    void requestFileIsRead() throws Exception {
        Path request = tmp.resolve("request.json");
        Files.writeString(request, "{\"panel_type\": \"Lipid Profile\","
                + " \"values\": {\"cholesterol\": 250, \"ldl\": 170, \"hdl\": 30, \"triglycerides\": 220},"
                + " \"risk\": {\"risk_level\": \"high\", \"risk_score\": 90}}", StandardCharsets.UTF_8);
        Path out = tmp.resolve("lipid.json");

        int exit = run("--input", request.toString(), "--out", out.toString());

        assertThat(exit).isEqualTo(2);
        JsonNode report = JSON.readTree(out.toFile());
        assertThat(report.path("risk").path("score").asInt()).isEqualTo(95);
        assertThat(report.path("lab_value_breakdown")).hasSize(4);
        assertThat(report.path("dietary_recommendations").get(0).path("category").asText())
                .isEqualTo("Reduce Saturated Fats (Priority)");
    }

    @Test
    void optionsOverrideTheRequestFile() throws Exception {
        Path request = tmp.resolve("request.json");
        Files.writeString(request, "{\"panel_type\": \"cbc\", \"values\": {\"wbc\": 9.0},"
                + " \"risk\": {\"risk_level\": \"low\", \"risk_score\": 5}}", StandardCharsets.UTF_8);
        Path out = tmp.resolve("override.json");

        int exit = run("--input", request.toString(), "--value", "wbc=3.0", "--risk-level", "high",
                "--out", out.toString());

        assertThat(exit).isEqualTo(2);
        JsonNode report = JSON.readTree(out.toFile());
        assertThat(report.path("inputs").path("values").path("wbc").asText()).isEqualTo("3.0");
        assertThat(report.path("inputs").path("external_risk").path("score").asInt()).isEqualTo(5);
    }

    @Test
    void compactReportGoesToStandardOutput() {
        StringWriter sw = new StringWriter();
        CommandLine cmd = new CommandLine(new LabInsightApp());
        cmd.setOut(new PrintWriter(sw));

        int exit = cmd.execute("--panel-type", "thyroid", "--value", "tsh=2.5", "--risk-level", "moderate",
                "--risk-score", "47", "--compact");

        assertThat(exit).isEqualTo(1);
        String printed = sw.toString().trim();
        assertThat(printed).doesNotContain("\n");
        assertThat(printed).contains("\"risk\":{\"level\":\"moderate\",\"score\":47}")
                .contains("\"suggested_specialists\":[]");
    }

    @Test
    void missingPanelTypeIsABadRequest() {
        assertThat(run("--value", "wbc=3.0")).isEqualTo(LabInsightApp.EXIT_BAD_REQUEST);
    }

    @Test
    void unreadableRequestFileIsABadRequest() throws Exception {
        assertThat(run("--input", tmp.resolve("missing.json").toString())).isEqualTo(LabInsightApp.EXIT_BAD_REQUEST);

        Path broken = tmp.resolve("broken.json");
        Files.writeString(broken, "{\"panel_type\": ", StandardCharsets.UTF_8);
        assertThat(run("--input", broken.toString())).isEqualTo(LabInsightApp.EXIT_BAD_REQUEST);

        Path array = tmp.resolve("array.json");
        Files.writeString(array, "[1, 2]", StandardCharsets.UTF_8);
        assertThat(run("--input", array.toString())).isEqualTo(LabInsightApp.EXIT_BAD_REQUEST);
    }
}
