/*
 * Copyright (c) 2026, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * This file is part of RouteInspector.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */


package com.routeinspector.tools;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.routeinspector.route.RoutingParserConfig;
import com.routeinspector.support.CheckOpenFilesExtension;
import com.routeinspector.support.RouteFiles;
import com.routeinspector.util.CodePerfTracker;
import joptsimple.OptionException;
import org.json.JSONObject;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

public class TestReportRouting {

    @Test
    public void testConfigDefaults() {
        ReportRoutingConfig config = new ReportRoutingConfig(new String[] {"design.route"});
        Assertions.assertEquals("design.route", config.getRouteFile());
        Assertions.assertFalse(config.isParallel());
        Assertions.assertFalse(config.isVerbose());
        Assertions.assertFalse(config.isReportConflicts());
        Assertions.assertEquals(0.8, config.getCongestionThreshold());
        Assertions.assertNull(config.getSummaryJsonFile());
        Assertions.assertNull(config.getTreesJsonFile());
    }

    @Test
    public void testConfigOptions() {
        ReportRoutingConfig config = new ReportRoutingConfig(new String[] {"-p", "--verbose", "-t", "0.5",
                "--summary-json", "s.json", "-j", "t.json", "-c", "design.route"});
        Assertions.assertTrue(config.isParallel());
        Assertions.assertTrue(config.isVerbose());
        Assertions.assertTrue(config.isReportConflicts());
        Assertions.assertEquals(0.5, config.getCongestionThreshold());
        Assertions.assertEquals("s.json", config.getSummaryJsonFile());
        Assertions.assertEquals("t.json", config.getTreesJsonFile());
        Assertions.assertEquals("design.route", config.getRouteFile());

        RoutingParserConfig parserConfig = config.createParserConfig();
        Assertions.assertTrue(parserConfig.isParallel());
        Assertions.assertTrue(parserConfig.isVerbose());
    }

    @Test
    public void testConfigErrors() {
        Assertions.assertThrows(RuntimeException.class, () -> new ReportRoutingConfig(new String[] {"-p"}));
        Assertions.assertThrows(OptionException.class,
                () -> new ReportRoutingConfig(new String[] {"--no-such-option", "design.route"}));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new ReportRoutingConfig(new String[] {"-t", "1.5", "design.route"}));
        Assertions.assertTrue(ReportRoutingConfig.hasHelpArg(new String[] {"-h"}));
        Assertions.assertFalse(ReportRoutingConfig.hasHelpArg(new String[] {"design.route"}));
    }

    @Test
    @ExtendWith(CheckOpenFilesExtension.class)
    public void testRunWritesJson(@TempDir Path tempDir) throws Exception {
        Path summary = tempDir.resolve("summary.json");
        Path trees = tempDir.resolve("trees.json");
        ReportRoutingConfig config = new ReportRoutingConfig(new String[] {"-c",
                "-s", summary.toString(), "-j", trees.toString(), RouteFiles.getString("sample.route")});
        ReportRouting report = new ReportRouting(config);
        CodePerfTracker t = new CodePerfTracker("TestReportRouting", false);
        report.run(t);

        Assertions.assertEquals(4, report.getDocument().getNets().size());
        Assertions.assertNotNull(t.getRuntime("Parse routing"));
        Assertions.assertNotNull(t.getRuntime("Write trees JSON"));
        JSONObject s = new JSONObject(new String(Files.readAllBytes(summary), StandardCharsets.UTF_8));
        Assertions.assertEquals(22, s.getInt("total_wire_length"));
        JSONObject tj = new JSONObject(new String(Files.readAllBytes(trees), StandardCharsets.UTF_8));
        Assertions.assertEquals(4, tj.getJSONArray("nets").length());
    }

    @Test
    public void testMain(@TempDir Path tempDir) {
        Path summary = tempDir.resolve("main.json");
        ReportRouting.main(new String[] {RouteFiles.getString("sample.route"), "--summary-json", summary.toString()});
        Assertions.assertTrue(Files.exists(summary));
    }
}
