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

import java.nio.file.Paths;
import java.util.List;
import java.util.Map.Entry;
import java.util.Set;

import com.routeinspector.analysis.CongestionReport;
import com.routeinspector.analysis.ConflictGraph;
import com.routeinspector.analysis.RouteStatistics;
import com.routeinspector.route.CongestionKey;
import com.routeinspector.route.DiagnosticType;
import com.routeinspector.route.NetRoute;
import com.routeinspector.route.RoutingDocument;
import com.routeinspector.route.RoutingDocumentParser;
import com.routeinspector.util.CodePerfTracker;
import com.routeinspector.util.MessageGenerator;

/**
 * Parses a VPR .route file and prints a report of its nets, channel congestion,
 * parse diagnostics and optionally the conflicts between nets.
 */
public class ReportRouting {

    private static final int MAX_LISTED = 10;

    private final ReportRoutingConfig config;

    private RoutingDocument doc;

    public ReportRouting(ReportRoutingConfig config) {
        this.config = config;
    }

    public RoutingDocument getDocument() {
        return doc;
    }

    /**
     * Parses the configured file and writes the report and any requested JSON files.
     * @param t Tracker timing each stage.
     */
    public void run(CodePerfTracker t) {
        t.start("Parse routing");
        doc = new RoutingDocumentParser(config.createParserConfig()).parse(config.getRouteFile());
        t.stop();

        t.start("Analyze");
        RouteStatistics stats = new RouteStatistics(doc);
        CongestionReport congestion = new CongestionReport(doc.getCongestion(), config.getCongestionThreshold());
        ConflictGraph conflicts = config.isReportConflicts() ? new ConflictGraph(doc) : null;
        t.stop();

        MessageGenerator.briefMessage(stats.toString("Route Statistics: " + doc.getSourceName()));
        if (doc.hasArraySize()) {
            MessageGenerator.briefMessage("Array size: " + doc.getArrayWidth() + " x " + doc.getArrayHeight());
        }
        printCongestion(congestion);
        printDiagnostics();
        if (conflicts != null) {
            printConflicts(conflicts);
        }

        if (config.getSummaryJsonFile() != null) {
            t.start("Write summary JSON");
            RoutingJsonWriter.write(RoutingJsonWriter.toSummaryJson(doc), Paths.get(config.getSummaryJsonFile()));
            t.stop();
        }
        if (config.getTreesJsonFile() != null) {
            t.start("Write trees JSON");
            RoutingJsonWriter.write(RoutingJsonWriter.toTreesJson(doc), Paths.get(config.getTreesJsonFile()));
            t.stop();
        }
    }

    private void printCongestion(CongestionReport congestion) {
        MessageGenerator.printHeader("Congestion");
        System.out.print(congestion);
        int listed = 0;
        for (Entry<CongestionKey, Double> e : congestion.getHighCongestionSegments()) {
            if (listed++ == MAX_LISTED) {
                MessageGenerator.briefMessage("  ...");
                break;
            }
            MessageGenerator.briefMessage(String.format("  %-32s %.3f", e.getKey(), e.getValue()));
        }
    }

    private void printDiagnostics() {
        MessageGenerator.printHeader("Diagnostics");
        for (DiagnosticType type : DiagnosticType.values()) {
            System.out.print(MessageGenerator.formatString(type + ":", doc.getDiagnostics(type).size()));
        }
        int listed = 0;
        for (NetRoute net : doc.getNets()) {
            if (!net.isReconstructionSuspicious()) {
                continue;
            }
            if (listed++ == MAX_LISTED) {
                MessageGenerator.briefMessage("  ...");
                break;
            }
            MessageGenerator.briefMessage("  Uncertain tree: " + net + ", root fallbacks="
                    + net.getRootFallbackCount() + ", detached=" + net.getDetachedRecordCount());
        }
    }

    private static void printConflicts(ConflictGraph conflicts) {
        MessageGenerator.printHeader("Conflict Graph");
        for (Entry<String, Double> e : conflicts.getMetrics().entrySet()) {
            System.out.print(MessageGenerator.formatString(e.getKey() + ":", e.getValue()));
        }
        List<String> hubs = conflicts.identifyHubs();
        MessageGenerator.briefMessage("Hub nets: " + (hubs.size() > MAX_LISTED ? hubs.subList(0, MAX_LISTED) + "..." : hubs));
        List<Set<String>> components = conflicts.getConnectedComponents();
        int largest = 0;
        for (Set<String> c : components) {
            largest = Math.max(largest, c.size());
        }
        System.out.print(MessageGenerator.formatString("Largest component:", largest));
    }

    public static void main(String[] args) {
        if (args.length == 0 || ReportRoutingConfig.hasHelpArg(args)) {
            ReportRoutingConfig.printHelp();
            return;
        }
        ReportRoutingConfig config = new ReportRoutingConfig(args);
        CodePerfTracker t = new CodePerfTracker(ReportRouting.class.getSimpleName());
        if (config.isVerbose()) {
            System.out.print(config);
        }
        new ReportRouting(config).run(t);
        t.printSummary();
    }
}
