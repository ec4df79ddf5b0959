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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.List;

import com.routeinspector.analysis.CongestionReport;
import com.routeinspector.route.RoutingParserConfig;
import com.routeinspector.util.MessageGenerator;
import joptsimple.OptionParser;
import joptsimple.OptionSet;

/**
 * Command line options of {@link ReportRouting}. Defaults can be changed by passing
 * the corresponding options or by calling the setters.
 */
public class ReportRoutingConfig {

    private String routeFile;

    private boolean parallel;

    private boolean verbose;

    private double congestionThreshold;

    private String summaryJsonFile;

    private String treesJsonFile;

    private boolean reportConflicts;

    private static final List<String> PARALLEL_OPTS = Arrays.asList("p", "parallel");
    private static final List<String> VERBOSE_OPTS = Arrays.asList("v", "verbose");
    private static final List<String> THRESHOLD_OPTS = Arrays.asList("t", "congestion-threshold");
    private static final List<String> SUMMARY_JSON_OPTS = Arrays.asList("s", "summary-json");
    private static final List<String> TREES_JSON_OPTS = Arrays.asList("j", "trees-json");
    private static final List<String> CONFLICTS_OPTS = Arrays.asList("c", "conflicts");
    private static final List<String> HELP_OPTS = Arrays.asList("?", "h", "help");

    public ReportRoutingConfig() {
        congestionThreshold = CongestionReport.DEFAULT_THRESHOLD;
    }

    public ReportRoutingConfig(String[] arguments) {
        this();
        parseArguments(arguments);
    }

    public static OptionParser createOptionParser() {
        return new OptionParser() {
            {
                acceptsAll(PARALLEL_OPTS, "Build the routing trees of nets in parallel");
                acceptsAll(VERBOSE_OPTS, "Print every parsed node line, branch and reattachment");
                acceptsAll(THRESHOLD_OPTS, "Normalized congestion above which a channel segment is reported"
                        + " (default " + CongestionReport.DEFAULT_THRESHOLD + ")").withRequiredArg();
                acceptsAll(SUMMARY_JSON_OPTS, "Write a JSON summary of the routing to the specified file")
                        .withRequiredArg();
                acceptsAll(TREES_JSON_OPTS, "Write the routing tree of every net as JSON to the specified file")
                        .withRequiredArg();
                acceptsAll(CONFLICTS_OPTS, "Build the net conflict graph and report its metrics and hubs");
                acceptsAll(HELP_OPTS, "Print this help message").forHelp();
                nonOptions("<input.route>[.gz]");
            }
        };
    }

    public static void printHelp() {
        OptionParser p = createOptionParser();
        MessageGenerator.printHeader("ReportRouting");
        System.out.println("Parses a VPR .route file and reports its routing trees, congestion and conflicts.");
        System.out.println("  USAGE: ReportRouting <input.route> [options]");
        try {
            p.printHelpOn(System.out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static boolean hasHelpArg(String[] arguments) {
        OptionParser p = createOptionParser();
        OptionSet options = p.parse(arguments);
        return options.has(HELP_OPTS.get(0));
    }

    private void parseArguments(String[] arguments) {
        OptionParser p = createOptionParser();
        OptionSet options = p.parse(arguments);

        List<?> files = options.nonOptionArguments();
        if (files.isEmpty()) {
            throw new RuntimeException("No input routing file found. Please specify a VPR .route file"
                    + " as the first argument");
        }
        setRouteFile((String) files.get(0));

        setParallel(options.has(PARALLEL_OPTS.get(0)));
        setVerbose(options.has(VERBOSE_OPTS.get(0)));
        setReportConflicts(options.has(CONFLICTS_OPTS.get(0)));
        if (options.has(THRESHOLD_OPTS.get(0))) {
            setCongestionThreshold(Double.parseDouble((String) options.valueOf(THRESHOLD_OPTS.get(0))));
        }
        if (options.has(SUMMARY_JSON_OPTS.get(0))) {
            setSummaryJsonFile((String) options.valueOf(SUMMARY_JSON_OPTS.get(0)));
        }
        if (options.has(TREES_JSON_OPTS.get(0))) {
            setTreesJsonFile((String) options.valueOf(TREES_JSON_OPTS.get(0)));
        }
    }

    /**
     * @return The options for the routing file parser implied by this configuration.
     */
    public RoutingParserConfig createParserConfig() {
        RoutingParserConfig config = new RoutingParserConfig();
        config.setParallel(parallel);
        config.setVerbose(verbose);
        return config;
    }

    public String getRouteFile() {
        return routeFile;
    }

    public void setRouteFile(String routeFile) {
        this.routeFile = routeFile;
    }

    public boolean isParallel() {
        return parallel;
    }

    public void setParallel(boolean parallel) {
        this.parallel = parallel;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    public double getCongestionThreshold() {
        return congestionThreshold;
    }

    public void setCongestionThreshold(double congestionThreshold) {
        if (congestionThreshold < 0 || congestionThreshold > 1) {
            throw new IllegalArgumentException("ERROR: Congestion threshold must be within [0,1], found "
                    + congestionThreshold);
        }
        this.congestionThreshold = congestionThreshold;
    }

    public String getSummaryJsonFile() {
        return summaryJsonFile;
    }

    public void setSummaryJsonFile(String summaryJsonFile) {
        this.summaryJsonFile = summaryJsonFile;
    }

    public String getTreesJsonFile() {
        return treesJsonFile;
    }

    public void setTreesJsonFile(String treesJsonFile) {
        this.treesJsonFile = treesJsonFile;
    }

    public boolean isReportConflicts() {
        return reportConflicts;
    }

    public void setReportConflicts(boolean reportConflicts) {
        this.reportConflicts = reportConflicts;
    }

    @Override
    public String toString() {
        StringBuilder s = new StringBuilder();
        s.append(MessageGenerator.formatString("Report Configuration"));
        s.append(MessageGenerator.formatString("Routing file: ", routeFile));
        s.append(MessageGenerator.formatString("Parallel: ", parallel));
        s.append(MessageGenerator.formatString("Verbose: ", verbose));
        s.append(MessageGenerator.formatString("Congestion threshold: ", congestionThreshold));
        s.append(MessageGenerator.formatString("Conflict graph: ", reportConflicts));
        if (summaryJsonFile != null) {
            s.append(MessageGenerator.formatString("Summary JSON: ", summaryJsonFile));
        }
        if (treesJsonFile != null) {
            s.append(MessageGenerator.formatString("Trees JSON: ", treesJsonFile));
        }
        return s.toString();
    }
}
