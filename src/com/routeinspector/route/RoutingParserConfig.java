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


package com.routeinspector.route;

import com.routeinspector.util.MessageGenerator;

/**
 * A collection of customizable parameters for a {@link RoutingDocumentParser} Object.
 * Modifications of default parameter values can be done by adding corresponding options to
 * the arguments or by calling the applicable setter method. Each option name must start
 * with two dashes.
 */
public class RoutingParserConfig {
    /** true to build the trees of different nets on the shared thread pool */
    private boolean parallel;
    /** true to print every net, branch point and diagnostic while parsing */
    private boolean verbose;
    /** true to print a one line summary per net */
    private boolean printNetSummaries;
    /** true to print recoverable problems (malformed lines, missing roots, ...) to standard error */
    private boolean printDiagnostics;

    /** Constructs a configuration with default values */
    public RoutingParserConfig() {
        this(null);
    }

    /**
     * Constructs a configuration from command line style arguments.
     * @param arguments Options such as "--parallel" or "--verbose", may be null.
     */
    public RoutingParserConfig(String[] arguments) {
        parallel = false;
        verbose = false;
        printNetSummaries = false;
        printDiagnostics = true;
        if (arguments != null) {
            parseArguments(arguments);
        }
    }

    private void parseArguments(String[] arguments) {
        for (String arg : arguments) {
            switch (arg) {
            case "--parallel":
                setParallel(true);
                break;
            case "--sequential":
                setParallel(false);
                break;
            case "--verbose":
                setVerbose(true);
                break;
            case "--quiet":
                setVerbose(false);
                setPrintNetSummaries(false);
                setPrintDiagnostics(false);
                break;
            case "--printNetSummaries":
                setPrintNetSummaries(true);
                break;
            default:
                throw new IllegalArgumentException("ERROR: unknown routing parser option: " + arg);
            }
        }
    }

    public boolean isParallel() {
        return parallel;
    }

    /**
     * Sets whether trees of different nets may be built concurrently. Nets are always
     * delimited sequentially and results always keep file order.
     * @param parallel true to use the shared thread pool.
     */
    public void setParallel(boolean parallel) {
        this.parallel = parallel;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    public boolean isPrintNetSummaries() {
        return printNetSummaries || verbose;
    }

    public void setPrintNetSummaries(boolean printNetSummaries) {
        this.printNetSummaries = printNetSummaries;
    }

    public boolean isPrintDiagnostics() {
        return printDiagnostics;
    }

    public void setPrintDiagnostics(boolean printDiagnostics) {
        this.printDiagnostics = printDiagnostics;
    }

    @Override
    public String toString() {
        StringBuilder s = new StringBuilder();
        s.append(MessageGenerator.formatString("Routing Parser Configuration"));
        s.append(MessageGenerator.formatString("Parallel tree building: ", parallel));
        s.append(MessageGenerator.formatString("Print net summaries: ", isPrintNetSummaries()));
        s.append(MessageGenerator.formatString("Print diagnostics: ", printDiagnostics));
        s.append(MessageGenerator.formatString("Verbose: ", verbose));
        return s.toString();
    }
}
