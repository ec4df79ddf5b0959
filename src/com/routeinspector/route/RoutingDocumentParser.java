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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import com.routeinspector.util.FileTools;
import com.routeinspector.util.MessageGenerator;
import com.routeinspector.util.ParallelismTools;
import org.jetbrains.annotations.NotNull;

/**
 * Reads a VPR .route file and reconstructs the routing tree of every net along with
 * the channel congestion of the whole document.
 * <p>
 * Lines are delimited into nets in a single sequential pass. The trees of the nets
 * are then built independently, optionally on the shared thread pool (see
 * {@link RoutingParserConfig#setParallel(boolean)}); the per-net congestion counts are
 * merged in file order afterwards. Malformed node lines and structural problems are
 * recorded as {@link ParseDiagnostic}s and never abort the parse.
 */
public class RoutingDocumentParser {

    private final RoutingParserConfig config;

    public RoutingDocumentParser() {
        this(new RoutingParserConfig());
    }

    public RoutingDocumentParser(@NotNull RoutingParserConfig config) {
        this.config = config;
    }

    public RoutingParserConfig getConfig() {
        return config;
    }

    /**
     * Parses a route file. Files ending in .gz are decompressed on the fly.
     * @param fileName Path of the route file.
     * @return The parsed document.
     * @throws UncheckedIOException If the file cannot be opened or read.
     * @throws UnrecognizedRouteFormatException If the file holds no nets and no node lines.
     */
    public RoutingDocument parse(String fileName) {
        return parse(Paths.get(fileName));
    }

    /**
     * Parses a route file. Files ending in .gz are decompressed on the fly.
     * @param file Path of the route file.
     * @return The parsed document.
     * @throws UncheckedIOException If the file cannot be opened or read.
     * @throws UnrecognizedRouteFormatException If the file holds no nets and no node lines.
     */
    public RoutingDocument parse(Path file) {
        try (BufferedReader br = FileTools.getProperInputStream(file)) {
            return parse(br, file.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Could not read routing file: " + file, e);
        }
    }

    /**
     * Parses route file content from a reader. The reader is consumed but not closed.
     * @param reader Source of the route file text.
     * @param sourceName Name used in messages, e.g. the file name.
     * @return The parsed document.
     * @throws UncheckedIOException If reading fails.
     * @throws UnrecognizedRouteFormatException If the input holds no nets and no node lines.
     */
    public RoutingDocument parse(Reader reader, String sourceName) {
        BufferedReader br = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        LineScanner scanner = new LineScanner(sourceName);
        String line;
        int lineNumber = 0;
        try {
            while ((line = br.readLine()) != null) {
                scanner.processLine(line, ++lineNumber);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Could not read routing file: " + sourceName
                    + " (at line " + (lineNumber + 1) + ")", e);
        }
        return finish(scanner);
    }

    public RoutingDocument parseLines(List<String> lines) {
        return parseLines(lines, "<lines>");
    }

    /**
     * Parses route file content that is already in memory.
     * @param lines The lines of the route file.
     * @param sourceName Name used in messages.
     * @return The parsed document.
     * @throws UnrecognizedRouteFormatException If the lines hold no nets and no node lines.
     */
    public RoutingDocument parseLines(List<String> lines, String sourceName) {
        LineScanner scanner = new LineScanner(sourceName);
        int lineNumber = 0;
        for (String line : lines) {
            scanner.processLine(line, ++lineNumber);
        }
        return finish(scanner);
    }

    private RoutingDocument finish(LineScanner scanner) {
        if (scanner.groups.isEmpty() && scanner.parsedNodeLines == 0) {
            throw new UnrecognizedRouteFormatException("ERROR: " + scanner.sourceName
                    + " contains no net delimiters and no parsable node lines, it does not appear to be a"
                    + " VPR .route file");
        }

        List<Callable<NetResult>> tasks = new ArrayList<>(scanner.groups.size());
        for (NetGroup group : scanner.groups) {
            tasks.add(() -> buildNet(group));
        }
        List<NetResult> results;
        if (config.isParallel()) {
            results = ParallelismTools.invokeAllInOrder(tasks);
        } else {
            results = new ArrayList<>(tasks.size());
            for (NetGroup group : scanner.groups) {
                results.add(buildNet(group));
            }
        }

        List<NetRoute> nets = new ArrayList<>(results.size());
        List<ParseDiagnostic> diagnostics = new ArrayList<>(scanner.diagnostics);
        CongestionAccumulator congestion = new CongestionAccumulator();
        for (int i = 0; i < results.size(); i++) {
            NetResult result = results.get(i);
            nets.add(result.net);
            diagnostics.addAll(result.diagnostics);
            congestion.merge(scanner.groups.get(i).congestion);
            if (config.isPrintDiagnostics()) {
                for (ParseDiagnostic d : result.diagnostics) {
                    MessageGenerator.briefError(d.toString());
                }
            }
            if (config.isPrintNetSummaries()) {
                MessageGenerator.briefMessage(summarize(result.net));
            }
        }

        RoutingDocument doc = new RoutingDocument(scanner.sourceName, nets, congestion.normalize(), diagnostics,
                scanner.arrayWidth, scanner.arrayHeight, scanner.placementFile);
        if (config.isVerbose()) {
            MessageGenerator.briefMessage("Parsed " + doc);
        }
        return doc;
    }

    private NetResult buildNet(NetGroup group) {
        List<ParseDiagnostic> diagnostics = new ArrayList<>();
        NetRoute net = RouteTreeBuilder.build(group.header.getId(), group.header.getName(), group.records,
                diagnostics, config.isVerbose());
        return new NetResult(net, diagnostics);
    }

    private static String summarize(NetRoute net) {
        StringBuilder sb = new StringBuilder();
        sb.append("Net '").append(net.getName()).append("': ").append(net.getRecordCount()).append(" records");
        if (net.hasRoot()) {
            sb.append(", ").append(net.getFanout()).append(" path(s) to SINK");
        } else {
            sb.append(", no tree");
        }
        if (net.isReconstructionSuspicious()) {
            sb.append(" (reconstruction uncertain)");
        }
        return sb.toString();
    }

    /** The records of one net as delimited from the file, before its tree is built */
    private static class NetGroup {
        private final NetHeader header;
        private final List<NodeRecord> records = new ArrayList<>();
        private final CongestionAccumulator congestion = new CongestionAccumulator();

        NetGroup(NetHeader header) {
            this.header = header;
        }
    }

    private static class NetResult {
        private final NetRoute net;
        private final List<ParseDiagnostic> diagnostics;

        NetResult(NetRoute net, List<ParseDiagnostic> diagnostics) {
            this.net = net;
            this.diagnostics = diagnostics;
        }
    }

    /**
     * Sequential state of the first pass: the net groups found so far and the net
     * currently receiving records.
     */
    private class LineScanner {
        private final String sourceName;
        private final List<NetGroup> groups = new ArrayList<>();
        private final List<ParseDiagnostic> diagnostics = new ArrayList<>();
        private NetGroup current;
        private int parsedNodeLines;
        private int arrayWidth = -1;
        private int arrayHeight = -1;
        private String placementFile;

        LineScanner(String sourceName) {
            this.sourceName = sourceName;
        }

        void processLine(String rawLine, int lineNumber) {
            String line = rawLine.trim();
            if (NetBoundaryScanner.isIgnorable(line)) {
                readBanner(line);
                return;
            }

            NetHeader header = NetBoundaryScanner.matchNetHeader(line, lineNumber);
            if (header != null) {
                current = new NetGroup(header);
                groups.add(current);
                if (config.isVerbose()) {
                    MessageGenerator.briefMessage("Starting " + header);
                }
                return;
            }

            if (!NodeRecordParser.isNodeLine(line)) {
                // e.g. "Block clk (#3) at (1,2), Pin class 0." lines of global nets
                return;
            }

            NodeRecord record;
            try {
                record = NodeRecordParser.parse(line, lineNumber);
            } catch (MalformedLineException e) {
                report(new ParseDiagnostic(DiagnosticType.MALFORMED_LINE, lineNumber,
                        current == null ? null : current.header.getName(), e.getMessage()));
                return;
            }
            parsedNodeLines++;

            if (current == null) {
                report(new ParseDiagnostic(DiagnosticType.ORPHAN_RECORD, lineNumber, null,
                        record + " appears before any net delimiter and was ignored"));
                return;
            }
            current.records.add(record);
            current.congestion.add(record);
            if (config.isVerbose()) {
                MessageGenerator.briefMessage("    " + record);
            }
        }

        private void readBanner(String line) {
            if (arrayWidth < 0) {
                int[] size = NetBoundaryScanner.parseArraySize(line);
                if (size != null) {
                    arrayWidth = size[0];
                    arrayHeight = size[1];
                    return;
                }
            }
            if (placementFile == null) {
                placementFile = NetBoundaryScanner.parsePlacementFile(line);
            }
        }

        private void report(ParseDiagnostic diagnostic) {
            diagnostics.add(diagnostic);
            if (config.isPrintDiagnostics()) {
                MessageGenerator.briefError(diagnostic.toString());
            }
        }
    }
}
