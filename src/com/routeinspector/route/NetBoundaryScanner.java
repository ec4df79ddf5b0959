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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes the structural lines of a VPR .route file: net delimiters and the
 * banners and markers that carry no node data.
 * <pre>
 * Placement_File: top.place Placement_ID: SHA256:...
 * Array size: 10 x 10 logic blocks.
 *
 * Routing:
 *
 * Net 0 (c0)
 * </pre>
 */
public class NetBoundaryScanner {

    private static final Pattern NET_HEADER = Pattern.compile("^Net\\s+(\\d+)\\s+\\((.+?)\\)\\s*(?::.*)?$");
    private static final Pattern ARRAY_SIZE = Pattern.compile("Array\\s+size:\\s+(\\d+)\\s+x\\s+(\\d+)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern PLACEMENT_FILE = Pattern.compile("^Placement_File:\\s*(\\S+)");

    public static final String COMMENT_PREFIX = "#";
    public static final String PLACEMENT_FILE_BANNER = "Placement_File:";
    public static final String ARRAY_SIZE_BANNER = "Array size:";
    public static final String ROUTING_MARKER = "Routing:";

    /**
     * Matches a net delimiter line. The name runs up to the last ')' before the
     * optional ": global net connecting:" suffix, so names may hold parentheses.
     * @param line A trimmed line.
     * @param lineNumber Position of the line, recorded on the header.
     * @return The net id and name, or null if the line does not start a net.
     */
    public static NetHeader matchNetHeader(String line, int lineNumber) {
        Matcher m = NET_HEADER.matcher(line);
        if (!m.find()) {
            return null;
        }
        int id;
        try {
            id = Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            // Wider than an int, not a net id this tool can represent
            return null;
        }
        return new NetHeader(id, m.group(2), lineNumber);
    }

    /**
     * Determines if a line is blank, a comment or one of the known banners
     * that do not affect net boundaries.
     * @param line A trimmed line.
     * @return True if the line should be skipped.
     */
    public static boolean isIgnorable(String line) {
        return line.isEmpty()
                || line.startsWith(COMMENT_PREFIX)
                || line.startsWith(PLACEMENT_FILE_BANNER)
                || line.startsWith(ARRAY_SIZE_BANNER)
                || line.equals(ROUTING_MARKER);
    }

    /**
     * Extracts the device grid dimensions from an "Array size: W x H logic blocks" banner.
     * @param line A trimmed line.
     * @return {width, height}, or null if the line is not an array size banner.
     */
    public static int[] parseArraySize(String line) {
        Matcher m = ARRAY_SIZE.matcher(line);
        if (!m.find()) {
            return null;
        }
        try {
            return new int[] {Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2))};
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Extracts the placement file name from a "Placement_File:" banner.
     * @param line A trimmed line.
     * @return The file name, or null if the line is not a placement banner.
     */
    public static String parsePlacementFile(String line) {
        Matcher m = PLACEMENT_FILE.matcher(line);
        return m.find() ? m.group(1) : null;
    }
}
