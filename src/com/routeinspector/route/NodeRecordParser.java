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

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns a single "Node:" line of a VPR .route file into a {@link NodeRecord}, e.g.
 * <pre>
 * Node:	1108	 CHANX (4,0,0)  Track: 4  Switch: 2
 * </pre>
 * The parser is stateless and safe to call from multiple threads.
 */
public class NodeRecordParser {

    public static final String NODE_MARKER = "Node:";

    private static final Pattern DOUBLE_COLON = Pattern.compile("\\b(Track|Switch|Pad)::", Pattern.CASE_INSENSITIVE);
    private static final Pattern SPACED_COMMA = Pattern.compile("\\s*,\\s*");
    private static final Pattern SPACED_OPEN = Pattern.compile("\\(\\s+");
    private static final Pattern SPACED_CLOSE = Pattern.compile("\\s+\\)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final String TRACK_KEY = "track";
    private static final String SWITCH_KEY = "switch";
    private static final String PAD_KEY = "pad";

    /**
     * Parses one node line.
     * @param line A trimmed, non-empty line that starts with {@link #NODE_MARKER}.
     * @param lineNumber 1-based position of the line in its file, used in diagnostics.
     * @return The parsed record.
     * @throws MalformedLineException If the line has fewer than three fields after the marker,
     * a non-numeric id or coordinate, or an unknown node kind.
     */
    public static NodeRecord parse(String line, int lineNumber) throws MalformedLineException {
        if (line == null || !line.trim().startsWith(NODE_MARKER)) {
            throw new MalformedLineException("Not a node line", line, lineNumber);
        }
        String[] parts = tokenize(line);
        if (parts.length < 3) {
            throw new MalformedLineException("Expected at least <id> <kind> <(x,y)>, found " + parts.length
                    + " field(s)", line, lineNumber);
        }

        int id;
        try {
            id = Integer.parseInt(parts[0]);
        } catch (NumberFormatException e) {
            throw new MalformedLineException("Non-numeric node id", line, lineNumber, e);
        }

        NodeKind kind = NodeKind.fromString(parts[1]);
        if (kind == null) {
            throw new MalformedLineException("Unknown node kind " + parts[1], line, lineNumber);
        }

        String[] coords = stripParentheses(parts[2]).split(",");
        int x;
        int y;
        try {
            x = Integer.parseInt(coords[0]);
            y = coords.length > 1 ? Integer.parseInt(coords[1]) : NodeRecord.UNKNOWN_COORDINATE;
        } catch (NumberFormatException e) {
            throw new MalformedLineException("Invalid coordinates " + parts[2], line, lineNumber, e);
        }

        int track = 0;
        int switchId = 0;
        int pad = NodeRecord.NO_PAD;
        Map<String, Object> attributes = new LinkedHashMap<>();
        int i = 3;
        while (i < parts.length) {
            String token = parts[i];
            if (!isKeyToken(token) || i + 1 >= parts.length) {
                i++;
                continue;
            }
            String key = stripTrailingColons(token).toLowerCase(Locale.ROOT);
            String value = parts[i + 1];
            Integer number = tryParseInt(value);
            switch (key) {
            case TRACK_KEY:
                if (number != null) track = number;
                break;
            case SWITCH_KEY:
                if (number != null) switchId = number;
                break;
            case PAD_KEY:
                if (number != null) pad = number;
                break;
            default:
                attributes.put(key, number != null ? number : value);
                break;
            }
            i += 2;
        }

        return new NodeRecord(id, kind, x, y, track, switchId, pad, attributes, lineNumber);
    }

    /**
     * Checks whether a line should be handed to {@link #parse(String, int)}.
     * @param line A trimmed line.
     * @return True if the line starts with the node marker.
     */
    public static boolean isNodeLine(String line) {
        return line.startsWith(NODE_MARKER);
    }

    private static String[] tokenize(String line) {
        String normalized = DOUBLE_COLON.matcher(line.trim()).replaceAll("$1:");
        normalized = SPACED_COMMA.matcher(normalized).replaceAll(",");
        normalized = SPACED_OPEN.matcher(normalized).replaceAll("(");
        normalized = SPACED_CLOSE.matcher(normalized).replaceAll(")");
        String body = normalized.substring(NODE_MARKER.length()).trim();
        if (body.isEmpty()) {
            return new String[0];
        }
        return WHITESPACE.split(body);
    }

    private static boolean isKeyToken(String token) {
        return token.length() > 1 && token.endsWith(":") && Character.isLetter(token.charAt(0));
    }

    private static String stripParentheses(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '(') start++;
        while (end > start && s.charAt(end - 1) == ')') end--;
        return s.substring(start, end);
    }

    private static String stripTrailingColons(String s) {
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == ':') end--;
        return s.substring(0, end);
    }

    private static Integer tryParseInt(String s) {
        try {
            return Integer.valueOf(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
