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

/**
 * Thrown by {@link NodeRecordParser} when a node line cannot be turned into a {@link NodeRecord}.
 * The condition is recoverable: callers skip the line and continue.
 */
public class MalformedLineException extends Exception {

    private static final long serialVersionUID = -3262047361254128170L;

    private final int lineNumber;

    private final String line;

    public MalformedLineException(String message, String line, int lineNumber) {
        super("Line " + lineNumber + ": " + message + " '" + abbreviate(line) + "'");
        this.line = line;
        this.lineNumber = lineNumber;
    }

    public MalformedLineException(String message, String line, int lineNumber, Throwable cause) {
        this(message, line, lineNumber);
        initCause(cause);
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }

    private static String abbreviate(String line) {
        if (line == null) {
            return "";
        }
        return line.length() > 80 ? line.substring(0, 80) + "..." : line;
    }
}
