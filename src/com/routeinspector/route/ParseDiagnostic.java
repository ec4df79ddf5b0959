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

import java.util.Objects;

import org.jetbrains.annotations.Nullable;

/**
 * A single recoverable problem found while parsing a route file.
 */
public final class ParseDiagnostic {

    private final DiagnosticType type;

    private final int lineNumber;

    private final String netName;

    private final String message;

    public ParseDiagnostic(DiagnosticType type, int lineNumber, @Nullable String netName, String message) {
        this.type = Objects.requireNonNull(type, "type");
        this.lineNumber = lineNumber;
        this.netName = netName;
        this.message = message;
    }

    public DiagnosticType getType() {
        return type;
    }

    /**
     * @return The 1-based line the problem was found on, or 0 if it concerns a whole net.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    @Nullable
    public String getNetName() {
        return netName;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("WARNING: ").append(type);
        if (lineNumber > 0) {
            sb.append(" at line ").append(lineNumber);
        }
        if (netName != null) {
            sb.append(" in net '").append(netName).append("'");
        }
        sb.append(": ").append(message);
        return sb.toString();
    }
}
