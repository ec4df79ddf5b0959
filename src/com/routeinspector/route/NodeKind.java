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

import java.util.Locale;

/**
 * Routing-resource node types as they appear in a VPR .route file.
 */
public enum NodeKind {
    /** Logical start of a net inside a block */
    SOURCE,
    /** Block output pin */
    OPIN,
    /** Horizontal routing channel segment */
    CHANX,
    /** Vertical routing channel segment */
    CHANY,
    /** Block input pin */
    IPIN,
    /** Logical end of a net inside a block */
    SINK;

    public static final NodeKind[] values = values();

    /**
     * Looks up a kind by name, ignoring case and surrounding whitespace.
     * @param name The kind as written in the route file, e.g. "chanx".
     * @return The matching kind, or null if the name is not a known kind.
     */
    public static NodeKind fromString(String name) {
        if (name == null) {
            return null;
        }
        String upper = name.trim().toUpperCase(Locale.ROOT);
        for (NodeKind kind : values) {
            if (kind.name().equals(upper)) {
                return kind;
            }
        }
        return null;
    }

    public boolean isChannel() {
        return this == CHANX || this == CHANY;
    }

    public boolean isPin() {
        return this == OPIN || this == IPIN;
    }

    public boolean isTerminal() {
        return this == SOURCE || this == SINK;
    }

    /**
     * Nodes of these kinds may start a new sub-path when the route file resumes
     * without an explicit branch marker.
     */
    public boolean isReattachmentCandidate() {
        return this == CHANX || this == CHANY || this == OPIN;
    }
}
