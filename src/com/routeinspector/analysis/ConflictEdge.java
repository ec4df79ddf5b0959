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


package com.routeinspector.analysis;

import org.jetbrains.annotations.Nullable;
import org.jgrapht.graph.DefaultEdge;

public class ConflictEdge extends DefaultEdge {

    private static final long serialVersionUID = 2620985176234154021L;

    private final ConflictType type;

    private final String segment;

    ConflictEdge(ConflictType type, @Nullable String segment) {
        this.type = type;
        this.segment = segment;
    }

    public ConflictType getType() {
        return type;
    }

    /**
     * @return The "x,y,KIND" location both nets use, or null for a bounding box overlap.
     */
    @Nullable
    public String getSegment() {
        return segment;
    }

    @Override
    public String toString() {
        return "(" + getSource() + " : " + getTarget() + ", " + type
                + (segment == null ? "" : " " + segment) + ")";
    }
}
