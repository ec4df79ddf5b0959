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

/**
 * The id and name captured from a "Net &lt;id&gt; (&lt;name&gt;)" delimiter line.
 */
public final class NetHeader {

    private final int id;

    private final String name;

    private final int lineNumber;

    public NetHeader(int id, String name, int lineNumber) {
        this.id = id;
        this.name = Objects.requireNonNull(name, "name");
        this.lineNumber = lineNumber;
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        NetHeader other = (NetHeader) obj;
        return id == other.id && name.equals(other.name);
    }

    @Override
    public String toString() {
        return "Net " + id + " (" + name + ")";
    }
}
