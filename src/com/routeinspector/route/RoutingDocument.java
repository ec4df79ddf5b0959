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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.jetbrains.annotations.Nullable;

/**
 * The result of parsing one route file: all nets in file order, the normalized
 * channel congestion and the diagnostics collected along the way.
 */
public class RoutingDocument {

    private final String sourceName;

    private final List<NetRoute> nets;

    private final CongestionMap congestion;

    private final long totalWireLength;

    private final List<ParseDiagnostic> diagnostics;

    private final int arrayWidth;

    private final int arrayHeight;

    private final String placementFile;

    RoutingDocument(String sourceName, List<NetRoute> nets, CongestionMap congestion,
                    List<ParseDiagnostic> diagnostics, int arrayWidth, int arrayHeight, String placementFile) {
        this.sourceName = sourceName;
        this.nets = Collections.unmodifiableList(new ArrayList<>(nets));
        this.congestion = congestion;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
        this.arrayWidth = arrayWidth;
        this.arrayHeight = arrayHeight;
        this.placementFile = placementFile;
        long length = 0;
        for (NetRoute net : nets) {
            length += net.getRecordCount();
        }
        this.totalWireLength = length;
    }

    public String getSourceName() {
        return sourceName;
    }

    public List<NetRoute> getNets() {
        return nets;
    }

    /**
     * Looks up a net by name.
     * @param name The net name as written in its delimiter line.
     * @return The first net with that name, or null.
     */
    @Nullable
    public NetRoute getNet(String name) {
        for (NetRoute net : nets) {
            if (net.getName().equals(name)) {
                return net;
            }
        }
        return null;
    }

    public CongestionMap getCongestion() {
        return congestion;
    }

    /**
     * Gets an approximate total wire length: the sum of the record counts of all nets.
     * This is a proxy for resource usage, not a geometric length.
     * @return The total number of node records over all nets.
     */
    public long getTotalWireLength() {
        return totalWireLength;
    }

    public List<ParseDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<ParseDiagnostic> getDiagnostics(DiagnosticType type) {
        List<ParseDiagnostic> result = new ArrayList<>();
        for (ParseDiagnostic d : diagnostics) {
            if (d.getType() == type) {
                result.add(d);
            }
        }
        return result;
    }

    /**
     * @return The grid width from the "Array size" banner, or -1 if the banner was absent.
     */
    public int getArrayWidth() {
        return arrayWidth;
    }

    /**
     * @return The grid height from the "Array size" banner, or -1 if the banner was absent.
     */
    public int getArrayHeight() {
        return arrayHeight;
    }

    public boolean hasArraySize() {
        return arrayWidth >= 0 && arrayHeight >= 0;
    }

    @Nullable
    public String getPlacementFile() {
        return placementFile;
    }

    @Override
    public String toString() {
        return sourceName + ": " + nets.size() + " nets, " + congestion.size() + " congestion entries, "
                + diagnostics.size() + " diagnostics";
    }
}
