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

import java.util.List;

import com.routeinspector.route.NetRoute;
import com.routeinspector.route.RoutingDocument;
import com.routeinspector.route.TreeNode;

/**
 * Aggregate counts over all nets of a parsed routing document.
 */
public class RouteStatistics {

    public int totalNets;
    public int totalRecords;
    public int netsWithRoot;
    public int netsWithoutRoot;
    /** Nets with more than one root-to-sink path */
    public int netsWithBranches;
    public int maxFanout;
    public int totalPaths;
    /** Mean number of tree nodes along a root-to-sink path */
    public double avgPathLength;
    public int suspiciousNets;
    public long totalWireLength;

    public RouteStatistics() {
    }

    /**
     * Walks every net of the document once, enumerating all of its root-to-sink paths.
     * @param doc The parsed document.
     */
    public RouteStatistics(RoutingDocument doc) {
        long pathNodes = 0;
        for (NetRoute net : doc.getNets()) {
            totalNets++;
            totalRecords += net.getRecordCount();
            if (net.isReconstructionSuspicious()) {
                suspiciousNets++;
            }
            if (!net.hasRoot()) {
                netsWithoutRoot++;
                continue;
            }
            netsWithRoot++;
            int fanout = 0;
            for (List<TreeNode> path : net.getSourceToSinkPaths()) {
                fanout++;
                pathNodes += path.size();
            }
            totalPaths += fanout;
            maxFanout = Math.max(maxFanout, fanout);
            if (fanout > 1) {
                netsWithBranches++;
            }
        }
        avgPathLength = totalPaths == 0 ? 0.0 : (double) pathNodes / totalPaths;
        totalWireLength = doc.getTotalWireLength();
    }

    @Override
    public String toString() {
        return toString("Route Statistics");
    }

    public String toString(String title) {
        StringBuilder sb = new StringBuilder();
        sb.append(title);
        sb.append("\n");
        sb.append("                                               :       count :\n");
        sb.append("   ------------------------------------------- : ----------- :\n");
        sb.append(String.format("   # of nets.................................. : %11d :\n", totalNets));
        sb.append(String.format("       # of nets with a routing tree.......... : %11d :\n", netsWithRoot));
        sb.append(String.format("           # of nets with branches............ : %11d :\n", netsWithBranches));
        if (suspiciousNets > 0) {
            sb.append(String.format("           # of uncertain reconstructions..... : %11d :\n", suspiciousNets));
        }
        if (netsWithoutRoot > 0) {
            sb.append(String.format("       # of nets without a SOURCE............. : %11d :\n", netsWithoutRoot));
        }
        sb.append(String.format("   # of node records.......................... : %11d :\n", totalRecords));
        sb.append(String.format("   # of source-to-sink paths.................. : %11d :\n", totalPaths));
        sb.append(String.format("       max fanout............................. : %11d :\n", maxFanout));
        sb.append(String.format("       avg path length (nodes)................ : %11.2f :\n", avgPathLength));
        sb.append(String.format("   total wire length.......................... : %11d :\n", totalWireLength));
        sb.append("   ------------------------------------------- : ----------- :");
        return sb.toString();
    }
}
