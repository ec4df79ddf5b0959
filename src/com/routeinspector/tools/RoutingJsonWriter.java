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


package com.routeinspector.tools;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map.Entry;

import com.routeinspector.analysis.CongestionReport;
import com.routeinspector.analysis.RouteStatistics;
import com.routeinspector.route.NetRoute;
import com.routeinspector.route.NodeRecord;
import com.routeinspector.route.RoutingDocument;
import com.routeinspector.route.TreeNode;
import com.routeinspector.util.FileTools;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Exports a parsed routing document as JSON for visualization front ends.
 */
public class RoutingJsonWriter {

    private static final int INDENT = 2;

    /**
     * Creates the document-level summary: total_routes, total_wire_length,
     * max_congestion and avg_congestion.
     */
    public static JSONObject toSummaryJson(RoutingDocument doc) {
        CongestionReport congestion = new CongestionReport(doc.getCongestion());
        JSONObject summary = new JSONObject();
        summary.put("total_routes", doc.getNets().size());
        summary.put("total_wire_length", doc.getTotalWireLength());
        summary.put("max_congestion", congestion.getMax());
        summary.put("avg_congestion", congestion.getAvg());
        return summary;
    }

    /**
     * Creates one entry per net with its routing tree, the coordinates along every
     * root-to-sink path and its size, plus the document statistics.
     */
    public static JSONObject toTreesJson(RoutingDocument doc) {
        JSONArray nets = new JSONArray();
        for (NetRoute net : doc.getNets()) {
            nets.put(toJson(net));
        }
        RouteStatistics stats = new RouteStatistics(doc);
        JSONObject statistics = new JSONObject();
        statistics.put("total_nets", stats.totalNets);
        statistics.put("nets_with_tree", stats.netsWithRoot);
        statistics.put("nets_without_tree", stats.netsWithoutRoot);
        statistics.put("nets_with_branches", stats.netsWithBranches);
        statistics.put("max_fanout", stats.maxFanout);
        statistics.put("total_paths", stats.totalPaths);
        statistics.put("avg_path_length", stats.avgPathLength);
        statistics.put("total_wire_length", stats.totalWireLength);

        JSONObject result = new JSONObject();
        result.put("nets", nets);
        result.put("statistics", statistics);
        return result;
    }

    public static JSONObject toJson(NetRoute net) {
        JSONObject o = new JSONObject();
        o.put("net_name", net.getName());
        JSONArray paths = new JSONArray();
        for (List<int[]> path : net.getPathCoordinates()) {
            JSONArray coords = new JSONArray();
            for (int[] xy : path) {
                coords.put(new JSONArray().put(xy[0]).put(xy[1]));
            }
            paths.put(coords);
        }
        o.put("paths", paths);
        o.put("tree", net.hasRoot() ? toJson(net.getRoot().get()) : JSONObject.NULL);
        o.put("segment_count", net.getRecordCount());
        o.put("fanout", net.getFanout());
        return o;
    }

    /**
     * Converts a tree to nested objects. The walk uses an explicit stack so deep
     * trees do not exhaust the call stack.
     * @param root Root of the (sub)tree to convert.
     * @return The node object, with a children array.
     */
    public static JSONObject toJson(TreeNode root) {
        JSONObject rootJson = toJson(root.getRecord());
        Deque<TreeNode> nodes = new ArrayDeque<>();
        Deque<JSONObject> objects = new ArrayDeque<>();
        nodes.push(root);
        objects.push(rootJson);
        while (!nodes.isEmpty()) {
            TreeNode node = nodes.pop();
            JSONObject json = objects.pop();
            JSONArray children = new JSONArray();
            json.put("children", children);
            for (TreeNode child : node.getChildren()) {
                JSONObject childJson = toJson(child.getRecord());
                children.put(childJson);
                nodes.push(child);
                objects.push(childJson);
            }
        }
        return rootJson;
    }

    public static JSONObject toJson(NodeRecord record) {
        JSONObject o = new JSONObject();
        o.put("node_id", record.getId());
        o.put("node_type", record.getKind().name());
        o.put("x", record.getX());
        o.put("y", record.getY());
        o.put("track", record.getTrack());
        o.put("switch_id", record.getSwitchId());
        o.put("pad", record.getPad());
        for (Entry<String, Object> e : record.getAttributes().entrySet()) {
            if (!o.has(e.getKey())) {
                o.put(e.getKey(), e.getValue());
            }
        }
        return o;
    }

    /**
     * Writes an indented JSON file.
     * @param json The object to write.
     * @param fileName Destination, replaced if it exists.
     */
    public static void write(JSONObject json, Path fileName) {
        FileTools.writeStringToTextFile(json.toString(INDENT), fileName);
    }
}
