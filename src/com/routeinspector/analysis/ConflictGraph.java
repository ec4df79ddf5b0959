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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import com.routeinspector.route.NetRoute;
import com.routeinspector.route.NodeRecord;
import com.routeinspector.route.RoutingDocument;
import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.alg.connectivity.ConnectivityInspector;
import org.jgrapht.alg.scoring.BetweennessCentrality;
import org.jgrapht.alg.scoring.ClusteringCoefficient;
import org.jgrapht.graph.SimpleGraph;

/**
 * Undirected graph with one vertex per net name, where an edge means the two nets
 * compete for the same region or the same routing resources. Bounding box overlaps
 * are detected first; a shared resource only adds an edge between nets that are not
 * already connected.
 */
public class ConflictGraph {

    public static final double DEFAULT_HUB_THRESHOLD = 0.1;

    public static final String NUM_NODES = "num_nodes";
    public static final String NUM_EDGES = "num_edges";
    public static final String DENSITY = "density";
    public static final String AVG_DEGREE = "avg_degree";
    public static final String CLUSTERING_COEFFICIENT = "clustering_coefficient";
    public static final String CONNECTED_COMPONENTS = "connected_components";

    private final Graph<String, ConflictEdge> graph;

    public ConflictGraph() {
        graph = new SimpleGraph<>(ConflictEdge.class);
    }

    public ConflictGraph(RoutingDocument doc) {
        this();
        for (NetRoute net : doc.getNets()) {
            graph.addVertex(net.getName());
        }
        addBoundingBoxConflicts(doc.getNets());
        addSharedSegmentConflicts(doc.getNets());
    }

    private void addBoundingBoxConflicts(List<NetRoute> nets) {
        Map<String, BoundingBox> boxes = new LinkedHashMap<>();
        for (NetRoute net : nets) {
            BoundingBox bbox = BoundingBox.of(net);
            if (bbox != null) {
                boxes.put(net.getName(), bbox);
            }
        }
        List<Entry<String, BoundingBox>> entries = new ArrayList<>(boxes.entrySet());
        for (int i = 0; i < entries.size(); i++) {
            for (int j = i + 1; j < entries.size(); j++) {
                if (entries.get(i).getValue().overlaps(entries.get(j).getValue())) {
                    addConflict(entries.get(i).getKey(), entries.get(j).getKey(), ConflictType.BBOX_OVERLAP, null);
                }
            }
        }
    }

    private void addSharedSegmentConflicts(List<NetRoute> nets) {
        Map<String, Set<String>> usage = new LinkedHashMap<>();
        for (NetRoute net : nets) {
            for (NodeRecord r : net.getRecords()) {
                String key = r.getX() + "," + r.getY() + "," + r.getKind();
                usage.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(net.getName());
            }
        }
        for (Entry<String, Set<String>> e : usage.entrySet()) {
            if (e.getValue().size() < 2) {
                continue;
            }
            List<String> users = new ArrayList<>(e.getValue());
            for (int i = 0; i < users.size(); i++) {
                for (int j = i + 1; j < users.size(); j++) {
                    addConflict(users.get(i), users.get(j), ConflictType.SHARED_SEGMENT, e.getKey());
                }
            }
        }
    }

    /**
     * Connects two nets unless they are the same net or already connected.
     * @return True if a new edge was added.
     */
    public boolean addConflict(String net0, String net1, ConflictType type, String segment) {
        if (net0.equals(net1) || graph.containsEdge(net0, net1)) {
            return false;
        }
        graph.addVertex(net0);
        graph.addVertex(net1);
        return graph.addEdge(net0, net1, new ConflictEdge(type, segment));
    }

    public Graph<String, ConflictEdge> getGraph() {
        return graph;
    }

    public ConflictEdge getConflict(String net0, String net1) {
        return graph.getEdge(net0, net1);
    }

    /**
     * @param netName Name of a net.
     * @return The nets in conflict with the given one, empty if the net is unknown.
     */
    public List<String> getConflictsFor(String netName) {
        if (!graph.containsVertex(netName)) {
            return Collections.emptyList();
        }
        return Graphs.neighborListOf(graph, netName);
    }

    public List<Set<String>> getConnectedComponents() {
        return new ConnectivityInspector<>(graph).connectedSets();
    }

    public List<String> identifyHubs() {
        return identifyHubs(DEFAULT_HUB_THRESHOLD);
    }

    /**
     * Finds nets that sit on many shortest paths between other nets.
     * @param centralityThreshold Exclusive lower bound on normalized betweenness centrality.
     * @return The hub nets, most central first.
     */
    public List<String> identifyHubs(double centralityThreshold) {
        if (graph.vertexSet().isEmpty()) {
            return Collections.emptyList();
        }
        Map<String, Double> centrality = new BetweennessCentrality<>(graph, true).getScores();
        List<String> hubs = new ArrayList<>();
        for (Entry<String, Double> e : centrality.entrySet()) {
            if (e.getValue() > centralityThreshold) {
                hubs.add(e.getKey());
            }
        }
        hubs.sort((a, b) -> Double.compare(centrality.get(b), centrality.get(a)));
        return hubs;
    }

    /**
     * Computes size and shape metrics of the graph, keyed by the NUM_NODES, NUM_EDGES,
     * DENSITY, AVG_DEGREE, CLUSTERING_COEFFICIENT and CONNECTED_COMPONENTS constants.
     * @return The metrics in that order, or an empty map for a graph without vertices.
     */
    public Map<String, Double> getMetrics() {
        Map<String, Double> metrics = new LinkedHashMap<>();
        int n = graph.vertexSet().size();
        if (n == 0) {
            return metrics;
        }
        int m = graph.edgeSet().size();
        metrics.put(NUM_NODES, (double) n);
        metrics.put(NUM_EDGES, (double) m);
        metrics.put(DENSITY, n > 1 ? 2.0 * m / ((double) n * (n - 1)) : 0.0);
        metrics.put(AVG_DEGREE, 2.0 * m / n);
        metrics.put(CLUSTERING_COEFFICIENT,
                new ClusteringCoefficient<>(graph).getAverageClusteringCoefficient());
        metrics.put(CONNECTED_COMPONENTS, (double) getConnectedComponents().size());
        return metrics;
    }

    @Override
    public String toString() {
        return "ConflictGraph: " + graph.vertexSet().size() + " nets, " + graph.edgeSet().size() + " conflicts";
    }
}
