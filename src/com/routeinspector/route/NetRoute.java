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
import java.util.Optional;

/**
 * The routing of one net: the raw node records in file order plus the tree
 * reconstructed from them. The flat record list is always kept so that consumers
 * can fall back to it when the reconstruction is unavailable or looks suspicious.
 */
public class NetRoute {

    private final int netId;

    private final String name;

    private final List<NodeRecord> records;

    private final TreeNode root;

    private final int treeNodeCount;

    /** Number of repeated ids consumed as "return to this node" markers */
    private final int branchMarkerCount;

    /** Number of times a new sub-path was attached to a nearby routing node after a SINK */
    private final int adjacencyReattachmentCount;

    /** Number of times a new sub-path had to be attached to the root after a SINK */
    private final int rootFallbackCount;

    /** Records listed before the SOURCE that could not be placed in the tree */
    private final int detachedRecordCount;

    NetRoute(int netId, String name, List<NodeRecord> records, TreeNode root, int treeNodeCount,
             int branchMarkerCount, int adjacencyReattachmentCount, int rootFallbackCount,
             int detachedRecordCount) {
        this.netId = netId;
        this.name = name;
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        this.root = root;
        this.treeNodeCount = treeNodeCount;
        this.branchMarkerCount = branchMarkerCount;
        this.adjacencyReattachmentCount = adjacencyReattachmentCount;
        this.rootFallbackCount = rootFallbackCount;
        this.detachedRecordCount = detachedRecordCount;
    }

    public int getNetId() {
        return netId;
    }

    public String getName() {
        return name;
    }

    /**
     * Gets the node records of this net exactly as listed in the route file,
     * including repeated branch-marker records.
     * @return An unmodifiable list of records.
     */
    public List<NodeRecord> getRecords() {
        return records;
    }

    public int getRecordCount() {
        return records.size();
    }

    public Optional<TreeNode> getRoot() {
        return Optional.ofNullable(root);
    }

    public boolean hasRoot() {
        return root != null;
    }

    /**
     * @return The number of distinct nodes placed in the tree, 0 without a root.
     */
    public int getTreeNodeCount() {
        return treeNodeCount;
    }

    public int getBranchMarkerCount() {
        return branchMarkerCount;
    }

    public int getAdjacencyReattachmentCount() {
        return adjacencyReattachmentCount;
    }

    public int getRootFallbackCount() {
        return rootFallbackCount;
    }

    public int getDetachedRecordCount() {
        return detachedRecordCount;
    }

    /**
     * Flags trees whose shape relied on the weakest heuristics: sub-paths attached
     * to the root for lack of a better candidate, or records that could not be placed.
     * Consumers should prefer {@link #getRecords()} for such nets.
     * @return True if the reconstruction should not be trusted.
     */
    public boolean isReconstructionSuspicious() {
        return rootFallbackCount > 0 || detachedRecordCount > 0;
    }

    /**
     * Gets a restartable view of all root-to-sink paths. Each iteration walks the
     * tree again.
     * @return The paths; empty if the net has no root.
     */
    public SourceToSinkPaths getSourceToSinkPaths() {
        return new SourceToSinkPaths(root);
    }

    /**
     * @return The number of root-to-sink paths, 0 without a root.
     */
    public int getFanout() {
        return root == null ? 0 : getSourceToSinkPaths().count();
    }

    /**
     * Gets the (x,y) grid coordinates along every root-to-sink path.
     * @return One list of {x, y} pairs per path.
     */
    public List<List<int[]>> getPathCoordinates() {
        List<List<int[]>> result = new ArrayList<>();
        for (List<TreeNode> path : getSourceToSinkPaths()) {
            List<int[]> coords = new ArrayList<>(path.size());
            for (TreeNode n : path) {
                coords.add(new int[] {n.getX(), n.getY()});
            }
            result.add(coords);
        }
        return result;
    }

    @Override
    public String toString() {
        return "Net " + netId + " (" + name + "): " + records.size() + " records"
                + (root == null ? ", no tree" : ", " + treeNodeCount + " tree nodes");
    }
}
