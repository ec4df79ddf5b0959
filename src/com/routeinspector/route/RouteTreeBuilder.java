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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.routeinspector.util.MessageGenerator;
import org.jetbrains.annotations.NotNull;

/**
 * Reconstructs a net's routing tree from its flat, ordered list of node records.
 * <p>
 * A route file lists a net's resources as a sequence of visits. When the router
 * branched, the branch point is listed again right before the new branch continues,
 * so a repeated id means "continue from this node" rather than "new node". When a
 * path ends in a SINK and the next record is not such a repeat, the builder looks for
 * an already placed routing node next to the upcoming record and resumes from there,
 * falling back to the root. The result is a best-effort reconstruction; nets that
 * needed the fallback are flagged by {@link NetRoute#isReconstructionSuspicious()}.
 */
public class RouteTreeBuilder {

    /**
     * Builds the tree of a net, discarding diagnostics.
     * @see #build(int, String, List, List, boolean)
     */
    public static NetRoute build(int netId, String name, @NotNull List<NodeRecord> records) {
        return build(netId, name, records, new ArrayList<>(), false);
    }

    /**
     * Builds the tree of a net.
     * @param netId The id from the net's delimiter line.
     * @param name The net name.
     * @param records The net's records in file order.
     * @param diagnostics Receives structural warnings (missing root, detached records,
     * root fallbacks).
     * @param verbose Prints each branch point and reattachment to standard out.
     * @return The net with its tree, or with no root if no SOURCE record exists.
     */
    public static NetRoute build(int netId, String name, @NotNull List<NodeRecord> records,
                                 @NotNull List<ParseDiagnostic> diagnostics, boolean verbose) {
        int rootIndex = -1;
        for (int i = 0; i < records.size(); i++) {
            if (records.get(i).getKind() == NodeKind.SOURCE) {
                rootIndex = i;
                break;
            }
        }
        if (rootIndex < 0) {
            diagnostics.add(new ParseDiagnostic(DiagnosticType.MISSING_ROOT, 0, name,
                    "No SOURCE among " + records.size() + " record(s), only the flat record list is available"));
            return new NetRoute(netId, name, records, null, 0, 0, 0, 0, 0);
        }

        for (int i = 0; i < rootIndex; i++) {
            NodeRecord r = records.get(i);
            diagnostics.add(new ParseDiagnostic(DiagnosticType.DETACHED_RECORD, r.getLineNumber(), name,
                    r + " precedes the SOURCE and was not placed in the tree"));
        }

        TreeNode root = new TreeNode(records.get(rootIndex));
        Map<Integer, TreeNode> placed = new HashMap<>();
        placed.put(root.getId(), root);
        TreeNode currentParent = root;
        int branchMarkers = 0;
        int adjacencyReattachments = 0;
        int rootFallbacks = 0;

        for (int i = rootIndex + 1; i < records.size(); i++) {
            NodeRecord record = records.get(i);
            TreeNode branchPoint = placed.get(record.getId());
            if (branchPoint != null) {
                currentParent = branchPoint;
                branchMarkers++;
                if (verbose) {
                    MessageGenerator.briefMessage("  Branch detected at " + record);
                }
                continue;
            }

            TreeNode node = new TreeNode(record);
            currentParent.addChild(node);
            placed.put(record.getId(), node);

            if (record.getKind() != NodeKind.SINK) {
                currentParent = node;
                continue;
            }

            // The path ended; decide where the next record continues from
            if (i + 1 >= records.size()) {
                continue;
            }
            NodeRecord next = records.get(i + 1);
            if (placed.containsKey(next.getId())) {
                // An explicit branch marker follows and will reposition us
                continue;
            }
            TreeNode candidate = findReattachmentPoint(root, next);
            if (candidate != null) {
                currentParent = candidate;
                adjacencyReattachments++;
                if (verbose) {
                    MessageGenerator.briefMessage("  Reattaching " + next + " below " + candidate.getRecord());
                }
            } else {
                currentParent = root;
                rootFallbacks++;
                diagnostics.add(new ParseDiagnostic(DiagnosticType.ROOT_FALLBACK, next.getLineNumber(), name,
                        "No routing node adjacent to " + next + ", attached to the root"));
            }
        }

        return new NetRoute(netId, name, records, root, placed.size(), branchMarkers,
                adjacencyReattachments, rootFallbacks, rootIndex);
    }

    /**
     * Searches the tree in pre-order (children in discovery order) for the first
     * CHANX, CHANY or OPIN node within one grid cell of the given record.
     * @param root Root of the tree built so far.
     * @param next The record about to be placed.
     * @return The first adjacent candidate, or null if there is none.
     */
    static TreeNode findReattachmentPoint(TreeNode root, NodeRecord next) {
        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TreeNode n = stack.pop();
            if (n.getKind().isReattachmentCandidate() && n.getRecord().isAdjacentOrSame(next)) {
                return n;
            }
            List<TreeNode> children = n.getChildren();
            for (int c = children.size() - 1; c >= 0; c--) {
                stack.push(children.get(c));
            }
        }
        return null;
    }

    /**
     * Finds the node with the given id by walking the tree from the root.
     * @param root Root of the tree.
     * @param id The node id to look for.
     * @return The node, or null if the id is not in the tree.
     */
    public static TreeNode findNode(TreeNode root, int id) {
        if (root == null) {
            return null;
        }
        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TreeNode n = stack.pop();
            if (n.getId() == id) {
                return n;
            }
            for (TreeNode child : n.getChildren()) {
                stack.push(child);
            }
        }
        return null;
    }
}
