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
import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TestRouteTreeBuilder {

    private static NodeRecord rec(int id, NodeKind kind, int x, int y) {
        return new NodeRecord(id, kind, x, y);
    }

    private static NodeRecord rec(int id, NodeKind kind, int x, int y, int track) {
        return new NodeRecord(id, kind, x, y, track);
    }

    private static List<Integer> ids(List<TreeNode> path) {
        return path.stream().map(TreeNode::getId).collect(Collectors.toList());
    }

    private static List<List<Integer>> paths(NetRoute net) {
        return net.getSourceToSinkPaths().stream().map(TestRouteTreeBuilder::ids).collect(Collectors.toList());
    }

    private static List<TreeNode> allNodes(TreeNode root) {
        List<TreeNode> nodes = new ArrayList<>();
        List<TreeNode> stack = new ArrayList<>();
        stack.add(root);
        while (!stack.isEmpty()) {
            TreeNode n = stack.remove(stack.size() - 1);
            nodes.add(n);
            stack.addAll(n.getChildren());
        }
        return nodes;
    }

    @Test
    public void testLinearNet() {
        NetRoute net = RouteTreeBuilder.build(0, "c0", Arrays.asList(
                rec(1, NodeKind.SOURCE, 0, 0),
                rec(2, NodeKind.OPIN, 0, 0),
                rec(3, NodeKind.CHANX, 0, 0, 2),
                rec(4, NodeKind.IPIN, 1, 0),
                rec(5, NodeKind.SINK, 1, 0)));

        Assertions.assertTrue(net.hasRoot());
        Assertions.assertEquals(Arrays.asList(Arrays.asList(1, 2, 3, 4, 5)), paths(net));
        Assertions.assertEquals(5, net.getTreeNodeCount());
        Assertions.assertEquals(1, net.getFanout());
        Assertions.assertFalse(net.isReconstructionSuspicious());
        TreeNode root = net.getRoot().get();
        Assertions.assertTrue(root.isRoot());
        Assertions.assertNull(root.getParent());
        TreeNode sink = RouteTreeBuilder.findNode(root, 5);
        Assertions.assertEquals(4, sink.getDepth());
        Assertions.assertEquals(Arrays.asList(1, 2, 3, 4, 5), ids(sink.getPathFromRoot()));
    }

    @Test
    public void testBranchFromRepeatedId() {
        NetRoute net = RouteTreeBuilder.build(1, "c1", Arrays.asList(
                rec(1, NodeKind.SOURCE, 0, 0),
                rec(2, NodeKind.CHANY, 1, 1, 0),
                rec(3, NodeKind.CHANX, 2, 1, 1),
                rec(4, NodeKind.SINK, 2, 1),
                rec(2, NodeKind.CHANY, 1, 1, 0),
                rec(5, NodeKind.CHANX, 1, 2, 3),
                rec(6, NodeKind.SINK, 1, 2)));

        Assertions.assertEquals(Arrays.asList(Arrays.asList(1, 2, 3, 4), Arrays.asList(1, 2, 5, 6)), paths(net));
        Assertions.assertEquals(7, net.getRecordCount());
        Assertions.assertEquals(6, net.getTreeNodeCount());
        Assertions.assertEquals(1, net.getBranchMarkerCount());
        Assertions.assertEquals(0, net.getAdjacencyReattachmentCount());
        TreeNode branchPoint = RouteTreeBuilder.findNode(net.getRoot().get(), 2);
        Assertions.assertEquals(2, branchPoint.getChildren().size());
    }

    @Test
    public void testIdsAreUniqueInTree() {
        NetRoute net = RouteTreeBuilder.build(2, "repeats", Arrays.asList(
                rec(1, NodeKind.SOURCE, 0, 0),
                rec(2, NodeKind.OPIN, 0, 0),
                rec(3, NodeKind.CHANX, 1, 0, 0),
                rec(4, NodeKind.SINK, 1, 0),
                rec(3, NodeKind.CHANX, 1, 0, 0),
                rec(5, NodeKind.SINK, 1, 1),
                rec(2, NodeKind.OPIN, 0, 0),
                rec(3, NodeKind.CHANX, 1, 0, 0),
                rec(6, NodeKind.CHANY, 0, 1, 1),
                rec(7, NodeKind.SINK, 0, 2)));

        List<TreeNode> nodes = allNodes(net.getRoot().get());
        Set<Integer> unique = new HashSet<>();
        for (TreeNode n : nodes) {
            Assertions.assertTrue(unique.add(n.getId()), "Duplicate node " + n);
        }
        Assertions.assertEquals(7, nodes.size());
        Assertions.assertEquals(net.getTreeNodeCount(), nodes.size());
        Assertions.assertEquals(3, net.getBranchMarkerCount());
    }

    @Test
    public void testLeafCountMatchesPathCount() {
        NetRoute net = RouteTreeBuilder.build(3, "fanout", Arrays.asList(
                rec(1, NodeKind.SOURCE, 2, 2),
                rec(2, NodeKind.OPIN, 2, 2),
                rec(3, NodeKind.CHANX, 2, 1, 0),
                rec(4, NodeKind.IPIN, 3, 1),
                rec(5, NodeKind.SINK, 3, 1),
                rec(3, NodeKind.CHANX, 2, 1, 0),
                rec(6, NodeKind.IPIN, 1, 1),
                rec(7, NodeKind.SINK, 1, 1),
                rec(2, NodeKind.OPIN, 2, 2),
                rec(8, NodeKind.CHANY, 2, 3, 1),
                rec(9, NodeKind.IPIN, 2, 4),
                rec(10, NodeKind.SINK, 2, 4),
                rec(8, NodeKind.CHANY, 2, 3, 1),
                rec(11, NodeKind.CHANX, 3, 3, 2)));

        long leaves = allNodes(net.getRoot().get()).stream().filter(TreeNode::isLeaf).count();
        Assertions.assertEquals(3, leaves);
        Assertions.assertEquals(leaves, net.getSourceToSinkPaths().count());
        // The dangling CHANX is not a sink and ends no path
        TreeNode dangling = RouteTreeBuilder.findNode(net.getRoot().get(), 11);
        Assertions.assertTrue(dangling.getChildren().isEmpty());
        Assertions.assertFalse(dangling.isLeaf());
    }

    @Test
    public void testAdjacencyReattachment() {
        NetRoute net = RouteTreeBuilder.build(4, "adjacent", Arrays.asList(
                rec(1, NodeKind.SOURCE, 0, 0),
                rec(2, NodeKind.OPIN, 0, 0),
                rec(3, NodeKind.CHANX, 1, 0, 0),
                rec(4, NodeKind.CHANY, 5, 5, 0),
                rec(5, NodeKind.SINK, 5, 6),
                rec(6, NodeKind.CHANX, 6, 4, 1),
                rec(7, NodeKind.SINK, 7, 4)));

        Assertions.assertEquals(1, net.getAdjacencyReattachmentCount());
        Assertions.assertEquals(0, net.getRootFallbackCount());
        TreeNode n6 = RouteTreeBuilder.findNode(net.getRoot().get(), 6);
        Assertions.assertEquals(4, n6.getParent().getId());
        Assertions.assertEquals(Arrays.asList(Arrays.asList(1, 2, 3, 4, 5), Arrays.asList(1, 2, 3, 4, 6, 7)),
                paths(net));
    }

    @Test
    public void testReattachmentPrefersFirstCandidateInPreOrder() {
        NodeRecord source = rec(1, NodeKind.SOURCE, 0, 0);
        NodeRecord opin = rec(2, NodeKind.OPIN, 1, 1);
        NodeRecord chanx = rec(3, NodeKind.CHANX, 2, 2, 0);
        NetRoute net = RouteTreeBuilder.build(5, "preorder", Arrays.asList(
                source, opin, chanx, rec(4, NodeKind.SINK, 2, 2)));
        TreeNode root = net.getRoot().get();
        // Both the OPIN and the CHANX are adjacent to (2,1), the OPIN comes first
        TreeNode found = RouteTreeBuilder.findReattachmentPoint(root, rec(9, NodeKind.IPIN, 2, 1));
        Assertions.assertEquals(2, found.getId());
        Assertions.assertNull(RouteTreeBuilder.findReattachmentPoint(root, rec(9, NodeKind.IPIN, 9, 9)));
    }

    @Test
    public void testRootFallback() {
        List<ParseDiagnostic> diagnostics = new ArrayList<>();
        NetRoute net = RouteTreeBuilder.build(6, "far", Arrays.asList(
                rec(1, NodeKind.SOURCE, 0, 0),
                rec(2, NodeKind.OPIN, 0, 0),
                rec(3, NodeKind.CHANX, 1, 0, 0),
                rec(4, NodeKind.SINK, 1, 0),
                rec(5, NodeKind.CHANY, 8, 8, 0),
                rec(6, NodeKind.SINK, 8, 9)), diagnostics, false);

        Assertions.assertEquals(1, net.getRootFallbackCount());
        Assertions.assertTrue(net.isReconstructionSuspicious());
        Assertions.assertEquals(1, net.getRoot().get().getChildren().stream().filter(c -> c.getId() == 5).count());
        Assertions.assertEquals(1, diagnostics.size());
        Assertions.assertEquals(DiagnosticType.ROOT_FALLBACK, diagnostics.get(0).getType());
        Assertions.assertEquals("far", diagnostics.get(0).getNetName());
    }

    @Test
    public void testMissingSource() {
        List<ParseDiagnostic> diagnostics = new ArrayList<>();
        List<NodeRecord> records = Arrays.asList(
                rec(2, NodeKind.OPIN, 0, 0),
                rec(3, NodeKind.CHANX, 1, 0, 0),
                rec(4, NodeKind.SINK, 1, 0));
        NetRoute net = RouteTreeBuilder.build(7, "headless", records, diagnostics, false);

        Assertions.assertFalse(net.hasRoot());
        Assertions.assertFalse(net.getRoot().isPresent());
        Assertions.assertEquals(records, net.getRecords());
        Assertions.assertEquals(0, net.getFanout());
        Assertions.assertFalse(net.getSourceToSinkPaths().iterator().hasNext());
        Assertions.assertTrue(net.getPathCoordinates().isEmpty());
        Assertions.assertEquals(1, diagnostics.size());
        Assertions.assertEquals(DiagnosticType.MISSING_ROOT, diagnostics.get(0).getType());
    }

    @Test
    public void testEmptyNet() {
        NetRoute net = RouteTreeBuilder.build(8, "empty", new ArrayList<>());
        Assertions.assertFalse(net.hasRoot());
        Assertions.assertEquals(0, net.getRecordCount());
        Assertions.assertEquals(0, net.getTreeNodeCount());
    }

    @Test
    public void testRecordsBeforeSourceAreDetached() {
        List<ParseDiagnostic> diagnostics = new ArrayList<>();
        NetRoute net = RouteTreeBuilder.build(9, "late_source", Arrays.asList(
                rec(7, NodeKind.CHANX, 4, 4, 1),
                rec(1, NodeKind.SOURCE, 0, 0),
                rec(2, NodeKind.OPIN, 0, 0),
                rec(3, NodeKind.SINK, 0, 1)), diagnostics, false);

        Assertions.assertEquals(1, net.getRoot().get().getId());
        Assertions.assertEquals(1, net.getDetachedRecordCount());
        Assertions.assertEquals(4, net.getRecordCount());
        Assertions.assertEquals(3, net.getTreeNodeCount());
        Assertions.assertNull(RouteTreeBuilder.findNode(net.getRoot().get(), 7));
        Assertions.assertTrue(net.isReconstructionSuspicious());
        Assertions.assertEquals(DiagnosticType.DETACHED_RECORD, diagnostics.get(0).getType());
    }

    @Test
    public void testPathsAreRestartable() {
        NetRoute net = RouteTreeBuilder.build(1, "c1", Arrays.asList(
                rec(1, NodeKind.SOURCE, 0, 0),
                rec(2, NodeKind.CHANY, 1, 1, 0),
                rec(3, NodeKind.SINK, 2, 1),
                rec(2, NodeKind.CHANY, 1, 1, 0),
                rec(4, NodeKind.SINK, 1, 2)));
        SourceToSinkPaths paths = net.getSourceToSinkPaths();
        Iterator<List<TreeNode>> first = paths.iterator();
        first.next();
        // A second walk is independent of a partially consumed one
        Assertions.assertEquals(2, paths.count());
        Assertions.assertTrue(first.hasNext());
        Assertions.assertEquals(Arrays.asList(1, 2, 4), ids(first.next()));
        Assertions.assertFalse(first.hasNext());
        Assertions.assertThrows(java.util.NoSuchElementException.class, first::next);
        Assertions.assertEquals(paths(net), paths(net));
    }

    @Test
    public void testLongNetDoesNotRecurse() {
        List<NodeRecord> records = new ArrayList<>();
        records.add(rec(0, NodeKind.SOURCE, 0, 0));
        for (int i = 1; i < 50000; i++) {
            records.add(rec(i, i % 2 == 0 ? NodeKind.CHANX : NodeKind.CHANY, i % 100, i / 100, i % 4));
        }
        records.add(rec(50000, NodeKind.SINK, 0, 0));
        NetRoute net = RouteTreeBuilder.build(10, "long", records);
        Assertions.assertEquals(1, net.getFanout());
        Assertions.assertEquals(50001, net.getSourceToSinkPaths().iterator().next().size());
    }

    @Test
    public void testPathCoordinates() {
        NetRoute net = RouteTreeBuilder.build(0, "c0", Arrays.asList(
                rec(1, NodeKind.SOURCE, 0, 0),
                rec(2, NodeKind.CHANX, 1, 0, 0),
                rec(3, NodeKind.SINK, 1, 1)));
        List<List<int[]>> coords = net.getPathCoordinates();
        Assertions.assertEquals(1, coords.size());
        Assertions.assertArrayEquals(new int[] {1, 1}, coords.get(0).get(2));
    }
}
