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
 * A {@link NodeRecord} placed in a net's routing tree. Children are kept in discovery
 * order. Only {@link RouteTreeBuilder} links nodes together; once a tree is returned it
 * is read-only.
 */
public class TreeNode {

    private final NodeRecord record;

    private TreeNode parent;

    private final List<TreeNode> children;

    private final List<TreeNode> childrenView;

    TreeNode(NodeRecord record) {
        this.record = record;
        this.children = new ArrayList<>(1);
        this.childrenView = Collections.unmodifiableList(children);
    }

    void addChild(TreeNode child) {
        children.add(child);
        child.parent = this;
    }

    public NodeRecord getRecord() {
        return record;
    }

    public int getId() {
        return record.getId();
    }

    public NodeKind getKind() {
        return record.getKind();
    }

    public int getX() {
        return record.getX();
    }

    public int getY() {
        return record.getY();
    }

    /**
     * @return The parent node, or null for the root.
     */
    @Nullable
    public TreeNode getParent() {
        return parent;
    }

    public List<TreeNode> getChildren() {
        return childrenView;
    }

    public boolean isRoot() {
        return parent == null && record.getKind() == NodeKind.SOURCE;
    }

    /**
     * A leaf is a SINK that nothing continues from. Childless nodes of any other kind
     * are dangling branches and do not terminate a source-to-sink path.
     */
    public boolean isLeaf() {
        return children.isEmpty() && record.getKind() == NodeKind.SINK;
    }

    /**
     * Counts the edges between this node and the root.
     * @return 0 for the root.
     */
    public int getDepth() {
        int depth = 0;
        TreeNode n = parent;
        while (n != null) {
            depth++;
            n = n.parent;
        }
        return depth;
    }

    /**
     * Walks the parent references up to the root.
     * @return The nodes from the root down to (and including) this node.
     */
    public List<TreeNode> getPathFromRoot() {
        List<TreeNode> path = new ArrayList<>();
        TreeNode n = this;
        while (n != null) {
            path.add(n);
            n = n.parent;
        }
        Collections.reverse(path);
        return path;
    }

    @Override
    public String toString() {
        return record.toString();
    }
}
