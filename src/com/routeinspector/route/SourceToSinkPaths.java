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
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.jetbrains.annotations.NotNull;

/**
 * The root-to-sink paths of a routing tree, enumerated depth-first with children
 * visited in discovery order. Every call to {@link #iterator()} starts a fresh walk
 * over the tree; no path is stored between walks.
 */
public class SourceToSinkPaths implements Iterable<List<TreeNode>> {

    private final TreeNode root;

    /**
     * @param root Root of the tree to walk, may be null for a net without a tree.
     */
    public SourceToSinkPaths(TreeNode root) {
        this.root = root;
    }

    @NotNull
    @Override
    public Iterator<List<TreeNode>> iterator() {
        return new PathIterator(root);
    }

    @Override
    public Spliterator<List<TreeNode>> spliterator() {
        return Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL);
    }

    public Stream<List<TreeNode>> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /**
     * Walks the whole tree once and counts the paths.
     * @return The number of root-to-sink paths, i.e. the fanout of the net.
     */
    public int count() {
        int count = 0;
        for (Iterator<List<TreeNode>> it = iterator(); it.hasNext(); it.next()) {
            count++;
        }
        return count;
    }

    private static class Frame {
        private final TreeNode node;
        private int nextChild;
        private boolean visited;

        Frame(TreeNode node) {
            this.node = node;
        }
    }

    private static class PathIterator implements Iterator<List<TreeNode>> {
        private final List<Frame> stack = new ArrayList<>();
        private List<TreeNode> next;

        PathIterator(TreeNode root) {
            if (root != null) {
                stack.add(new Frame(root));
            }
            next = advance();
        }

        private List<TreeNode> advance() {
            while (!stack.isEmpty()) {
                Frame top = stack.get(stack.size() - 1);
                if (!top.visited) {
                    top.visited = true;
                    if (top.node.isLeaf()) {
                        return currentPath();
                    }
                }
                List<TreeNode> children = top.node.getChildren();
                if (top.nextChild < children.size()) {
                    stack.add(new Frame(children.get(top.nextChild++)));
                } else {
                    stack.remove(stack.size() - 1);
                }
            }
            return null;
        }

        private List<TreeNode> currentPath() {
            List<TreeNode> path = new ArrayList<>(stack.size());
            for (Frame f : stack) {
                path.add(f.node);
            }
            return Collections.unmodifiableList(path);
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public List<TreeNode> next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            List<TreeNode> path = next;
            next = advance();
            return path;
        }
    }
}
