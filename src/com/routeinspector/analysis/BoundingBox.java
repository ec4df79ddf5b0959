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

import java.util.Objects;

import com.routeinspector.route.NetRoute;
import com.routeinspector.route.NodeRecord;

/**
 * Closed rectangle of grid coordinates covered by the records of a net.
 */
public final class BoundingBox {

    private final int minX;
    private final int maxX;
    private final int minY;
    private final int maxY;

    public BoundingBox(int minX, int maxX, int minY, int maxY) {
        this.minX = minX;
        this.maxX = maxX;
        this.minY = minY;
        this.maxY = maxY;
    }

    /**
     * Computes the box of a net from its records. Negative (unknown) coordinates
     * are left out, x and y independently.
     * @param net The net.
     * @return The box, or null if the net has no valid x or no valid y coordinate.
     */
    public static BoundingBox of(NetRoute net) {
        int minX = Integer.MAX_VALUE;
        int maxX = Integer.MIN_VALUE;
        int minY = Integer.MAX_VALUE;
        int maxY = Integer.MIN_VALUE;
        for (NodeRecord r : net.getRecords()) {
            if (r.getX() >= 0) {
                minX = Math.min(minX, r.getX());
                maxX = Math.max(maxX, r.getX());
            }
            if (r.getY() >= 0) {
                minY = Math.min(minY, r.getY());
                maxY = Math.max(maxY, r.getY());
            }
        }
        if (minX > maxX || minY > maxY) {
            return null;
        }
        return new BoundingBox(minX, maxX, minY, maxY);
    }

    public int getMinX() {
        return minX;
    }

    public int getMaxX() {
        return maxX;
    }

    public int getMinY() {
        return minY;
    }

    public int getMaxY() {
        return maxY;
    }

    /**
     * Boxes that only share an edge or a corner overlap.
     */
    public boolean overlaps(BoundingBox other) {
        return !(maxX < other.minX || minX > other.maxX || maxY < other.minY || minY > other.maxY);
    }

    @Override
    public int hashCode() {
        return Objects.hash(minX, maxX, minY, maxY);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof BoundingBox))
            return false;
        BoundingBox other = (BoundingBox) obj;
        return minX == other.minX && maxX == other.maxX && minY == other.minY && maxY == other.maxY;
    }

    @Override
    public String toString() {
        return "[(" + minX + "," + minY + ") - (" + maxX + "," + maxY + ")]";
    }
}
