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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * One occurrence of a routing-resource graph node in a net's record stream.
 * The same id may occur more than once within a net; a repeat marks a branch point.
 * Instances are immutable.
 */
public final class NodeRecord {

    /** Coordinate value used when a position is unknown */
    public static final int UNKNOWN_COORDINATE = -1;
    /** Pad value used when the node is not an I/O pad */
    public static final int NO_PAD = -1;

    private final int id;
    private final NodeKind kind;
    private final int x;
    private final int y;
    private final int track;
    private final int switchId;
    private final int pad;
    /** Line of the route file this record was parsed from, 0 if not parsed from a file */
    private final int lineNumber;
    /** Forward-compatible Key: Value pairs, excluded from equality */
    private final Map<String, Object> attributes;

    public NodeRecord(int id, @NotNull NodeKind kind, int x, int y) {
        this(id, kind, x, y, 0);
    }

    public NodeRecord(int id, @NotNull NodeKind kind, int x, int y, int track) {
        this(id, kind, x, y, track, 0, NO_PAD, Collections.emptyMap(), 0);
    }

    public NodeRecord(int id, @NotNull NodeKind kind, int x, int y, int track, int switchId, int pad,
                      @NotNull Map<String, Object> attributes, int lineNumber) {
        this.id = id;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.x = x;
        this.y = y;
        this.track = track;
        this.switchId = switchId;
        this.pad = pad;
        this.lineNumber = lineNumber;
        this.attributes = attributes.isEmpty() ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public int getId() {
        return id;
    }

    public NodeKind getKind() {
        return kind;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public int getTrack() {
        return track;
    }

    public int getSwitchId() {
        return switchId;
    }

    public int getPad() {
        return pad;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * Gets the additional attributes found on the node line (e.g. "class", "pin").
     * Keys are lower case; values are Integer when the text was numeric, String otherwise.
     * @return An unmodifiable map of attributes.
     */
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    public boolean isIoPad() {
        return pad >= 0;
    }

    public boolean hasKnownLocation() {
        return x >= 0 && y >= 0;
    }

    /**
     * Checks whether another node lies within one grid cell of this one in both axes.
     * @param other The node to compare against.
     * @return True if |dx| <= 1 and |dy| <= 1.
     */
    public boolean isAdjacentOrSame(NodeRecord other) {
        return Math.abs(x - other.x) <= 1 && Math.abs(y - other.y) <= 1;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, x, y, track, switchId, pad);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        NodeRecord other = (NodeRecord) obj;
        return id == other.id && kind == other.kind && x == other.x && y == other.y
                && track == other.track && switchId == other.switchId && pad == other.pad;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Node ").append(id).append(" ").append(kind)
          .append(" (").append(x).append(",").append(y).append(")");
        if (kind.isChannel()) {
            sb.append(" trk=").append(track);
        }
        if (switchId != 0) {
            sb.append(" sw=").append(switchId);
        }
        if (isIoPad()) {
            sb.append(" pad=").append(pad);
        }
        return sb.toString();
    }
}
