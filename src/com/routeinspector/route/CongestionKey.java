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

import java.util.Objects;

/**
 * Identifies one channel track at one grid location: (kind, x, y, track).
 * Rendered as KIND_x_y_track, e.g. CHANX_4_0_2.
 */
public final class CongestionKey {

    private static final String SEPARATOR = "_";

    private final NodeKind kind;
    private final int x;
    private final int y;
    private final int track;

    public CongestionKey(NodeKind kind, int x, int y, int track) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.x = x;
        this.y = y;
        this.track = track;
    }

    public static CongestionKey of(NodeRecord record) {
        return new CongestionKey(record.getKind(), record.getX(), record.getY(), record.getTrack());
    }

    /**
     * Parses the KIND_x_y_track form produced by {@link #toString()}.
     * @param key The string key.
     * @return The key.
     * @throws IllegalArgumentException If the string is not in the expected form.
     */
    public static CongestionKey parse(String key) {
        String[] parts = key.split(SEPARATOR);
        if (parts.length != 4) {
            throw new IllegalArgumentException("ERROR: Malformed congestion key: " + key);
        }
        NodeKind kind = NodeKind.fromString(parts[0]);
        if (kind == null) {
            throw new IllegalArgumentException("ERROR: Unknown node kind in congestion key: " + key);
        }
        try {
            return new CongestionKey(kind, Integer.parseInt(parts[1]), Integer.parseInt(parts[2]),
                    Integer.parseInt(parts[3]));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("ERROR: Malformed congestion key: " + key, e);
        }
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

    @Override
    public int hashCode() {
        return Objects.hash(kind, x, y, track);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        CongestionKey other = (CongestionKey) obj;
        return kind == other.kind && x == other.x && y == other.y && track == other.track;
    }

    @Override
    public String toString() {
        return kind + SEPARATOR + x + SEPARATOR + y + SEPARATOR + track;
    }
}
