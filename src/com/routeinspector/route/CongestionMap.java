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
import java.util.Set;

/**
 * Normalized channel usage: each (kind, x, y, track) key maps to a value in [0,1],
 * where 1.0 marks the most used track(s) of the document.
 */
public final class CongestionMap {

    public static final CongestionMap EMPTY = new CongestionMap(Collections.emptyMap());

    private final Map<CongestionKey, Double> values;

    CongestionMap(Map<CongestionKey, Double> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * @param key The channel track to look up.
     * @return The normalized usage, 0.0 if the track was never used.
     */
    public double get(CongestionKey key) {
        return values.getOrDefault(key, 0.0);
    }

    /**
     * @param key A key in KIND_x_y_track form.
     * @return The normalized usage, 0.0 if the track was never used.
     */
    public double get(String key) {
        return get(CongestionKey.parse(key));
    }

    public boolean containsKey(CongestionKey key) {
        return values.containsKey(key);
    }

    public Set<CongestionKey> keySet() {
        return values.keySet();
    }

    public Map<CongestionKey, Double> asMap() {
        return values;
    }

    /**
     * Renders the keys in the KIND_x_y_track form expected by visualization front ends.
     * @return A new map in first-seen order.
     */
    public Map<String, Double> asStringKeyedMap() {
        Map<String, Double> result = new LinkedHashMap<>();
        for (Map.Entry<CongestionKey, Double> e : values.entrySet()) {
            result.put(e.getKey().toString(), e.getValue());
        }
        return result;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * @return The largest value, 1.0 unless the map is empty, in which case 0.0.
     */
    public double getMaxValue() {
        double max = 0.0;
        for (double v : values.values()) {
            max = Math.max(max, v);
        }
        return max;
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        return values.equals(((CongestionMap) obj).values);
    }

    @Override
    public String toString() {
        return asStringKeyedMap().toString();
    }
}
