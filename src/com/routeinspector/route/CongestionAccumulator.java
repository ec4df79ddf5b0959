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

/**
 * Counts how often each channel track is used. One accumulator is filled per net and
 * the per-net accumulators are then merged, so no counter is ever shared between
 * threads.
 */
public class CongestionAccumulator {

    private final Map<CongestionKey, Integer> counts = new LinkedHashMap<>();

    /**
     * Counts the record if it is a CHANX or CHANY node, ignores it otherwise.
     * @param record The record to count.
     */
    public void add(NodeRecord record) {
        if (!record.getKind().isChannel()) {
            return;
        }
        counts.merge(CongestionKey.of(record), 1, Integer::sum);
    }

    /**
     * Adds all counts of another accumulator to this one.
     * @param other The accumulator to merge in, left unchanged.
     */
    public void merge(CongestionAccumulator other) {
        for (Map.Entry<CongestionKey, Integer> e : other.counts.entrySet()) {
            counts.merge(e.getKey(), e.getValue(), Integer::sum);
        }
    }

    public int getCount(CongestionKey key) {
        return counts.getOrDefault(key, 0);
    }

    public Map<CongestionKey, Integer> getCounts() {
        return Collections.unmodifiableMap(counts);
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    /**
     * Divides every count by the largest count.
     * @return A map with values in [0,1] whose maximum is 1.0, or an empty map if
     * nothing was counted.
     */
    public CongestionMap normalize() {
        if (counts.isEmpty()) {
            return CongestionMap.EMPTY;
        }
        int max = 0;
        for (int c : counts.values()) {
            max = Math.max(max, c);
        }
        Map<CongestionKey, Double> normalized = new LinkedHashMap<>();
        for (Map.Entry<CongestionKey, Integer> e : counts.entrySet()) {
            normalized.put(e.getKey(), (double) e.getValue() / max);
        }
        return new CongestionMap(normalized);
    }
}
