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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import com.routeinspector.route.CongestionKey;
import com.routeinspector.route.CongestionMap;
import com.routeinspector.util.MessageGenerator;

/**
 * Summary of a normalized congestion map: extremes, mean and the segments whose
 * usage is close to the most used one.
 */
public class CongestionReport {

    public static final double DEFAULT_THRESHOLD = 0.8;

    private final CongestionMap congestion;

    private final double threshold;

    private double max;

    private double min;

    private double avg;

    private int congestedSegments;

    public CongestionReport(CongestionMap congestion) {
        this(congestion, DEFAULT_THRESHOLD);
    }

    /**
     * @param congestion Normalized congestion values.
     * @param threshold Segments with a value strictly above this are counted as congested.
     */
    public CongestionReport(CongestionMap congestion, double threshold) {
        this.congestion = congestion;
        this.threshold = threshold;
        if (congestion.isEmpty()) {
            return;
        }
        max = Double.NEGATIVE_INFINITY;
        min = Double.POSITIVE_INFINITY;
        double sum = 0;
        for (double value : congestion.asMap().values()) {
            max = Math.max(max, value);
            min = Math.min(min, value);
            sum += value;
            if (value > threshold) {
                congestedSegments++;
            }
        }
        avg = sum / congestion.size();
    }

    public double getThreshold() {
        return threshold;
    }

    public double getMax() {
        return max;
    }

    public double getMin() {
        return min;
    }

    public double getAvg() {
        return avg;
    }

    public int getCongestedSegments() {
        return congestedSegments;
    }

    public int getTotalSegments() {
        return congestion.size();
    }

    /**
     * Gets the segments whose normalized usage is above a threshold, most congested first.
     * Ties are ordered by the string form of the key.
     * @param threshold Exclusive lower bound on the normalized value.
     * @return The matching segments with their values.
     */
    public List<Entry<CongestionKey, Double>> getHighCongestionSegments(double threshold) {
        List<Entry<CongestionKey, Double>> result = new ArrayList<>();
        for (Entry<CongestionKey, Double> e : congestion.asMap().entrySet()) {
            if (e.getValue() > threshold) {
                result.add(Map.entry(e.getKey(), e.getValue()));
            }
        }
        result.sort(Comparator.comparing((Entry<CongestionKey, Double> e) -> e.getValue()).reversed()
                .thenComparing(e -> e.getKey().toString()));
        return result;
    }

    public List<Entry<CongestionKey, Double>> getHighCongestionSegments() {
        return getHighCongestionSegments(threshold);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(MessageGenerator.formatString("Channel segments used:", getTotalSegments()));
        sb.append(MessageGenerator.formatString("Max congestion:", max));
        sb.append(MessageGenerator.formatString("Avg congestion:", avg));
        sb.append(MessageGenerator.formatString("Min congestion:", min));
        sb.append(MessageGenerator.formatString("Segments above " + threshold + ":", congestedSegments));
        return sb.toString();
    }
}
