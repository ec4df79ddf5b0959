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


package com.routeinspector.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Measures the wall-clock runtime of consecutive named segments of a program and
 * prints them as they complete, followed by a total.
 */
public class CodePerfTracker {

    private final String name;

    private final List<String> segmentNames = new ArrayList<>();

    private final List<Long> runtimes = new ArrayList<>();

    private final boolean printProgress;

    private boolean running;

    private static final int SEGMENT_NAME_SIZE = 24;

    /** A tracker that records nothing and prints nothing */
    public static final CodePerfTracker SILENT = new CodePerfTracker(null, false);

    public CodePerfTracker(String name) {
        this(name, true);
    }

    public CodePerfTracker(String name, boolean printProgress) {
        this.name = name;
        this.printProgress = printProgress;
        if (printProgress && name != null) {
            MessageGenerator.printHeader(name);
        }
    }

    public CodePerfTracker start(String segmentName) {
        if (this == SILENT) return this;
        segmentNames.add(segmentName);
        runtimes.add(System.nanoTime());
        running = true;
        return this;
    }

    public CodePerfTracker stop() {
        if (this == SILENT || !running) return this;
        int idx = runtimes.size() - 1;
        runtimes.set(idx, System.nanoTime() - runtimes.get(idx));
        running = false;
        if (printProgress) {
            print(segmentNames.get(idx), runtimes.get(idx));
        }
        return this;
    }

    /**
     * @param segmentName Name passed to {@link #start(String)}.
     * @return Runtime of the segment in nanoseconds, or null if it never completed.
     */
    public Long getRuntime(String segmentName) {
        int i = segmentNames.indexOf(segmentName);
        if (i == -1 || (running && i == runtimes.size() - 1)) {
            return null;
        }
        return runtimes.get(i);
    }

    public List<String> getSegmentNames() {
        return segmentNames;
    }

    private static void print(String segmentName, long runtime) {
        System.out.printf("%" + SEGMENT_NAME_SIZE + "s: %9.3fs\n", segmentName, runtime / 1000000000.0);
    }

    public void printSummary() {
        if (this == SILENT) return;
        int completed = running ? runtimes.size() - 1 : runtimes.size();
        if (!printProgress) {
            MessageGenerator.printHeader(name);
            for (int i = 0; i < completed; i++) {
                print(segmentNames.get(i), runtimes.get(i));
            }
        }
        long total = 0L;
        for (int i = 0; i < completed; i++) {
            total += runtimes.get(i);
        }
        System.out.println("------------------------------------------------------------------------------");
        print("*Total*", total);
    }
}
