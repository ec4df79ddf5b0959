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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class TestNetBoundaryScanner {

    @Test
    public void testNetHeader() {
        NetHeader h = NetBoundaryScanner.matchNetHeader("Net 12 (top.u1.q[3])", 40);
        Assertions.assertEquals(12, h.getId());
        Assertions.assertEquals("top.u1.q[3]", h.getName());
        Assertions.assertEquals(40, h.getLineNumber());
        Assertions.assertEquals("Net 12 (top.u1.q[3])", h.toString());
    }

    @Test
    public void testGlobalNetHeader() {
        NetHeader h = NetBoundaryScanner.matchNetHeader("Net 3 (clk): global net connecting:", 1);
        Assertions.assertEquals(3, h.getId());
        Assertions.assertEquals("clk", h.getName());
    }

    @Test
    public void testNetNameWithParentheses() {
        Assertions.assertEquals("a (b)", NetBoundaryScanner.matchNetHeader("Net 0 (a (b))", 1).getName());
        NetHeader h = NetBoundaryScanner.matchNetHeader("Net 5 (f(x)): global net connecting:", 1);
        Assertions.assertEquals(5, h.getId());
        Assertions.assertEquals("f(x)", h.getName());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Net (c0)",
            "Net x (c0)",
            "Net 0 c0",
            "Network 0 (c0)",
            "Node:\t1\tSOURCE (1,0)",
            "Net 99999999999 (huge)",
    })
    public void testNotANetHeader(String line) {
        Assertions.assertNull(NetBoundaryScanner.matchNetHeader(line, 1));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "# comment",
            "Placement_File: top.place Placement_ID: SHA256:abc",
            "Array size: 10 x 10 logic blocks.",
            "Routing:",
    })
    public void testIgnorable(String line) {
        Assertions.assertTrue(NetBoundaryScanner.isIgnorable(line));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Net 0 (c0)",
            "Node:\t1\tSOURCE (1,0)",
            "Block clk (#4) at (0,0), Pin class 0.",
    })
    public void testNotIgnorable(String line) {
        Assertions.assertFalse(NetBoundaryScanner.isIgnorable(line));
    }

    @Test
    public void testArraySize() {
        Assertions.assertArrayEquals(new int[] {12, 8},
                NetBoundaryScanner.parseArraySize("Array size: 12 x 8 logic blocks."));
        Assertions.assertNull(NetBoundaryScanner.parseArraySize("Routing:"));
    }

    @Test
    public void testPlacementFile() {
        Assertions.assertEquals("top.place",
                NetBoundaryScanner.parsePlacementFile("Placement_File: top.place Placement_ID: SHA256:abc"));
        Assertions.assertNull(NetBoundaryScanner.parsePlacementFile("Array size: 12 x 8 logic blocks."));
    }
}
