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

/**
 * Common class for generating console messages.
 */
public class MessageGenerator {

    private static final int HEADER_WIDTH = 72;

    /**
     * Used as a general way to create an error message and send it to
     * std.err.
     * @param msg The message to print to standard error
     */
    public static void briefError(String msg) {
        System.err.println(msg);
    }

    /**
     * Used as a general way to create a message and send it to
     * std.out.
     * @param msg The message to print to standard out
     */
    public static void briefMessage(String msg) {
        System.out.println(msg);
    }

    /**
     * Prints a generic header to standard out to separate operations.
     * @param s Title placed in the middle of the header.
     */
    public static void printHeader(String s) {
        System.out.println(createHeader(s));
    }

    /**
     * Builds the three line banner printed by {@link #printHeader(String)}.
     * @param s Title placed in the middle of the header.
     * @return The banner, without a trailing newline.
     */
    public static String createHeader(String s) {
        String bar = "==============================================================================";
        double whiteSpace = (HEADER_WIDTH - s.length()) / 2.0;
        String left = makeWhiteSpace((int) whiteSpace);
        String right = makeWhiteSpace((int) (whiteSpace + 0.5));
        return bar + "\n" + "== " + left + s + right + " ==" + "\n" + bar;
    }

    public static String formatString(String s) {
        return String.format("%-36s\n", s);
    }

    public static String formatString(String s, int value) {
        return String.format("%-36s %10d\n", s, value);
    }

    public static String formatString(String s, long value) {
        return String.format("%-36s %10d\n", s, value);
    }

    public static String formatString(String s, double value) {
        return String.format("%-36s %10.3f\n", s, value);
    }

    public static String formatString(String s, boolean value) {
        return String.format("%-36s %10s\n", s, value);
    }

    public static String formatString(String s, String value) {
        return String.format("%-36s %10s\n", s, value);
    }

    /**
     * Creates a whitespace string with length number of spaces.
     * @param length Number of spaces in the string.
     * @return The newly created whitespace string.
     */
    public static String makeWhiteSpace(int length) {
        if (length < 1)
            return "";
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(" ");
        }
        return sb.toString();
    }
}
