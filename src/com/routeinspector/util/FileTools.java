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

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.GZIPInputStream;

/**
 * A collection of file reading and writing helpers shared by the parsers and tools.
 */
public class FileTools {

    /**
     * Creates a BufferedReader that reads an input file and determines based on file
     * extension (*.gz) if the file is gzipped or not.
     * @param fileName Path of the text or gzipped file
     * @return An opened BufferedReader to the file. The caller is responsible for closing it.
     */
    public static BufferedReader getProperInputStream(Path fileName) {
        InputStream in = null;
        try {
            in = Files.newInputStream(fileName);
            if (fileName.toString().endsWith(".gz")) {
                in = new GZIPInputStream(in);
            }
            return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            throw new UncheckedIOException("ERROR: Could not find file: " + fileName, e);
        } catch (IOException e) {
            if (in != null) {
                try {
                    in.close();
                } catch (IOException suppressed) {
                    e.addSuppressed(suppressed);
                }
            }
            throw new UncheckedIOException("ERROR: Problem reading file: " + fileName, e);
        }
    }

    /**
     * Writes each string in the list as a line of the given file, replacing any
     * existing content.
     * @param lines The lines to write.
     * @param fileName Destination file.
     */
    public static void writeLinesToTextFile(List<String> lines, Path fileName) {
        try (BufferedWriter bw = Files.newBufferedWriter(fileName, StandardCharsets.UTF_8)) {
            for (String line : lines) {
                bw.write(line);
                bw.newLine();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Could not write to file: " + fileName, e);
        }
    }

    /**
     * Writes a single string to a file, replacing any existing content.
     * @param contents Text to write.
     * @param fileName Destination file.
     */
    public static void writeStringToTextFile(String contents, Path fileName) {
        try (BufferedWriter bw = Files.newBufferedWriter(fileName, StandardCharsets.UTF_8)) {
            bw.write(contents);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Could not write to file: " + fileName, e);
        }
    }
}
