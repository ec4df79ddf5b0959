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

/**
 * Thrown when an input contains neither net delimiters nor any parsable node line,
 * which means it is not a route file.
 */
public class UnrecognizedRouteFormatException extends RuntimeException {

    private static final long serialVersionUID = 5843305571716931072L;

    public UnrecognizedRouteFormatException(String message) {
        super(message);
    }
}
