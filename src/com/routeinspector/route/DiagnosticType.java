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
 * Recoverable conditions found while reading a route file. None of these abort a parse.
 */
public enum DiagnosticType {
    /** A node line could not be parsed and was skipped */
    MALFORMED_LINE,
    /** A net has no SOURCE record, so no tree was built */
    MISSING_ROOT,
    /** A node line appeared before the first net delimiter */
    ORPHAN_RECORD,
    /** A record listed before the net's SOURCE was left out of the tree */
    DETACHED_RECORD,
    /** A sub-path following a SINK had no nearby routing node and was attached to the root */
    ROOT_FALLBACK;
}
