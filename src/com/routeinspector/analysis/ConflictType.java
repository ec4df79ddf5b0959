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

/**
 * Reason two nets are connected in a {@link ConflictGraph}.
 */
public enum ConflictType {
    /** The bounding boxes of the two nets intersect */
    BBOX_OVERLAP,
    /** Both nets use a routing resource at the same location and of the same kind */
    SHARED_SEGMENT;
}
