/*
 * package-info.java
 *
 * This source file is part of the docfeed open source project
 *
 * Copyright 2026 the docfeed project authors
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
 */

/**
 * Source stages that read every target range: in backend order, or merged by {@code ORDER BY}.
 *
 * <p>
 * The streaming order-by stage resumes each range at the first row after the last one returned. Its continuation
 * records, per range, the backend state at the start of the page, the order-by values and id of the last row, and
 * how many rows with those values were already returned.
 * </p>
 */
package io.docfeed.query.pipeline.crosspartition;
