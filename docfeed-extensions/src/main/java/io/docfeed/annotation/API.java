/*
 * API.java
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

package io.docfeed.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks the stability level of a public type, field or method for consumers of the docfeed libraries.
 *
 * <p>
 * Members of an annotated type share the type's status unless annotated themselves. A status may become more
 * stable at any time. It may only become less stable as its own {@link Status} constant allows.
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * The stability of the annotated element.
     * @return the stability status
     */
    Status value();

    /**
     * Stability levels, from least to most stable.
     */
    enum Status {
        /**
         * Public only so that other docfeed packages can reach it. May change in any release.
         */
        INTERNAL,

        /**
         * Scheduled for removal. Removed no earlier than the next minor release.
         */
        DEPRECATED,

        /**
         * Under active development. May change or disappear without a version change.
         */
        EXPERIMENTAL,

        /**
         * May change in the next minor release, but not before it.
         */
        UNSTABLE,

        /**
         * Kept for callers that depend on it. Not extended with new behavior, but changed only in a minor release.
         */
        MAINTAINED,

        /**
         * Changed incompatibly only in a major release.
         */
        STABLE
    }
}
