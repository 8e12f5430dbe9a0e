/*
 * This file is part of Dependency-Track.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (c) OWASP Foundation. All Rights Reserved.
 */
package org.dependencytrack.spdx.expression;

import org.eclipse.microprofile.config.Config;

import static java.util.Objects.requireNonNull;

/**
 * @since 5.7.0
 */
final class SpdxExpressionParserConfig {

    static final String PREFIX = "dt.spdx-expression.";
    static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    private final Config config;

    SpdxExpressionParserConfig(final Config config) {
        this.config = requireNonNull(config, "config must not be null");
    }

    /**
     * @return Maximum number of nested parentheses an expression may contain.
     * @throws IllegalArgumentException When the configured value is not positive.
     */
    int getMaxNestingDepth() {
        final int maxNestingDepth = config
                .getOptionalValue(PREFIX + "max-nesting-depth", int.class)
                .orElse(DEFAULT_MAX_NESTING_DEPTH);
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException(
                    "%smax-nesting-depth must be positive, but is %d".formatted(PREFIX, maxNestingDepth));
        }

        return maxNestingDepth;
    }

}
