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

/**
 * Thrown when an SPDX license expression could not be parsed.
 * <p>
 * The exception intentionally does not expose where in the expression parsing failed.
 *
 * @since 5.7.0
 */
public class SpdxExpressionException extends RuntimeException {

    private final String expression;

    SpdxExpressionException(final String expression) {
        super("Parsing for expression `%s` failed.".formatted(expression));
        this.expression = expression;
    }

    /**
     * @return The complete expression that failed to parse.
     */
    public String getExpression() {
        return expression;
    }

}
