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

import org.dependencytrack.spdx.expression.model.Expression;
import org.dependencytrack.spdx.expression.model.SimpleExpression;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A parsed SPDX license expression.
 * <p>
 * {@link #toString()} yields the canonical form of the expression,
 * with upper-case operators and the grouping of the input.
 *
 * @param expression Root of the expression tree.
 * @since 5.7.0
 */
public record SpdxExpression(Expression expression) {

    public SpdxExpression {
        requireNonNull(expression, "expression must not be null");
    }

    /**
     * Parse an SPDX license expression, using a parser configured from
     * the global {@link org.eclipse.microprofile.config.Config}.
     *
     * @param expressionString The expression to parse.
     * @return The parsed {@link SpdxExpression}.
     * @throws SpdxExpressionException When {@code expressionString} is not a valid expression.
     * @see SpdxExpressionParser#parse(String)
     */
    public static SpdxExpression parse(final String expressionString) {
        return new SpdxExpression(DefaultParserHolder.INSTANCE.parse(expressionString));
    }

    /**
     * Shorthand for {@code SpdxExpression.parse(expressionString).licenses()}.
     *
     * @see #licenses()
     */
    public static List<String> licenses(final String expressionString) {
        return parse(expressionString).licenses();
    }

    /**
     * Get all licenses and exceptions referenced by this expression.
     * <p>
     * Licenses are represented in their canonical form, i.e. including any
     * {@code DocumentRef-} and {@code LicenseRef-} prefixes, and the {@code +} suffix.
     *
     * @return Distinct licenses and exceptions, sorted lexicographically.
     */
    public List<String> licenses() {
        return LicenseCollector.collect(expression).getIdentifiers();
    }

    /**
     * @return Distinct exceptions referenced via {@code WITH}, sorted lexicographically.
     */
    public List<String> exceptions() {
        return LicenseCollector.collect(expression).getExceptions();
    }

    /**
     * @return Distinct licenses, excluding exceptions, sorted by their canonical form.
     */
    public List<SimpleExpression> simpleExpressions() {
        return LicenseCollector.collect(expression).getLicenses();
    }

    @Override
    public String toString() {
        return expression.toString();
    }

    private static final class DefaultParserHolder {

        private static final SpdxExpressionParser INSTANCE = new SpdxExpressionParser();

    }

}
