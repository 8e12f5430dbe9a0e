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

import org.dependencytrack.spdx.expression.IdentifierRecognizer.Match;
import org.dependencytrack.spdx.expression.model.Expression;
import org.dependencytrack.spdx.expression.model.SimpleExpression;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Parser for SPDX license expressions.
 * <p>
 * Operator precedence, from strongest to weakest binding, is {@code WITH}, {@code AND}, {@code OR}.
 * {@code AND} and {@code OR} are left-associative. Parentheses override precedence,
 * and are retained in the resulting tree as {@link Expression.Parens}.
 * <pre>
 * expr      := term ( OR term )*
 * term      := factor ( AND factor )*
 * factor    := with_expr | simple | "(" expr ")"
 * with_expr := simple WS "WITH" WS idstring
 * simple    := [ "DocumentRef-" idstring ":" ] "LicenseRef-" idstring | idstring [ "+" ]
 * </pre>
 * Operator keywords are case-insensitive, identifiers are not.
 * <p>
 * Instances are immutable and safe for concurrent use.
 *
 * @see <a href="https://spdx.github.io/spdx-spec/v2.3/SPDX-license-expressions/">SPDX License Expressions</a>
 * @since 5.7.0
 */
public final class SpdxExpressionParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(SpdxExpressionParser.class);

    private final int maxNestingDepth;

    public SpdxExpressionParser() {
        this(ConfigProvider.getConfig());
    }

    public SpdxExpressionParser(final Config config) {
        this.maxNestingDepth = new SpdxExpressionParserConfig(config).getMaxNestingDepth();
    }

    /**
     * Parse an SPDX license expression.
     *
     * @param expression The expression to parse.
     * @return The parsed {@link Expression}.
     * @throws SpdxExpressionException When {@code expression} is not a valid SPDX license expression
     *                                 in its entirety.
     */
    public Expression parse(final String expression) {
        requireNonNull(expression, "expression must not be null");
        LOGGER.trace("Parsing expression {}", expression);

        final var grammar = new Grammar(expression, maxNestingDepth);
        final Match<Expression> result = grammar.expr(0, 0);
        if (result == null) {
            LOGGER.debug("Expression {} does not match the grammar", expression);
            throw new SpdxExpressionException(expression);
        }

        final int end = grammar.skipWhitespace(result.end());
        if (end != expression.length()) {
            LOGGER.debug("Expression {} has unexpected trailing input at offset {}", expression, end);
            throw new SpdxExpressionException(expression);
        }

        return result.value();
    }

    private enum Operator {

        AND,

        OR

    }

    private record Operation(Operator operator, Expression operand) {
    }

    /**
     * Recursive descent over a single input.
     * <p>
     * Every rule receives the offset to start matching at, and returns the matched
     * node along with the offset after it, or {@code null} if it did not match.
     */
    private static final class Grammar {

        private final String input;
        private final int maxNestingDepth;

        private Grammar(final String input, final int maxNestingDepth) {
            this.input = input;
            this.maxNestingDepth = maxNestingDepth;
        }

        private @Nullable Match<Expression> expr(final int offset, final int depth) {
            final Match<Expression> initial = term(offset, depth);
            if (initial == null) {
                return null;
            }

            final var operations = new ArrayList<Operation>();
            int end = initial.end();
            while (true) {
                final int operandOffset = keyword(end, Operator.OR.name(), true);
                if (operandOffset < 0) {
                    break;
                }

                final Match<Expression> operand = term(operandOffset, depth);
                if (operand == null) {
                    break;
                }

                operations.add(new Operation(Operator.OR, operand.value()));
                end = operand.end();
            }

            return new Match<>(fold(initial.value(), operations), end);
        }

        private @Nullable Match<Expression> term(final int offset, final int depth) {
            final Match<Expression> initial = factor(offset, depth);
            if (initial == null) {
                return null;
            }

            final var operations = new ArrayList<Operation>();
            int end = initial.end();
            while (true) {
                final int operandOffset = keyword(end, Operator.AND.name(), true);
                if (operandOffset < 0) {
                    break;
                }

                final Match<Expression> operand = factor(operandOffset, depth);
                if (operand == null) {
                    break;
                }

                operations.add(new Operation(Operator.AND, operand.value()));
                end = operand.end();
            }

            return new Match<>(fold(initial.value(), operations), end);
        }

        private @Nullable Match<Expression> factor(final int offset, final int depth) {
            final int start = skipWhitespace(offset);

            final Match<Expression> with = withExpression(start);
            if (with != null) {
                return with;
            }

            final Match<SimpleExpression> simple = IdentifierRecognizer.simpleLicenseExpression(input, start);
            if (simple != null) {
                return new Match<>(Expression.simple(simple.value()), simple.end());
            }

            return parens(start, depth);
        }

        private @Nullable Match<Expression> withExpression(final int offset) {
            final Match<SimpleExpression> license = IdentifierRecognizer.simpleLicenseExpression(input, offset);
            if (license == null) {
                return null;
            }

            final int withEnd = keyword(license.end(), "WITH", false);
            if (withEnd < 0) {
                return null;
            }

            final Match<String> exception = IdentifierRecognizer.exceptionIdstring(input, skipWhitespace(withEnd));
            if (exception == null) {
                return null;
            }

            return new Match<>(Expression.with(license.value(), exception.value()), exception.end());
        }

        private @Nullable Match<Expression> parens(final int offset, final int depth) {
            if (offset >= input.length() || input.charAt(offset) != '(') {
                return null;
            }
            if (depth >= maxNestingDepth) {
                LOGGER.debug("Maximum nesting depth of {} exceeded at offset {}", maxNestingDepth, offset);
                return null;
            }

            final Match<Expression> inner = expr(offset + 1, depth + 1);
            if (inner == null) {
                return null;
            }

            final int closingOffset = skipWhitespace(inner.end());
            if (closingOffset >= input.length() || input.charAt(closingOffset) != ')') {
                return null;
            }

            return new Match<>(Expression.parens(inner.value()), closingOffset + 1);
        }

        /**
         * Matches an operator keyword, which must be separated from its operands by whitespace.
         * When {@code allowParenthesis} is set, a parenthesis may take the place of that whitespace.
         *
         * @return Offset after the keyword, or {@code -1} if the keyword did not match.
         */
        private int keyword(final int offset, final String keyword, final boolean allowParenthesis) {
            final int start = skipWhitespace(offset);
            if (start == offset
                    && !(allowParenthesis && offset > 0 && input.charAt(offset - 1) == ')')) {
                return -1;
            }

            final int end = start + keyword.length();
            if (end >= input.length() || !matchesKeyword(start, keyword)) {
                return -1;
            }

            final char next = input.charAt(end);
            if (!isWhitespace(next) && !(allowParenthesis && next == '(')) {
                return -1;
            }

            return end;
        }

        private boolean matchesKeyword(final int offset, final String keyword) {
            for (int i = 0; i < keyword.length(); i++) {
                final char c = input.charAt(offset + i);
                final char upper = (c >= 'a' && c <= 'z') ? (char) (c - ('a' - 'A')) : c;
                if (upper != keyword.charAt(i)) {
                    return false;
                }
            }

            return true;
        }

        private int skipWhitespace(final int offset) {
            int end = offset;
            while (end < input.length() && isWhitespace(input.charAt(end))) {
                end++;
            }

            return end;
        }

        private static boolean isWhitespace(final char c) {
            return c == ' ' || c == '\t' || c == '\r' || c == '\n';
        }

    }

    /**
     * Folds {@code operations} onto {@code initial} from left to right,
     * such that {@code A AND B AND C} becomes {@code And(And(A, B), C)}.
     */
    private static Expression fold(final Expression initial, final List<Operation> operations) {
        Expression result = initial;
        for (final Operation operation : operations) {
            result = switch (operation.operator()) {
                case AND -> Expression.and(result, operation.operand());
                case OR -> Expression.or(result, operation.operand());
            };
        }

        return result;
    }

}
