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
package org.dependencytrack.spdx.expression.model;

import java.util.ArrayDeque;
import java.util.Deque;

import static java.util.Objects.requireNonNull;

/**
 * Node of a parsed SPDX license expression.
 * <p>
 * {@link And} and {@link Or} are binary. Chains of the same operator are nested
 * to the left, i.e. {@code A AND B AND C} is {@code And(And(A, B), C)}.
 * <p>
 * {@link #toString()} renders the canonical form of the expression. The static factory
 * methods build expressions programmatically, applying the same invariants as the parser.
 *
 * @since 5.7.0
 */
public sealed interface Expression {

    record Simple(SimpleExpression expression) implements Expression {

        public Simple {
            requireNonNull(expression, "expression must not be null");
        }

        @Override
        public String toString() {
            return expression.toString();
        }

    }

    record With(WithExpression expression) implements Expression {

        public With {
            requireNonNull(expression, "expression must not be null");
        }

        @Override
        public String toString() {
            return expression.toString();
        }

    }

    record And(Expression left, Expression right) implements Expression {

        public And {
            requireNonNull(left, "left must not be null");
            requireNonNull(right, "right must not be null");
        }

        @Override
        public boolean equals(final Object o) {
            return o instanceof final And other && structurallyEqual(this, other);
        }

        @Override
        public int hashCode() {
            return operatorChainHashCode(this);
        }

        @Override
        public String toString() {
            return renderOperatorChain(this);
        }

    }

    record Or(Expression left, Expression right) implements Expression {

        public Or {
            requireNonNull(left, "left must not be null");
            requireNonNull(right, "right must not be null");
        }

        @Override
        public boolean equals(final Object o) {
            return o instanceof final Or other && structurallyEqual(this, other);
        }

        @Override
        public int hashCode() {
            return operatorChainHashCode(this);
        }

        @Override
        public String toString() {
            return renderOperatorChain(this);
        }

    }

    /**
     * Explicit grouping as written in the parsed input.
     * <p>
     * Has no effect on the meaning of the expression, but is retained so that
     * rendering reproduces the input grouping, including redundant parentheses.
     */
    record Parens(Expression expression) implements Expression {

        public Parens {
            requireNonNull(expression, "expression must not be null");
        }

        @Override
        public String toString() {
            return "(" + expression + ")";
        }

    }

    /**
     * @param identifier An SPDX license ID, optionally suffixed with {@code +}.
     * @return A {@link Simple} expression for {@code identifier}.
     * @throws IllegalArgumentException When {@code identifier} is not a valid license ID.
     */
    static Expression simple(final String identifier) {
        return simple(SimpleExpression.ofLicenseId(identifier));
    }

    static Expression simple(final SimpleExpression license) {
        return new Simple(license);
    }

    /**
     * @param identifier An SPDX license ID, optionally suffixed with {@code +}.
     * @param exception  An SPDX license exception ID.
     * @return A {@link With} expression applying {@code exception} to {@code identifier}.
     * @throws IllegalArgumentException When {@code identifier} or {@code exception} are invalid.
     */
    static Expression with(final String identifier, final String exception) {
        return with(SimpleExpression.ofLicenseId(identifier), exception);
    }

    static Expression with(final SimpleExpression license, final String exception) {
        return new With(new WithExpression(license, exception));
    }

    static Expression and(final Expression left, final Expression right) {
        return new And(left, right);
    }

    static Expression or(final Expression left, final Expression right) {
        return new Or(left, right);
    }

    static Expression parens(final Expression expression) {
        return new Parens(expression);
    }

    /**
     * Renders a chain of {@link And} and {@link Or} nodes by walking down its left spine,
     * so that long operator chains do not recurse once per operand.
     */
    private static String renderOperatorChain(final Expression expr) {
        final Deque<Expression> rightOperands = new ArrayDeque<>();
        final Deque<String> operators = new ArrayDeque<>();

        Expression current = expr;
        while (true) {
            if (current instanceof final And and) {
                operators.push(" AND ");
                rightOperands.push(and.right());
                current = and.left();
            } else if (current instanceof final Or or) {
                operators.push(" OR ");
                rightOperands.push(or.right());
                current = or.left();
            } else {
                break;
            }
        }

        final var sb = new StringBuilder(current.toString());
        while (!operators.isEmpty()) {
            sb.append(operators.pop()).append(rightOperands.pop());
        }

        return sb.toString();
    }

    /**
     * Compares two trees node by node, using an explicit stack instead of recursion.
     */
    private static boolean structurallyEqual(final Expression first, final Expression second) {
        final Deque<Expression> firstNodes = new ArrayDeque<>();
        final Deque<Expression> secondNodes = new ArrayDeque<>();
        firstNodes.push(first);
        secondNodes.push(second);

        while (!firstNodes.isEmpty()) {
            final Expression a = firstNodes.pop();
            final Expression b = secondNodes.pop();
            if (a == b) {
                continue;
            }

            if (a instanceof final And andA && b instanceof final And andB) {
                firstNodes.push(andA.right());
                secondNodes.push(andB.right());
                firstNodes.push(andA.left());
                secondNodes.push(andB.left());
            } else if (a instanceof final Or orA && b instanceof final Or orB) {
                firstNodes.push(orA.right());
                secondNodes.push(orB.right());
                firstNodes.push(orA.left());
                secondNodes.push(orB.left());
            } else if (a instanceof final Parens parensA && b instanceof final Parens parensB) {
                firstNodes.push(parensA.expression());
                secondNodes.push(parensB.expression());
            } else if (a instanceof And || a instanceof Or || a instanceof Parens) {
                return false;
            } else if (!a.equals(b)) {
                return false;
            }
        }

        return true;
    }

    /**
     * Hashes a chain of {@link And} and {@link Or} nodes along its left spine.
     */
    private static int operatorChainHashCode(final Expression expr) {
        final Deque<Expression> rightOperands = new ArrayDeque<>();
        final Deque<Integer> operators = new ArrayDeque<>();

        Expression current = expr;
        while (true) {
            if (current instanceof final And and) {
                operators.push(1);
                rightOperands.push(and.right());
                current = and.left();
            } else if (current instanceof final Or or) {
                operators.push(2);
                rightOperands.push(or.right());
                current = or.left();
            } else {
                break;
            }
        }

        int hash = current.hashCode();
        while (!operators.isEmpty()) {
            hash = 31 * (31 * hash + operators.pop()) + rightOperands.pop().hashCode();
        }

        return hash;
    }

}
