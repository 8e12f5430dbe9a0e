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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.dependencytrack.spdx.expression.model.Expression.and;
import static org.dependencytrack.spdx.expression.model.Expression.or;
import static org.dependencytrack.spdx.expression.model.Expression.parens;
import static org.dependencytrack.spdx.expression.model.Expression.simple;
import static org.dependencytrack.spdx.expression.model.Expression.with;

class ExpressionTest {

    @Test
    void shouldRenderWithExpression() {
        assertThat(with("license", "exception")).hasToString("license WITH exception");
    }

    @Test
    void shouldRenderWithExpressionOfLicenseRef() {
        final Expression expression = new Expression.With(new WithExpression(
                SimpleExpression.ofLicenseRef("doc", "license"), "exception"));
        assertThat(expression).hasToString("DocumentRef-doc:LicenseRef-license WITH exception");
    }

    @Test
    void shouldRenderAndChain() {
        final Expression expression = and(and(simple("license1"), simple("license2")), simple("license3"));
        assertThat(expression).hasToString("license1 AND license2 AND license3");
    }

    @Test
    void shouldRenderOrChain() {
        final Expression expression = or(or(simple("license1"), simple("license2")), simple("license3"));
        assertThat(expression).hasToString("license1 OR license2 OR license3");
    }

    @Test
    void shouldRenderMixedChain() {
        final Expression expression = or(
                and(simple("A"), with("B", "E")),
                and(simple("C"), parens(or(simple("D"), simple("F")))));
        assertThat(expression).hasToString("A AND B WITH E OR C AND (D OR F)");
    }

    @Test
    void shouldRenderRedundantParentheses() {
        assertThat(parens(parens(simple("MIT")))).hasToString("((MIT))");
    }

    @Test
    void shouldRenderLongOperatorChain() {
        Expression expression = simple("license0");
        for (int i = 1; i < 10_000; i++) {
            expression = and(expression, simple("license" + i));
        }

        final String expected = IntStream.range(0, 10_000)
                .mapToObj(i -> "license" + i)
                .collect(Collectors.joining(" AND "));
        assertThat(expression).hasToString(expected);
    }

    @Test
    void shouldRejectWithExceptionCarryingPlus() {
        assertThatExceptionOfType(IllegalArgumentException.class)
                .isThrownBy(() -> with("license", "exception+"))
                .withMessage("exception must be a plain identifier, but got: exception+");
    }

    @Test
    void shouldRejectWithExceptionCarryingLicenseRef() {
        assertThatExceptionOfType(IllegalArgumentException.class)
                .isThrownBy(() -> with("license", "LicenseRef-exception"));
    }

    @Test
    void visitorShouldVisitLeavesFromLeftToRight() {
        final Expression expression = or(
                and(simple("A"), with("B", "E")),
                parens(simple("C")));

        final var visited = new ArrayList<String>();
        new ExpressionVisitor() {

            @Override
            public void visitSimple(final Expression.Simple expr) {
                visited.add(expr.toString());
            }

            @Override
            public void visitWith(final Expression.With expr) {
                visited.add(expr.toString());
            }

        }.visit(expression);

        assertThat(visited).containsExactly("A", "B WITH E", "C");
    }

    @Test
    void visitorShouldAllowOverridingCompoundNodes() {
        final Expression expression = and(parens(or(simple("A"), simple("B"))), simple("C"));

        final var visited = new ArrayList<String>();
        new ExpressionVisitor() {

            @Override
            public void visitParens(final Expression.Parens expr) {
                visited.add(expr.toString());
            }

            @Override
            public void visitSimple(final Expression.Simple expr) {
                visited.add(expr.toString());
            }

        }.visit(expression);

        assertThat(visited).isEqualTo(List.of("(A OR B)", "C"));
    }

    @Test
    void longOperatorChainsShouldBeEqualAndHaveEqualHashCodes() {
        final Expression first = orChain(50_000);
        final Expression second = orChain(50_000);

        assertThat(first).isEqualTo(second);
        assertThat(first).hasSameHashCodeAs(second);
    }

    @Test
    void operatorChainsShouldDifferByOperandsAndOperators() {
        assertThat(and(simple("A"), simple("B"))).isNotEqualTo(or(simple("A"), simple("B")));
        assertThat(and(simple("A"), simple("B"))).isNotEqualTo(and(simple("A"), simple("C")));
        assertThat(and(parens(simple("A")), simple("B"))).isNotEqualTo(and(simple("A"), simple("B")));
        assertThat(or(orChain(100), simple("B"))).isNotEqualTo(or(orChain(100), simple("C")));
        assertThat(and(simple("A"), simple("B"))).isNotEqualTo(simple("A"));
    }

    @Test
    void visitorShouldVisitLongOperatorChain() {
        final var visited = new ArrayList<String>();
        new ExpressionVisitor() {

            @Override
            public void visitSimple(final Expression.Simple expr) {
                visited.add(expr.toString());
            }

        }.visit(orChain(50_000));

        assertThat(visited).hasSize(50_000);
        assertThat(visited).startsWith("license0", "license1");
        assertThat(visited).endsWith("license49999");
    }

    @Test
    void visitorShouldInvokeVisitAndOncePerChain() {
        final Expression expression = or(
                and(and(simple("A"), simple("B")), simple("C")),
                and(simple("D"), simple("E")));

        final var visited = new ArrayList<String>();
        new ExpressionVisitor() {

            @Override
            public void visitAnd(final Expression.And expr) {
                visited.add(expr.toString());
                ExpressionVisitor.super.visitAnd(expr);
            }

            @Override
            public void visitSimple(final Expression.Simple expr) {
                visited.add(expr.toString());
            }

        }.visit(expression);

        assertThat(visited).containsExactly("A AND B AND C", "A", "B", "C", "D AND E", "D", "E");
    }

    private static Expression orChain(final int operands) {
        Expression expression = simple("license0");
        for (int i = 1; i < operands; i++) {
            expression = or(expression, simple("license" + i));
        }

        return expression;
    }

}
