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

/**
 * Depth-first visitor over an {@link Expression} tree.
 * <p>
 * The default implementations descend into child nodes,
 * left operands before right operands.
 * <p>
 * Chains of the same operator, such as {@code A AND B AND C}, are traversed iteratively.
 * {@link #visitAnd(Expression.And)} and {@link #visitOr(Expression.Or)} are invoked once
 * for the outermost node of such a chain, and not for the nodes nested in its left operand.
 *
 * @since 5.7.0
 */
public interface ExpressionVisitor {

    default void visit(final Expression expr) {
        if (expr instanceof final Expression.Simple simple) {
            visitSimple(simple);
        } else if (expr instanceof final Expression.With with) {
            visitWith(with);
        } else if (expr instanceof final Expression.And and) {
            visitAnd(and);
        } else if (expr instanceof final Expression.Or or) {
            visitOr(or);
        } else if (expr instanceof final Expression.Parens parens) {
            visitParens(parens);
        } else {
            throw new IllegalArgumentException("Unexpected expression type: " + expr.getClass().getName());
        }
    }

    default void visitSimple(final Expression.Simple expr) {
    }

    default void visitWith(final Expression.With expr) {
    }

    default void visitAnd(final Expression.And expr) {
        visitOperands(expr);
    }

    default void visitOr(final Expression.Or expr) {
        visitOperands(expr);
    }

    default void visitParens(final Expression.Parens expr) {
        visit(expr.expression());
    }

    private void visitOperands(final Expression chain) {
        final Deque<Expression> rightOperands = new ArrayDeque<>();

        Expression current = chain;
        while (true) {
            if (chain instanceof Expression.And && current instanceof final Expression.And and) {
                rightOperands.push(and.right());
                current = and.left();
            } else if (chain instanceof Expression.Or && current instanceof final Expression.Or or) {
                rightOperands.push(or.right());
                current = or.left();
            } else {
                break;
            }
        }

        visit(current);
        while (!rightOperands.isEmpty()) {
            visit(rightOperands.pop());
        }
    }

}
