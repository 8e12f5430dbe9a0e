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
import org.dependencytrack.spdx.expression.model.ExpressionVisitor;
import org.dependencytrack.spdx.expression.model.SimpleExpression;

import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Collects the distinct licenses and exceptions referenced by an {@link Expression},
 * ordered by their canonical text.
 *
 * @since 5.7.0
 */
final class LicenseCollector implements ExpressionVisitor {

    private final Map<String, SimpleExpression> licenseByText = new TreeMap<>();
    private final SortedSet<String> exceptions = new TreeSet<>();

    static LicenseCollector collect(final Expression expression) {
        final var collector = new LicenseCollector();
        collector.visit(expression);
        return collector;
    }

    @Override
    public void visitSimple(final Expression.Simple expr) {
        addLicense(expr.expression());
    }

    @Override
    public void visitWith(final Expression.With expr) {
        addLicense(expr.expression().license());
        exceptions.add(expr.expression().exception());
    }

    private void addLicense(final SimpleExpression license) {
        licenseByText.putIfAbsent(license.toString(), license);
    }

    List<SimpleExpression> getLicenses() {
        return List.copyOf(licenseByText.values());
    }

    List<String> getExceptions() {
        return List.copyOf(exceptions);
    }

    /**
     * @return Licenses and exceptions combined.
     */
    List<String> getIdentifiers() {
        final var identifiers = new TreeSet<>(licenseByText.keySet());
        identifiers.addAll(exceptions);
        return List.copyOf(identifiers);
    }

}
