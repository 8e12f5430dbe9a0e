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

import org.jspecify.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A single license identifier, e.g. {@code MIT}, {@code GPL-2.0+},
 * {@code LicenseRef-Custom} or {@code DocumentRef-spdx-doc:LicenseRef-Custom}.
 *
 * @param identifier  The identifier, without any {@code LicenseRef-} or {@code DocumentRef-} prefix.
 *                    May end in {@code +} ("or later") for SPDX license IDs.
 * @param documentRef ID of the external document the identifier refers to, if any.
 * @param licenseRef  Whether the identifier is a user-defined {@code LicenseRef-}.
 * @since 5.7.0
 */
public record SimpleExpression(String identifier, @Nullable String documentRef, boolean licenseRef) {

    public static final String DOCUMENT_REF_PREFIX = "DocumentRef-";
    public static final String LICENSE_REF_PREFIX = "LicenseRef-";

    public SimpleExpression {
        requireNonNull(identifier, "identifier must not be null");
        if (identifier.isEmpty()) {
            throw new IllegalArgumentException("identifier must not be empty");
        }
        if (documentRef != null && !licenseRef) {
            throw new IllegalArgumentException(
                    "documentRef is only allowed for LicenseRef identifiers, but got: %s".formatted(identifier));
        }

        final int plusIndex = identifier.indexOf('+');
        if (plusIndex >= 0 && (licenseRef || plusIndex == 0 || plusIndex != identifier.length() - 1)) {
            throw new IllegalArgumentException(
                    "+ is only allowed once at the end of SPDX license IDs, but got: %s".formatted(identifier));
        }
    }

    public static SimpleExpression ofLicenseId(final String identifier) {
        return new SimpleExpression(identifier, null, false);
    }

    public static SimpleExpression ofLicenseRef(final String identifier) {
        return new SimpleExpression(identifier, null, true);
    }

    public static SimpleExpression ofLicenseRef(final String documentRef, final String identifier) {
        return new SimpleExpression(identifier, requireNonNull(documentRef, "documentRef must not be null"), true);
    }

    /**
     * @return Whether the identifier carries the "or later" ({@code +}) marker.
     */
    public boolean orLater() {
        return identifier.endsWith("+");
    }

    @Override
    public String toString() {
        final var sb = new StringBuilder();
        if (documentRef != null) {
            sb.append(DOCUMENT_REF_PREFIX).append(documentRef).append(':');
        }
        if (licenseRef) {
            sb.append(LICENSE_REF_PREFIX);
        }

        return sb.append(identifier).toString();
    }

}
