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

import org.dependencytrack.spdx.expression.model.SimpleExpression;
import org.jspecify.annotations.Nullable;

import static org.dependencytrack.spdx.expression.model.SimpleExpression.DOCUMENT_REF_PREFIX;
import static org.dependencytrack.spdx.expression.model.SimpleExpression.LICENSE_REF_PREFIX;

/**
 * Recognizers for the identifier syntax of SPDX license expressions.
 * <p>
 * Each recognizer attempts to match at a given offset of the input.
 * On success, it returns the recognized value along with the offset
 * directly after the match. On mismatch, it returns {@code null}
 * (or {@code -1} for plain offsets), and the caller continues
 * from the offset it started at.
 *
 * @since 5.7.0
 */
final class IdentifierRecognizer {

    record Match<T>(T value, int end) {
    }

    record LicenseRef(@Nullable String documentRef, String licenseId) {
    }

    private IdentifierRecognizer() {
    }

    static boolean isIdChar(final char c) {
        return (c >= 'a' && c <= 'z')
                || (c >= 'A' && c <= 'Z')
                || (c >= '0' && c <= '9')
                || c == '-'
                || c == '.';
    }

    /**
     * Recognizes one or more of {@code [A-Za-z0-9-.]}.
     *
     * @return Offset after the identifier, or {@code -1} if no identifier character is present.
     */
    static int idstring(final String input, final int offset) {
        int end = offset;
        while (end < input.length() && isIdChar(input.charAt(end))) {
            end++;
        }

        return end > offset ? end : -1;
    }

    /**
     * Recognizes an {@link #idstring(String, int)}, optionally followed by a {@code +}.
     * The {@code +} is part of the returned identifier.
     */
    static @Nullable Match<String> licenseIdstring(final String input, final int offset) {
        int end = idstring(input, offset);
        if (end < 0) {
            return null;
        }
        if (end < input.length() && input.charAt(end) == '+') {
            end++;
        }

        return new Match<>(input.substring(offset, end), end);
    }

    /**
     * Recognizes {@code DocumentRef-<id>:}.
     *
     * @return The {@code <id>} part.
     */
    static @Nullable Match<String> documentRef(final String input, final int offset) {
        if (!input.startsWith(DOCUMENT_REF_PREFIX, offset)) {
            return null;
        }

        final int idStart = offset + DOCUMENT_REF_PREFIX.length();
        final int idEnd = idstring(input, idStart);
        if (idEnd < 0 || idEnd >= input.length() || input.charAt(idEnd) != ':') {
            return null;
        }

        return new Match<>(input.substring(idStart, idEnd), idEnd + 1);
    }

    /**
     * Recognizes {@code [DocumentRef-<doc>:]LicenseRef-<id>}.
     */
    static @Nullable Match<LicenseRef> licenseRef(final String input, final int offset) {
        final Match<String> documentRef = documentRef(input, offset);
        final int prefixStart = documentRef != null ? documentRef.end() : offset;
        if (!input.startsWith(LICENSE_REF_PREFIX, prefixStart)) {
            return null;
        }

        final int idStart = prefixStart + LICENSE_REF_PREFIX.length();
        final int idEnd = idstring(input, idStart);
        if (idEnd < 0) {
            return null;
        }

        final var licenseRef = new LicenseRef(
                documentRef != null ? documentRef.value() : null,
                input.substring(idStart, idEnd));
        return new Match<>(licenseRef, idEnd);
    }

    /**
     * Recognizes a single license, either as {@code LicenseRef-} (with optional {@code DocumentRef-}),
     * or as plain license ID with optional {@code +}.
     * <p>
     * {@code LicenseRef-} must be tried first, since both prefixes consist of valid
     * identifier characters and would otherwise be consumed as part of a plain license ID.
     */
    static @Nullable Match<SimpleExpression> simpleLicenseExpression(final String input, final int offset) {
        final Match<LicenseRef> licenseRef = licenseRef(input, offset);
        if (licenseRef != null) {
            final var expression = new SimpleExpression(
                    licenseRef.value().licenseId(), licenseRef.value().documentRef(), true);
            return new Match<>(expression, licenseRef.end());
        }

        final Match<String> licenseId = licenseIdstring(input, offset);
        if (licenseId != null) {
            return new Match<>(SimpleExpression.ofLicenseId(licenseId.value()), licenseId.end());
        }

        return null;
    }

    /**
     * Recognizes the exception operand of {@code WITH}: a plain {@link #idstring(String, int)}
     * that is neither a {@code LicenseRef-} nor a {@code DocumentRef-}.
     */
    static @Nullable Match<String> exceptionIdstring(final String input, final int offset) {
        final int end = idstring(input, offset);
        if (end < 0
                || input.startsWith(LICENSE_REF_PREFIX, offset)
                || input.startsWith(DOCUMENT_REF_PREFIX, offset)) {
            return null;
        }

        return new Match<>(input.substring(offset, end), end);
    }

}
