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

import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class SpdxExpressionParserConfigTest {

    @Test
    void shouldReturnDefaultMaxNestingDepthWhenNotConfigured() {
        final var config = new SpdxExpressionParserConfig(new SmallRyeConfigBuilder().build());

        assertThat(config.getMaxNestingDepth()).isEqualTo(256);
    }

    @Test
    void shouldReturnConfiguredMaxNestingDepth() {
        final var config = new SpdxExpressionParserConfig(configWithMaxNestingDepth("42"));

        assertThat(config.getMaxNestingDepth()).isEqualTo(42);
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "-1"})
    void shouldThrowWhenMaxNestingDepthIsNotPositive(final String value) {
        final var config = new SpdxExpressionParserConfig(configWithMaxNestingDepth(value));

        assertThatExceptionOfType(IllegalArgumentException.class)
                .isThrownBy(config::getMaxNestingDepth)
                .withMessage("dt.spdx-expression.max-nesting-depth must be positive, but is " + value);
    }

    @Test
    void parserShouldRejectInvalidMaxNestingDepth() {
        assertThatExceptionOfType(IllegalArgumentException.class)
                .isThrownBy(() -> new SpdxExpressionParser(configWithMaxNestingDepth("0")));
    }

    @Test
    void shouldThrowWhenConfigIsNull() {
        assertThatExceptionOfType(NullPointerException.class)
                .isThrownBy(() -> new SpdxExpressionParserConfig(null))
                .withMessage("config must not be null");
    }

    private static Config configWithMaxNestingDepth(final String value) {
        return new SmallRyeConfigBuilder()
                .withDefaultValues(Map.of("dt.spdx-expression.max-nesting-depth", value))
                .build();
    }

}
