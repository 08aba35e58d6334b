/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.hugegraph.dgraph.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Collections;

import org.junit.Test;

public class DgAssertTest {

    @Test
    public void testIsTrue() {
        DgAssert.isTrue(true, "unused");
        assertThatThrownBy(() -> DgAssert.isTrue(false, "broken"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("broken");
        assertThatThrownBy(() -> DgAssert.isTrue(false, () -> "lazy"))
                .hasMessage("lazy");
        assertThatThrownBy(() -> DgAssert.isFalse(true, "inverted"))
                .hasMessage("inverted");
    }

    @Test
    public void testArguments() {
        DgAssert.isArgumentValid("value", "name");
        assertThatThrownBy(() -> DgAssert.isArgumentValid("  ", "name"))
                .hasMessage("The argument is invalid: name");
        assertThatThrownBy(() -> DgAssert.isArgumentValid(Collections.emptyList(), "stubs"))
                .hasMessage("The argument is invalid: stubs");
        assertThatThrownBy(() -> DgAssert.isArgumentNotNull(null, "config"))
                .hasMessage("The argument is null: config");
    }

    @Test
    public void testIsInvalid() {
        assertThat(DgAssert.isInvalid()).isTrue();
        assertThat(DgAssert.isInvalid("a", null)).isTrue();
        assertThat(DgAssert.isInvalid("a", "b")).isFalse();
    }
}
