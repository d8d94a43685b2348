/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.sigtable.utils;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link Preconditions}. */
class PreconditionsTest {

    @Test
    void testCheckNotNull() {
        assertThat(Preconditions.checkNotNull("a")).isEqualTo("a");
        assertThatThrownBy(() -> Preconditions.checkNotNull(null, "source must not be null"))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("source must not be null");
    }

    @Test
    void testCheckArgumentTemplate() {
        assertThatThrownBy(
                        () -> Preconditions.checkArgument(false, "row %s of %s", 3, 2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("row 3 of 2");
        assertThatThrownBy(() -> Preconditions.checkState(false, "closed"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("closed");
    }

    @Test
    void testCheckFromIndexSize() {
        assertThatCode(() -> Preconditions.checkFromIndexSize(0, 0, 0)).doesNotThrowAnyException();
        assertThatCode(() -> Preconditions.checkFromIndexSize(2, 3, 5)).doesNotThrowAnyException();

        assertThatThrownBy(() -> Preconditions.checkFromIndexSize(3, 3, 5))
                .isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> Preconditions.checkFromIndexSize(-1, 1, 5))
                .isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> Preconditions.checkFromIndexSize(1, Integer.MAX_VALUE, 5))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }
}
