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

package org.sigtable.table;

import org.sigtable.exceptions.OutOfRangeException;
import org.sigtable.exceptions.SizeMismatchException;
import org.sigtable.table.schema.SignalType;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.sigtable.table.SignalTableTestUtils.DEFAULT_CODEC;
import static org.sigtable.table.SignalTableTestUtils.expectedSamples;
import static org.sigtable.table.SignalTableTestUtils.sampleCount;
import static org.sigtable.table.SignalTableTestUtils.samples;

/** Tests for {@link SignalExtractor}. */
class SignalExtractorTest {

    private static SignalExtractor extractor(SignalType signalType, int... batchSizes) {
        return new SignalExtractor(
                new SignalTableIndex(
                        SignalTableTestUtils.tableBatches(signalType, batchSizes), true));
    }

    @ParameterizedTest
    @EnumSource(SignalType.class)
    void testSamplesAreWrittenInRequestOrder(SignalType signalType) {
        SignalExtractor extractor = extractor(signalType, 1000, 1000, 237);
        long[] rows = {2236, 999};

        long count = extractor.extractSampleCount(rows);
        assertThat(count).isEqualTo(sampleCount(2236) + sampleCount(999));

        short[] out = new short[(int) count];
        extractor.extractSamples(rows, out);

        short[] first = samples(2236);
        assertThat(Arrays.copyOfRange(out, 0, first.length)).containsExactly(first);
        assertThat(Arrays.copyOfRange(out, first.length, out.length))
                .containsExactly(samples(999));
    }

    @Test
    void testRepeatedAndUnsortedRows() {
        SignalExtractor extractor = extractor(SignalType.VBZ_SIGNAL, 100, 100, 37);
        long[] rows = {236, 5, 236, 120, 22, 0};

        assertThat(extractor.extractSamples(rows)).containsExactly(expectedSamples(rows));
    }

    @Test
    void testSampleCountMatchesExtractedLength() {
        SignalExtractor extractor = extractor(SignalType.UNCOMPRESSED_SIGNAL, 64, 64, 10);
        for (long row = 0; row < 138; row++) {
            long[] rows = {row};
            short[] out = new short[(int) extractor.extractSampleCount(rows)];
            extractor.extractSamples(rows, out);
            assertThat(out).containsExactly(samples(row));
        }
    }

    @Test
    void testSizeMismatchLeavesCanaryUntouched() {
        SignalExtractor extractor = extractor(SignalType.VBZ_SIGNAL, 1000, 1000, 237);
        long[] rows = {2236, 999};
        long count = extractor.extractSampleCount(rows);

        short[] tooLarge = new short[(int) count + 1];
        Arrays.fill(tooLarge, (short) 0x7A7A);
        assertThatThrownBy(() -> extractor.extractSamples(rows, tooLarge))
                .isInstanceOf(SizeMismatchException.class);
        assertThat(tooLarge).containsOnly((short) 0x7A7A);

        short[] tooSmall = new short[(int) count - 1];
        Arrays.fill(tooSmall, (short) 0x7A7A);
        assertThatThrownBy(() -> extractor.extractSamples(rows, tooSmall))
                .isInstanceOf(SizeMismatchException.class);
        assertThat(tooSmall).containsOnly((short) 0x7A7A);
    }

    @Test
    void testOutOfRangeRowWritesNothing() {
        SignalExtractor extractor = extractor(SignalType.VBZ_SIGNAL, 10, 10);
        long[] rows = {3, 20};
        short[] out = new short[sampleCount(3)];
        Arrays.fill(out, (short) 1);

        assertThatThrownBy(() -> extractor.extractSamples(rows, out))
                .isInstanceOf(OutOfRangeException.class);
        assertThat(out).containsOnly((short) 1);
        assertThatThrownBy(() -> extractor.extractSampleCount(rows))
                .isInstanceOf(OutOfRangeException.class);
    }

    @Test
    void testExtractIntoSlice() {
        SignalExtractor extractor = extractor(SignalType.UNCOMPRESSED_SIGNAL, 50);
        long[] rows = {44, 21};
        short[] expected = expectedSamples(rows);
        short[] out = new short[expected.length + 6];

        extractor.extractSamples(rows, out, 3, expected.length);

        assertThat(Arrays.copyOfRange(out, 3, 3 + expected.length)).containsExactly(expected);
        assertThat(Arrays.copyOfRange(out, 0, 3)).containsOnly((short) 0);
    }

    @Test
    void testEmptyRequest() {
        SignalExtractor extractor = extractor(SignalType.VBZ_SIGNAL, 10);
        assertThat(extractor.extractSampleCount(new long[0])).isZero();
        assertThat(extractor.extractSamples(new long[0])).isEmpty();
        assertThat(extractor.signalRowInfo(new long[0])).isEmpty();
    }

    @Test
    void testSignalRowInfo() {
        SignalExtractor extractor = extractor(SignalType.VBZ_SIGNAL, 100, 100, 37);
        List<SignalRowInfo> infos = extractor.signalRowInfo(new long[] {236, 5});

        assertThat(infos).hasSize(2);
        assertThat(infos.get(0).batchIndex()).isEqualTo(2);
        assertThat(infos.get(0).batchRow()).isEqualTo(36);
        assertThat(infos.get(0).sampleCount()).isEqualTo(sampleCount(236));
        assertThat(infos.get(0).storedByteCount())
                .isEqualTo(DEFAULT_CODEC.compress(samples(236)).length);
        assertThat(infos.get(1))
                .isEqualTo(
                        new SignalRowInfo(
                                0, 5, 5, DEFAULT_CODEC.compress(samples(5)).length));
    }
}
