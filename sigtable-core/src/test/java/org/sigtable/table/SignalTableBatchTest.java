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

import org.sigtable.codec.SignalCodec;
import org.sigtable.codec.VbzSignalCodec;
import org.sigtable.compression.BlockCompressionType;
import org.sigtable.data.columnar.VectorizedColumnBatch;
import org.sigtable.data.columnar.heap.HeapArrayVector;
import org.sigtable.data.columnar.heap.HeapBytesVector;
import org.sigtable.data.columnar.heap.HeapIntVector;
import org.sigtable.data.columnar.heap.HeapShortVector;
import org.sigtable.data.columnar.heap.HeapUuidVector;
import org.sigtable.exceptions.OutOfRangeException;
import org.sigtable.exceptions.SignalCodecException;
import org.sigtable.exceptions.SignalTableOpenException;
import org.sigtable.exceptions.SizeMismatchException;
import org.sigtable.table.schema.SignalType;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.sigtable.table.SignalTableTestUtils.DEFAULT_CODEC;
import static org.sigtable.table.SignalTableTestUtils.batchOf;
import static org.sigtable.table.SignalTableTestUtils.description;
import static org.sigtable.table.SignalTableTestUtils.readId;
import static org.sigtable.table.SignalTableTestUtils.sampleCount;
import static org.sigtable.table.SignalTableTestUtils.samples;

/** Tests for {@link SignalTableBatch}. */
class SignalTableBatchTest {

    private static SignalTableBatch batch(SignalType signalType, long firstRow, int rowCount) {
        return new SignalTableBatch(
                SignalTableTestUtils.batch(signalType, DEFAULT_CODEC, firstRow, rowCount),
                description(signalType),
                DEFAULT_CODEC);
    }

    @ParameterizedTest
    @EnumSource(SignalType.class)
    void testExtractEveryRow(SignalType signalType) {
        SignalTableBatch batch = batch(signalType, 100, 50);
        assertThat(batch.rowCount()).isEqualTo(50);
        assertThat(batch.signalType()).isEqualTo(signalType);

        for (int row = 0; row < 50; row++) {
            long rowId = 100 + row;
            assertThat(batch.readIdAt(row)).isEqualTo(readId(rowId));
            assertThat(batch.sampleCountAt(row)).isEqualTo(sampleCount(rowId));
            assertThat(batch.extractSignalRow(row)).containsExactly(samples(rowId));

            short[] out = new short[sampleCount(rowId)];
            batch.extractSignalRow(row, out);
            assertThat(out).containsExactly(samples(rowId));
        }
    }

    @Test
    void testExtractIntoOffset() {
        SignalTableBatch batch = batch(SignalType.VBZ_SIGNAL, 0, 30);
        short[] out = new short[40];
        Arrays.fill(out, (short) 9999);

        batch.extractSignalRow(22, out, 5, 22);

        assertThat(Arrays.copyOfRange(out, 5, 27)).containsExactly(samples(22));
        assertThat(Arrays.copyOfRange(out, 0, 5)).containsOnly((short) 9999);
        assertThat(Arrays.copyOfRange(out, 27, 40)).containsOnly((short) 9999);
    }

    @ParameterizedTest
    @EnumSource(SignalType.class)
    void testSizeMismatchLeavesBufferUntouched(SignalType signalType) {
        SignalTableBatch batch = batch(signalType, 0, 30);
        short[] out = new short[21];
        Arrays.fill(out, (short) -5);

        assertThatThrownBy(() -> batch.extractSignalRow(22, out))
                .isInstanceOf(SizeMismatchException.class)
                .satisfies(
                        e -> {
                            SizeMismatchException mismatch = (SizeMismatchException) e;
                            assertThat(mismatch.expected()).isEqualTo(22);
                            assertThat(mismatch.actual()).isEqualTo(21);
                        });
        assertThat(out).containsOnly((short) -5);
    }

    @Test
    void testRowOutOfRange() {
        SignalTableBatch batch = batch(SignalType.UNCOMPRESSED_SIGNAL, 0, 3);
        assertThatThrownBy(() -> batch.extractSignalRow(3, new short[3]))
                .isInstanceOf(OutOfRangeException.class);
        assertThatThrownBy(() -> batch.sampleCountAt(-1)).isInstanceOf(OutOfRangeException.class);
        assertThatThrownBy(() -> batch.samplesByteCount(3))
                .isInstanceOf(OutOfRangeException.class);
        assertThatThrownBy(() -> batch.readIdAt(3)).isInstanceOf(OutOfRangeException.class);
    }

    @Test
    void testSamplesByteCount() {
        SignalTableBatch uncompressed = batch(SignalType.UNCOMPRESSED_SIGNAL, 0, 30);
        assertThat(uncompressed.samplesByteCount(22)).isEqualTo(44);
        assertThat(uncompressed.samplesByteCount(0)).isZero();

        SignalTableBatch vbz = batch(SignalType.VBZ_SIGNAL, 0, 30);
        long expected = DEFAULT_CODEC.compress(samples(22)).length;
        assertThat(vbz.samplesByteCount(22)).isEqualTo(expected);
        assertThat(vbz.vbzSignalColumn().getBytes(22).len).isEqualTo((int) expected);
    }

    @Test
    void testColumnAccessForRepresentation() {
        SignalTableBatch uncompressed = batch(SignalType.UNCOMPRESSED_SIGNAL, 0, 5);
        assertThat(uncompressed.uncompressedSignalColumn().getLength(4)).isEqualTo(4);
        assertThatThrownBy(uncompressed::vbzSignalColumn)
                .isInstanceOf(IllegalStateException.class);

        SignalTableBatch vbz = batch(SignalType.VBZ_SIGNAL, 0, 5);
        assertThat(vbz.samplesColumn().getInt(3)).isEqualTo(3);
        assertThat(vbz.readIdColumn().getUuid(2)).isEqualTo(readId(2));
        assertThatThrownBy(vbz::uncompressedSignalColumn)
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testSampleCountIsUnsigned() {
        HeapUuidVector readIds = new HeapUuidVector(1);
        readIds.appendUuid(readId(0));
        HeapArrayVector signal = new HeapArrayVector(1, new HeapShortVector(1));
        signal.appendArray(0);
        HeapIntVector samples = new HeapIntVector(1);
        samples.appendInt(-1);

        SignalTableBatch batch =
                new SignalTableBatch(
                        batchOf(1, readIds, signal, samples),
                        description(SignalType.UNCOMPRESSED_SIGNAL),
                        DEFAULT_CODEC);

        assertThat(batch.sampleCountAt(0)).isEqualTo(4_294_967_295L);
        assertThatThrownBy(() -> batch.extractSignalRow(0, new short[0]))
                .isInstanceOf(SizeMismatchException.class);
    }

    @Test
    void testStoredLengthDisagreesWithSampleCount() {
        HeapUuidVector readIds = new HeapUuidVector(1);
        readIds.appendUuid(readId(0));
        HeapShortVector values = new HeapShortVector(4);
        values.appendShorts(new short[] {1, 2, 3}, 0, 3);
        HeapArrayVector signal = new HeapArrayVector(1, values);
        signal.appendArray(3);
        HeapIntVector samples = new HeapIntVector(1);
        samples.appendInt(4);

        SignalTableBatch batch =
                new SignalTableBatch(
                        batchOf(1, readIds, signal, samples),
                        description(SignalType.UNCOMPRESSED_SIGNAL),
                        DEFAULT_CODEC);

        assertThatThrownBy(() -> batch.extractSignalRow(0))
                .isInstanceOf(SignalCodecException.class)
                .hasMessageContaining("stores 3 samples");
    }

    @Test
    void testCorruptedBlobPropagatesCodecError() {
        HeapUuidVector readIds = new HeapUuidVector(1);
        readIds.appendUuid(readId(0));
        HeapBytesVector signal = new HeapBytesVector(1);
        byte[] blob = DEFAULT_CODEC.compress(new short[] {1, 2, 3, 4});
        signal.appendByteArray(blob, 0, blob.length - 1);
        HeapIntVector samples = new HeapIntVector(1);
        samples.appendInt(4);

        SignalTableBatch batch =
                new SignalTableBatch(
                        batchOf(1, readIds, signal, samples),
                        description(SignalType.VBZ_SIGNAL),
                        DEFAULT_CODEC);

        assertThatThrownBy(() -> batch.extractSignalRow(0, new short[4]))
                .isInstanceOf(SignalCodecException.class);
    }

    @Test
    void testFailedDecodeLeavesBufferUntouched() {
        SignalCodec rawVarints = VbzSignalCodec.create(BlockCompressionType.NONE, 1);
        byte[] blob = rawVarints.compress(new short[] {10, 20, 30, 40, 50});

        HeapUuidVector readIds = new HeapUuidVector(1);
        readIds.appendUuid(readId(0));
        HeapBytesVector signal = new HeapBytesVector(1);
        signal.appendByteArray(blob, 0, blob.length - 1);
        HeapIntVector samples = new HeapIntVector(1);
        samples.appendInt(5);

        SignalTableBatch batch =
                new SignalTableBatch(
                        batchOf(1, readIds, signal, samples),
                        description(SignalType.VBZ_SIGNAL),
                        rawVarints);

        short[] out = new short[5];
        Arrays.fill(out, (short) 31354);
        assertThatThrownBy(() -> batch.extractSignalRow(0, out))
                .isInstanceOf(SignalCodecException.class)
                .hasMessageContaining("Unexpected end");
        assertThat(out).containsOnly((short) 31354);

        short[] padded = new short[9];
        Arrays.fill(padded, (short) 31354);
        assertThatThrownBy(() -> batch.extractSignalRow(0, padded, 2, 5))
                .isInstanceOf(SignalCodecException.class);
        assertThat(padded).containsOnly((short) 31354);
    }

    @Test
    void testColumnTypeMismatch() {
        VectorizedColumnBatch uncompressed =
                SignalTableTestUtils.uncompressedBatch(
                        Collections.singletonList(readId(0)),
                        Collections.singletonList(new short[] {1}));

        assertThatThrownBy(
                        () ->
                                new SignalTableBatch(
                                        uncompressed,
                                        description(SignalType.VBZ_SIGNAL),
                                        DEFAULT_CODEC))
                .isInstanceOf(SignalTableOpenException.class)
                .hasMessageContaining("signal");

        VectorizedColumnBatch missingColumns = batchOf(1, new HeapUuidVector(1));
        assertThatThrownBy(
                        () ->
                                new SignalTableBatch(
                                        missingColumns,
                                        description(SignalType.VBZ_SIGNAL),
                                        DEFAULT_CODEC))
                .isInstanceOf(SignalTableOpenException.class);
    }

    @Test
    void testNonShortListIsRejected() {
        HeapUuidVector readIds = new HeapUuidVector(1);
        HeapArrayVector signal = new HeapArrayVector(1, new HeapIntVector(1));
        HeapIntVector samples = new HeapIntVector(1);

        assertThatThrownBy(
                        () ->
                                new SignalTableBatch(
                                        batchOf(0, readIds, signal, samples),
                                        description(SignalType.UNCOMPRESSED_SIGNAL),
                                        DEFAULT_CODEC))
                .isInstanceOf(SignalTableOpenException.class)
                .hasMessageContaining("16 bit");
    }
}
