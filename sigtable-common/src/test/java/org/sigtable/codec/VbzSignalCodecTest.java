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

package org.sigtable.codec;

import org.sigtable.compression.BlockCompressionType;
import org.sigtable.compression.CompressorUtils;
import org.sigtable.exceptions.SignalCodecException;
import org.sigtable.exceptions.SignalTableException.ErrorKind;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link VbzSignalCodec}. */
class VbzSignalCodecTest {

    private static short[] randomWalk(int length, long seed) {
        Random random = new Random(seed);
        short[] samples = new short[length];
        int value = 500;
        for (int i = 0; i < length; i++) {
            value += random.nextInt(41) - 20;
            value = Math.max(Short.MIN_VALUE, Math.min(Short.MAX_VALUE, value));
            samples[i] = (short) value;
        }
        return samples;
    }

    @ParameterizedTest
    @EnumSource(BlockCompressionType.class)
    void testCompressAndDecompress(BlockCompressionType type) {
        VbzSignalCodec codec = VbzSignalCodec.create(type, 1);
        assertThat(codec.compressionType()).isEqualTo(type);

        short[] samples = randomWalk(10_000, 42);
        byte[] blob = codec.compress(samples);
        assertThat(codec.decompress(blob, samples.length)).containsExactly(samples);
    }

    @ParameterizedTest
    @EnumSource(BlockCompressionType.class)
    void testExtremeSampleValues(BlockCompressionType type) {
        VbzSignalCodec codec = VbzSignalCodec.create(type, 1);
        short[] samples = {
            Short.MIN_VALUE, Short.MAX_VALUE, Short.MIN_VALUE, 0, -1, 1, Short.MAX_VALUE, 0
        };
        byte[] blob = codec.compress(samples);
        assertThat(codec.decompress(blob, samples.length)).containsExactly(samples);
    }

    @ParameterizedTest
    @EnumSource(BlockCompressionType.class)
    void testEmptySignal(BlockCompressionType type) {
        VbzSignalCodec codec = VbzSignalCodec.create(type, 1);
        byte[] blob = codec.compress(new short[0]);
        assertThat(codec.decompress(blob, 0)).isEmpty();
    }

    @Test
    void testDecompressIntoOffset() {
        VbzSignalCodec codec = VbzSignalCodec.create(BlockCompressionType.ZSTD, 3);
        short[] samples = randomWalk(100, 7);
        byte[] blob = codec.compress(samples);

        byte[] padded = new byte[blob.length + 10];
        System.arraycopy(blob, 0, padded, 4, blob.length);
        short[] out = new short[120];
        Arrays.fill(out, (short) -7);

        codec.decompress(padded, 4, blob.length, samples.length, out, 10);

        assertThat(Arrays.copyOfRange(out, 10, 110)).containsExactly(samples);
        assertThat(Arrays.copyOfRange(out, 0, 10)).containsOnly((short) -7);
        assertThat(Arrays.copyOfRange(out, 110, 120)).containsOnly((short) -7);
    }

    @Test
    void testCompressSlice() {
        VbzSignalCodec codec = VbzSignalCodec.create(BlockCompressionType.LZ4, 1);
        short[] samples = randomWalk(50, 3);
        byte[] blob = codec.compress(samples, 10, 20);
        assertThat(codec.decompress(blob, 20))
                .containsExactly(Arrays.copyOfRange(samples, 10, 30));
    }

    @ParameterizedTest
    @EnumSource(BlockCompressionType.class)
    void testCountMismatch(BlockCompressionType type) {
        VbzSignalCodec codec = VbzSignalCodec.create(type, 1);
        short[] samples = randomWalk(64, 11);
        byte[] blob = codec.compress(samples);

        assertThatThrownBy(() -> codec.decompress(blob, samples.length + 1))
                .isInstanceOf(SignalCodecException.class);
        assertThatThrownBy(() -> codec.decompress(blob, samples.length - 1))
                .isInstanceOf(SignalCodecException.class);
    }

    @ParameterizedTest
    @EnumSource(
            value = BlockCompressionType.class,
            names = {"ZSTD", "LZ4", "LZO"})
    void testTruncatedBlob(BlockCompressionType type) {
        VbzSignalCodec codec = VbzSignalCodec.create(type, 1);
        short[] samples = randomWalk(256, 5);
        byte[] blob = codec.compress(samples);

        byte[] truncated = Arrays.copyOf(blob, blob.length - 3);
        assertThatThrownBy(() -> codec.decompress(truncated, samples.length))
                .isInstanceOf(SignalCodecException.class)
                .satisfies(
                        e -> assertThat(((SignalCodecException) e).kind())
                                .isEqualTo(ErrorKind.CODEC_ERROR));

        byte[] headerOnly = Arrays.copyOf(blob, 5);
        assertThatThrownBy(() -> codec.decompress(headerOnly, samples.length))
                .isInstanceOf(SignalCodecException.class);
    }

    @ParameterizedTest
    @EnumSource(
            value = BlockCompressionType.class,
            names = {"ZSTD", "LZ4", "LZO"})
    void testCorruptedPayload(BlockCompressionType type) {
        VbzSignalCodec codec = VbzSignalCodec.create(type, 1);
        short[] samples = randomWalk(256, 9);
        byte[] blob = codec.compress(samples);

        byte[] garbage = new byte[blob.length];
        System.arraycopy(blob, 0, garbage, 0, CompressorUtils.HEADER_LENGTH);
        Arrays.fill(garbage, CompressorUtils.HEADER_LENGTH, garbage.length, (byte) 0xFF);

        assertThatThrownBy(() -> codec.decompress(garbage, samples.length))
                .isInstanceOf(SignalCodecException.class);
    }

    @Test
    void testOversizedHeaderIsRejected() {
        VbzSignalCodec codec = VbzSignalCodec.create(BlockCompressionType.ZSTD, 1);
        byte[] blob = codec.compress(randomWalk(16, 1));
        CompressorUtils.writeIntLE(Integer.MAX_VALUE, blob, 4);

        assertThatThrownBy(() -> codec.decompress(blob, 16))
                .isInstanceOf(SignalCodecException.class)
                .hasMessageContaining("too many");
    }

    @Test
    void testRawVarintsTrailingBytes() {
        VbzSignalCodec codec = VbzSignalCodec.create(BlockCompressionType.NONE, 1);
        short[] samples = {1, 2, 3};
        byte[] blob = Arrays.copyOf(codec.compress(samples), 4);
        blob[3] = 0;

        assertThatThrownBy(() -> codec.decompress(blob, 3))
                .isInstanceOf(SignalCodecException.class)
                .hasMessageContaining("trailing");
    }

    @ParameterizedTest
    @EnumSource(BlockCompressionType.class)
    void testFailedDecodeDoesNotWriteOutput(BlockCompressionType type) {
        VbzSignalCodec codec = VbzSignalCodec.create(type, 1);
        short[] samples = randomWalk(32, 13);
        byte[] blob = codec.compress(samples);

        short[] out = new short[40];
        Arrays.fill(out, (short) 0x5A5A);
        assertThatThrownBy(() -> codec.decompress(blob, 0, blob.length, 33, out, 4))
                .isInstanceOf(SignalCodecException.class);
        assertThat(out).containsOnly((short) 0x5A5A);

        assertThatThrownBy(() -> codec.decompress(blob, 0, blob.length, 31, out, 4))
                .isInstanceOf(SignalCodecException.class);
        assertThat(out).containsOnly((short) 0x5A5A);
    }

    @Test
    void testOutputBufferTooSmall() {
        VbzSignalCodec codec = VbzSignalCodec.create(BlockCompressionType.ZSTD, 1);
        byte[] blob = codec.compress(randomWalk(10, 1));

        assertThatThrownBy(() -> codec.decompress(blob, 0, blob.length, 10, new short[9], 0))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }
}
