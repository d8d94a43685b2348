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

import org.sigtable.compression.BlockCompressionFactory;
import org.sigtable.compression.BlockCompressionType;
import org.sigtable.compression.BlockCompressor;
import org.sigtable.compression.BufferDecompressionException;
import org.sigtable.compression.CompressorUtils;
import org.sigtable.exceptions.SignalCodecException;
import org.sigtable.utils.Preconditions;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

import java.util.Arrays;

import static org.sigtable.compression.CompressorUtils.HEADER_LENGTH;
import static org.sigtable.compression.CompressorUtils.readIntLE;

/**
 * 默认的信号编解码器:差分变长编码后接一个块压缩阶段。
 *
 * <p>压缩字节块的结构:
 * <pre>
 * +-------------------------------+
 * | compressed length (int32 LE)  | ← 块压缩头部,NONE 时不存在
 * | original length   (int32 LE)  |
 * +-------------------------------+
 * | block compressed varints      | ← ZSTD / LZ4 / LZO
 * +-------------------------------+
 * </pre>
 *
 * <p>样本数不写入字节块,由调用方以 {@code expectedCount} 传入(来自表上的 samples 列),
 * 解码必须恰好得到该数量的样本,不多也不少。
 *
 * <p>使用示例:
 * <pre>{@code
 * SignalCodec codec = VbzSignalCodec.create(BlockCompressionType.ZSTD, 1);
 * byte[] blob = codec.compress(samples);
 * short[] restored = codec.decompress(blob, samples.length);
 * }</pre>
 */
@ThreadSafe
public class VbzSignalCodec implements SignalCodec {

    /** 块压缩工厂,为 null 表示不做块压缩 */
    @Nullable private final BlockCompressionFactory compressionFactory;

    public VbzSignalCodec(@Nullable BlockCompressionFactory compressionFactory) {
        this.compressionFactory = compressionFactory;
    }

    public static VbzSignalCodec create(BlockCompressionType compressionType, int zstdLevel) {
        return new VbzSignalCodec(BlockCompressionFactory.create(compressionType, zstdLevel));
    }

    public BlockCompressionType compressionType() {
        return compressionFactory == null
                ? BlockCompressionType.NONE
                : compressionFactory.getCompressionType();
    }

    @Override
    public byte[] compress(short[] samples, int offset, int length) {
        Preconditions.checkFromIndexSize(offset, length, samples.length);

        byte[] varints = new byte[length * ZigZagDeltaVarints.MAX_BYTES_PER_SAMPLE];
        int varintLength = ZigZagDeltaVarints.encode(samples, offset, length, varints);
        if (compressionFactory == null) {
            return Arrays.copyOf(varints, varintLength);
        }

        BlockCompressor compressor = compressionFactory.getCompressor();
        byte[] compressed = new byte[compressor.getMaxCompressedSize(varintLength)];
        int compressedLength = compressor.compress(varints, 0, varintLength, compressed, 0);
        return Arrays.copyOf(compressed, compressedLength);
    }

    @Override
    public void decompress(
            byte[] blob,
            int blobOffset,
            int blobLength,
            int expectedCount,
            short[] out,
            int outOffset)
            throws SignalCodecException {
        Preconditions.checkArgument(
                expectedCount >= 0, "Expected sample count must not be negative.");
        Preconditions.checkFromIndexSize(blobOffset, blobLength, blob.length);
        Preconditions.checkFromIndexSize(outOffset, expectedCount, out.length);

        if (compressionFactory == null) {
            ZigZagDeltaVarints.decode(blob, blobOffset, blobLength, expectedCount, out, outOffset);
            return;
        }

        byte[] varints;
        try {
            int originalLength =
                    CompressorUtils.readOriginalLength(blob, blobOffset, blobLength);
            int compressedLength = readIntLE(blob, blobOffset);
            if (blobLength != HEADER_LENGTH + compressedLength) {
                throw new SignalCodecException(
                        String.format(
                                "Signal block declares %d compressed bytes but %d are stored.",
                                compressedLength, blobLength - HEADER_LENGTH));
            }
            if (originalLength
                    > (long) expectedCount * ZigZagDeltaVarints.MAX_BYTES_PER_SAMPLE) {
                throw new SignalCodecException(
                        String.format(
                                "Signal block expands to %d bytes, too many for %d samples.",
                                originalLength, expectedCount));
            }
            varints = new byte[originalLength];
            compressionFactory
                    .getDecompressor()
                    .decompress(blob, blobOffset, blobLength, varints, 0);
        } catch (BufferDecompressionException e) {
            throw new SignalCodecException(
                    "Failed to decompress signal block: " + e.getMessage(), e);
        }

        ZigZagDeltaVarints.decode(varints, 0, varints.length, expectedCount, out, outOffset);
    }

    @Override
    public String toString() {
        return "VbzSignalCodec{" + compressionType() + "}";
    }
}
