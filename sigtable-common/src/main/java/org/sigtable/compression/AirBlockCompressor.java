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

package org.sigtable.compression;

import io.airlift.compress.Compressor;

import static org.sigtable.compression.CompressorUtils.HEADER_LENGTH;
import static org.sigtable.compression.CompressorUtils.writeHeader;

/** 将 Airlift 压缩器适配为 {@link BlockCompressor},负责写入块头部。 */
public class AirBlockCompressor implements BlockCompressor {

    private final Compressor internalCompressor;

    public AirBlockCompressor(Compressor internalCompressor) {
        this.internalCompressor = internalCompressor;
    }

    @Override
    public int getMaxCompressedSize(int srcSize) {
        return HEADER_LENGTH + internalCompressor.maxCompressedLength(srcSize);
    }

    @Override
    public int compress(byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff)
            throws BufferCompressionException {
        if (dst.length < dstOff + getMaxCompressedSize(srcLen)) {
            throw new BufferCompressionException(
                    String.format(
                            "Destination has %d bytes but up to %d bytes may be written.",
                            dst.length - dstOff, getMaxCompressedSize(srcLen)));
        }
        try {
            int compressedLength =
                    srcLen == 0
                            ? 0
                            : internalCompressor.compress(
                                    src,
                                    srcOff,
                                    srcLen,
                                    dst,
                                    dstOff + HEADER_LENGTH,
                                    internalCompressor.maxCompressedLength(srcLen));
            return writeHeader(dst, dstOff, compressedLength, srcLen);
        } catch (Exception e) {
            throw new BufferCompressionException(e);
        }
    }
}
