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

import net.jpountz.lz4.LZ4Exception;
import net.jpountz.lz4.LZ4Factory;
import net.jpountz.lz4.LZ4SafeDecompressor;

import static org.sigtable.compression.CompressorUtils.HEADER_LENGTH;
import static org.sigtable.compression.CompressorUtils.checkBlock;
import static org.sigtable.compression.CompressorUtils.readIntLE;

/**
 * 还原 {@link Lz4BlockCompressor} 写出的块。
 *
 * <p>存储的信号块来自外部文件,使用 safe 解压模式,写入上限为头部记录的原始长度,
 * 损坏的块不会越界写 dst。
 */
public class Lz4BlockDecompressor implements BlockDecompressor {

    private final LZ4SafeDecompressor lz4;

    public Lz4BlockDecompressor() {
        this.lz4 = LZ4Factory.fastestInstance().safeDecompressor();
    }

    @Override
    public int decompress(byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff)
            throws BufferDecompressionException {
        int payloadLen = checkBlock(src, srcOff, srcLen, dst, dstOff);
        int varintLen = readIntLE(src, srcOff + 4);
        if (varintLen == 0) {
            return 0;
        }

        int restored;
        try {
            restored =
                    lz4.decompress(
                            src, srcOff + HEADER_LENGTH, payloadLen, dst, dstOff, varintLen);
        } catch (LZ4Exception e) {
            throw new BufferDecompressionException("Corrupted LZ4 signal block", e);
        }
        if (restored != varintLen) {
            throw new BufferDecompressionException(
                    String.format(
                            "LZ4 signal block restored %d bytes, header declares %d.",
                            restored, varintLen));
        }
        return restored;
    }
}
