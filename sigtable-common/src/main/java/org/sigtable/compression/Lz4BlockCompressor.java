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

import net.jpountz.lz4.LZ4Compressor;
import net.jpountz.lz4.LZ4Exception;
import net.jpountz.lz4.LZ4Factory;

import static org.sigtable.compression.CompressorUtils.HEADER_LENGTH;
import static org.sigtable.compression.CompressorUtils.writeHeader;

/**
 * 用 LZ4 块格式压缩信号的变长字节流。
 *
 * <p>差分编码后相邻样本多为单字节的小值,LZ4 的快速模式在这类数据上压缩比有限但解码极快,
 * 适合频繁随机读取单行信号的场景。输出不是 LZ4 Frame 格式,只能由
 * {@link Lz4BlockDecompressor} 读取。
 */
public class Lz4BlockCompressor implements BlockCompressor {

    private final LZ4Compressor lz4;

    public Lz4BlockCompressor() {
        this.lz4 = LZ4Factory.fastestInstance().fastCompressor();
    }

    @Override
    public int getMaxCompressedSize(int srcSize) {
        return HEADER_LENGTH + lz4.maxCompressedLength(srcSize);
    }

    @Override
    public int compress(byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff)
            throws BufferCompressionException {
        if (srcLen == 0) {
            return writeHeader(dst, dstOff, 0, 0);
        }
        int payloadOff = dstOff + HEADER_LENGTH;
        int payloadLen;
        try {
            payloadLen =
                    lz4.compress(src, srcOff, srcLen, dst, payloadOff, dst.length - payloadOff);
        } catch (LZ4Exception e) {
            throw new BufferCompressionException(e);
        }
        return writeHeader(dst, dstOff, payloadLen, srcLen);
    }
}
