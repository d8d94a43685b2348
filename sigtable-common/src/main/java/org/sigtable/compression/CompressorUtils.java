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

/** 块压缩的公共工具方法。 */
public class CompressorUtils {

    /**
     * 头部长度。
     *
     * <p>每个压缩块前放置两个小端序整数,第一个表示块的压缩长度,第二个表示块的原始长度。
     */
    public static final int HEADER_LENGTH = 8;

    public static void writeIntLE(int i, byte[] buf, int offset) {
        buf[offset++] = (byte) i;
        buf[offset++] = (byte) (i >>> 8);
        buf[offset++] = (byte) (i >>> 16);
        buf[offset] = (byte) (i >>> 24);
    }

    /**
     * 在 {@code dst[dstOff]} 处写入块头部。
     *
     * @return 整个块的长度,即头部加压缩数据
     */
    public static int writeHeader(byte[] dst, int dstOff, int compressedLen, int originalLen) {
        writeIntLE(compressedLen, dst, dstOff);
        writeIntLE(originalLen, dst, dstOff + 4);
        return HEADER_LENGTH + compressedLen;
    }

    public static int readIntLE(byte[] buf, int i) {
        return (buf[i] & 0xFF)
                | ((buf[i + 1] & 0xFF) << 8)
                | ((buf[i + 2] & 0xFF) << 16)
                | ((buf[i + 3] & 0xFF) << 24);
    }

    /**
     * 读取块头部记录的原始长度。
     *
     * @param src 压缩块所在数组
     * @param srcOff 压缩块起始偏移
     * @param srcLen 压缩块长度
     * @return 原始(解压后)长度
     * @throws BufferDecompressionException 如果块长度不足以容纳头部或头部非法
     */
    public static int readOriginalLength(byte[] src, int srcOff, int srcLen)
            throws BufferDecompressionException {
        if (srcLen < HEADER_LENGTH || src.length - srcOff < HEADER_LENGTH) {
            throw new BufferDecompressionException(
                    String.format(
                            "Compressed block of %d bytes is shorter than its %d byte header.",
                            srcLen, HEADER_LENGTH));
        }
        int compressedLen = readIntLE(src, srcOff);
        int originalLen = readIntLE(src, srcOff + 4);
        validateLength(compressedLen, originalLen);
        return originalLen;
    }

    /**
     * 验证压缩长度和原始长度的有效性。
     *
     * <ul>
     *   <li>长度不能为负数</li>
     *   <li>原始长度为0时,压缩长度必须为0</li>
     *   <li>原始长度不为0时,压缩长度不能为0</li>
     * </ul>
     *
     * @throws BufferDecompressionException 如果长度验证失败
     */
    public static void validateLength(int compressedLen, int originalLen)
            throws BufferDecompressionException {
        if (originalLen < 0
                || compressedLen < 0
                || (originalLen == 0 && compressedLen != 0)
                || (originalLen != 0 && compressedLen == 0)) {
            throw new BufferDecompressionException("Input is corrupted, invalid length.");
        }
    }

    /** 校验头部、源数据完整性与目标空间,返回压缩长度。 */
    static int checkBlock(byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff)
            throws BufferDecompressionException {
        int originalLen = readOriginalLength(src, srcOff, srcLen);
        int compressedLen = readIntLE(src, srcOff);

        if (dst.length - dstOff < originalLen) {
            throw new BufferDecompressionException("Buffer length too small");
        }

        if (srcLen - HEADER_LENGTH < compressedLen
                || src.length - srcOff - HEADER_LENGTH < compressedLen) {
            throw new BufferDecompressionException(
                    "Source data is not integral for decompression.");
        }
        return compressedLen;
    }

    private CompressorUtils() {}
}
