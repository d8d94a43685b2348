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

import com.github.luben.zstd.RecyclingBufferPool;
import com.github.luben.zstd.ZstdOutputStream;

import java.io.IOException;
import java.io.OutputStream;

import static org.sigtable.compression.CompressorUtils.HEADER_LENGTH;
import static org.sigtable.compression.CompressorUtils.writeHeader;

/**
 * Zstd 块压缩器。
 *
 * <p>实现细节:
 * <ul>
 *   <li>先预留头部空间,压缩完成后回填压缩长度和原始长度</li>
 *   <li>使用单线程压缩(workers=0)以保证性能可预测</li>
 *   <li>通过自定义 OutputStream 直接写入目标数组,避免额外的数据复制</li>
 * </ul>
 */
public class ZstdBlockCompressor implements BlockCompressor {

    /** 最大块大小,用于计算压缩后的最大可能大小 */
    private static final int MAX_BLOCK_SIZE = 128 * 1024;

    /** 压缩级别 */
    private final int level;

    public ZstdBlockCompressor(int level) {
        this.level = level;
    }

    @Override
    public int getMaxCompressedSize(int srcSize) {
        return HEADER_LENGTH + zstdMaxCompressedLength(srcSize);
    }

    private int zstdMaxCompressedLength(int uncompressedSize) {
        // refer to io.airlift.compress.zstd.ZstdCompressor
        int result = uncompressedSize + (uncompressedSize >>> 8);
        if (uncompressedSize < MAX_BLOCK_SIZE) {
            result += (MAX_BLOCK_SIZE - uncompressedSize) >>> 11;
        }
        return result;
    }

    @Override
    public int compress(byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff)
            throws BufferCompressionException {
        if (srcLen == 0) {
            return writeHeader(dst, dstOff, 0, 0);
        }

        ByteArrayOutputStream stream = new ByteArrayOutputStream(dst, dstOff + HEADER_LENGTH);
        // use the two-argument constructor to avoid zstd-jni conflicts
        try (ZstdOutputStream zstdStream =
                new ZstdOutputStream(stream, RecyclingBufferPool.INSTANCE)) {
            zstdStream.setLevel(level);
            zstdStream.setWorkers(0);
            zstdStream.write(src, srcOff, srcLen);
        } catch (IOException e) {
            throw new BufferCompressionException(e);
        }

        int compressedLength = stream.position() - dstOff - HEADER_LENGTH;
        return writeHeader(dst, dstOff, compressedLength, srcLen);
    }

    /** 直接写入提供的字节数组的输出流。 */
    private static class ByteArrayOutputStream extends OutputStream {

        private final byte[] buf;
        private int position;

        ByteArrayOutputStream(byte[] buf, int position) {
            this.buf = buf;
            this.position = position;
        }

        @Override
        public void write(int b) throws IOException {
            if (position >= buf.length) {
                throw new IOException("Compressed data exceeds the destination buffer.");
            }
            buf[position] = (byte) b;
            position += 1;
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            if ((off < 0) || (off > b.length) || (len < 0) || ((off + len) - b.length > 0)) {
                throw new IndexOutOfBoundsException("Invalid offset or length");
            }
            if (len == 0) {
                return;
            }
            try {
                System.arraycopy(b, off, buf, position, len);
            } catch (IndexOutOfBoundsException e) {
                throw new IOException(e);
            }
            position += len;
        }

        int position() {
            return position;
        }
    }
}
