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

/**
 * 信号块压缩器。
 *
 * <p>输入是差分变长编码阶段产生的字节流,输出是一个自描述的块:
 * <pre>
 * | compressed length (int32 LE) | original length (int32 LE) | payload |
 * </pre>
 * 原始长度即变长字节流的长度,解码端据此分配精确大小的中间缓冲区,
 * 并在解压前拒绝与样本数不相称的头部。
 *
 * <p>实现不保存跨调用的状态,同一个实例可以重复使用。
 */
public interface BlockCompressor {

    /** 长度为 srcSize 的变长字节流压缩后最多占用的字节数,含头部。 */
    int getMaxCompressedSize(int srcSize);

    /**
     * 压缩 {@code src[srcOff, srcOff + srcLen)},从 {@code dst[dstOff]} 开始写入头部和压缩数据。
     * 空输入只写一个长度均为 0 的头部。
     *
     * @return 写入的总字节数
     * @throws BufferCompressionException 如果底层压缩库失败或目标空间不足
     */
    int compress(byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff)
            throws BufferCompressionException;
}
