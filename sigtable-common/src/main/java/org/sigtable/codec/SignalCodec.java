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

import org.sigtable.annotation.Public;
import org.sigtable.exceptions.SignalCodecException;

/**
 * 信号编解码器,在 16 位有符号样本序列与压缩字节块之间转换。
 *
 * <p>读取路径只依赖两个操作:
 * <ul>
 *   <li>{@link #decompress}: 把字节块解码为恰好 {@code expectedCount} 个样本,
 *       格式错误或长度不符时抛出 {@link SignalCodecException}
 *   <li>{@link #compress}: 对任意合法输入总能成功
 * </ul>
 *
 * <p>实现必须是无状态的纯函数,可以被多个线程同时调用。
 */
@Public
public interface SignalCodec {

    /**
     * 压缩 {@code samples[offset, offset + length)}。
     *
     * @return 新分配的压缩字节块,长度即为其物理大小
     */
    byte[] compress(short[] samples, int offset, int length);

    default byte[] compress(short[] samples) {
        return compress(samples, 0, samples.length);
    }

    /**
     * 解码压缩字节块,并将恰好 {@code expectedCount} 个样本写入 {@code out[outOffset, ...)}。
     *
     * @param blob 压缩数据所在数组
     * @param blobOffset 压缩数据起始偏移
     * @param blobLength 压缩数据长度
     * @param expectedCount 行上记录的样本数
     * @param out 输出数组
     * @param outOffset 输出起始偏移
     * @throws SignalCodecException 如果数据损坏或解码得到的样本数与 expectedCount 不一致
     */
    void decompress(
            byte[] blob,
            int blobOffset,
            int blobLength,
            int expectedCount,
            short[] out,
            int outOffset)
            throws SignalCodecException;

    default short[] decompress(byte[] blob, int expectedCount) throws SignalCodecException {
        short[] samples = new short[expectedCount];
        decompress(blob, 0, blob.length, expectedCount, samples, 0);
        return samples;
    }
}
