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
 * 信号块解压缩器,还原 {@link BlockCompressor} 写出的变长字节流。
 *
 * <p>调用方先用 {@link CompressorUtils#readOriginalLength(byte[], int, int)} 取得字节流长度,
 * 校验它与期望样本数相称后再分配 dst。
 */
public interface BlockDecompressor {

    /**
     * 解压 {@code src[srcOff, srcOff + srcLen)} 中的一个块到 {@code dst[dstOff]}。
     *
     * @return 还原出的字节数,等于头部记录的原始长度
     * @throws BufferDecompressionException 如果头部非法、数据不完整、dst 空间不足,
     *     或解压结果与头部记录的长度不一致
     */
    int decompress(byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff)
            throws BufferDecompressionException;
}
