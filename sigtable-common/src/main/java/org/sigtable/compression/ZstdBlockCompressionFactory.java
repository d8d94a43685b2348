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

/** Zstd 编解码器的 {@link BlockCompressionFactory} 实现。 */
public class ZstdBlockCompressionFactory implements BlockCompressionFactory {

    /** 压缩级别(1-22,越高压缩率越好但速度越慢) */
    private final int compressLevel;

    public ZstdBlockCompressionFactory(int compressLevel) {
        this.compressLevel = compressLevel;
    }

    @Override
    public BlockCompressionType getCompressionType() {
        return BlockCompressionType.ZSTD;
    }

    @Override
    public BlockCompressor getCompressor() {
        return new ZstdBlockCompressor(compressLevel);
    }

    @Override
    public BlockDecompressor getDecompressor() {
        return new ZstdBlockDecompressor();
    }
}
