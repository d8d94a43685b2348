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

import io.airlift.compress.lzo.LzoCompressor;
import io.airlift.compress.lzo.LzoDecompressor;

import javax.annotation.Nullable;

/**
 * 块压缩工厂接口。
 *
 * <p>每种压缩算法有一个 {@link BlockCompressionFactory} 实现来创建压缩器和解压缩器。
 */
public interface BlockCompressionFactory {

    BlockCompressionType getCompressionType();

    BlockCompressor getCompressor();

    BlockDecompressor getDecompressor();

    /**
     * 根据压缩类型创建工厂。
     *
     * @param compression 块压缩类型
     * @param zstdLevel ZSTD 压缩级别,其他类型忽略该参数
     * @return 对应的压缩工厂,{@link BlockCompressionType#NONE} 返回 null
     */
    @Nullable
    static BlockCompressionFactory create(BlockCompressionType compression, int zstdLevel) {
        switch (compression) {
            case NONE:
                return null;
            case ZSTD:
                return new ZstdBlockCompressionFactory(zstdLevel);
            case LZ4:
                return new Lz4BlockCompressionFactory();
            case LZO:
                return new AirCompressorFactory(
                        BlockCompressionType.LZO, new LzoCompressor(), new LzoDecompressor());
            default:
                throw new IllegalStateException("Unknown CompressionMethod " + compression);
        }
    }

    /** 使用默认 ZSTD 级别 1 创建工厂。 */
    @Nullable
    static BlockCompressionFactory create(BlockCompressionType compression) {
        return create(compression, 1);
    }
}
