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
 * LZ4 信号块压缩。
 *
 * <p>压缩器和解压器只包装 lz4-java 的线程安全实例,因此工厂共享同一对对象。
 */
public class Lz4BlockCompressionFactory implements BlockCompressionFactory {

    private static final Lz4BlockCompressor COMPRESSOR = new Lz4BlockCompressor();

    private static final Lz4BlockDecompressor DECOMPRESSOR = new Lz4BlockDecompressor();

    @Override
    public BlockCompressionType getCompressionType() {
        return BlockCompressionType.LZ4;
    }

    @Override
    public BlockCompressor getCompressor() {
        return COMPRESSOR;
    }

    @Override
    public BlockDecompressor getDecompressor() {
        return DECOMPRESSOR;
    }
}
