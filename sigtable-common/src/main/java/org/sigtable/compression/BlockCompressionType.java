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
 * 块压缩类型枚举。
 *
 * <p>信号解码器在 zig-zag 差分编码之后使用的块压缩算法。每种类型有一个持久化 ID,
 * 可以记录在表的模式元数据中。
 */
public enum BlockCompressionType {
    /** 不压缩,仅保留差分变长编码 */
    NONE(0),
    /** Zstandard 压缩,默认选项 */
    ZSTD(1),
    /** LZ4 压缩,解码速度最快 */
    LZ4(2),
    /** LZO 压缩 */
    LZO(3);

    /** 持久化 ID */
    private final int persistentId;

    BlockCompressionType(int persistentId) {
        this.persistentId = persistentId;
    }

    public int persistentId() {
        return this.persistentId;
    }

    /**
     * 根据持久化 ID 获取压缩类型。
     *
     * @throws IllegalArgumentException 如果持久化 ID 未知
     */
    public static BlockCompressionType getCompressionTypeByPersistentId(int persistentId) {
        for (BlockCompressionType type : values()) {
            if (type.persistentId == persistentId) {
                return type;
            }
        }

        throw new IllegalArgumentException("Unknown persistentId " + persistentId);
    }
}
