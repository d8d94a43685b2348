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

package org.sigtable.table;

import org.sigtable.compression.BlockCompressionType;
import org.sigtable.options.ConfigOption;

import static org.sigtable.options.ConfigOptions.key;

/** 信号表读取器的配置项。 */
public class SignalTableOptions {

    /** 是否启用标准批次大小缓存,关闭后每次定位都做线性扫描。 */
    public static final ConfigOption<Boolean> BATCH_SIZE_CACHE_ENABLED =
            key("signal.batch-size-cache.enabled")
                    .booleanType()
                    .defaultValue(true)
                    .withDescription(
                            "Whether to cache the standard batch size and resolve row ids "
                                    + "by division instead of scanning all batches.");

    public static final ConfigOption<BlockCompressionType> CODEC_BLOCK_COMPRESSION =
            key("signal.codec.block-compression")
                    .enumType(BlockCompressionType.class)
                    .defaultValue(BlockCompressionType.ZSTD)
                    .withDescription(
                            "Block compression applied after the delta varint stage of "
                                    + "compressed signal.");

    public static final ConfigOption<Integer> CODEC_ZSTD_LEVEL =
            key("signal.codec.zstd-level")
                    .intType()
                    .defaultValue(1)
                    .withDescription("Zstd compression level used by the signal codec.");

    /**
     * 是否要求表模式带有完整的写入方元数据。
     *
     * <p>关闭后元数据缺失时使用 {@code SchemaMetadata.unknown()}。
     */
    public static final ConfigOption<Boolean> SCHEMA_VERIFY_METADATA =
            key("signal.schema.verify-metadata")
                    .booleanType()
                    .defaultValue(true)
                    .withDescription(
                            "Whether opening a table fails when the writer metadata of the "
                                    + "schema is missing or malformed.");

    private SignalTableOptions() {}
}
