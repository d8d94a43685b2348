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

import org.sigtable.annotation.Public;
import org.sigtable.annotation.VisibleForTesting;
import org.sigtable.codec.SignalCodec;
import org.sigtable.codec.VbzSignalCodec;
import org.sigtable.data.columnar.VectorizedColumnBatch;
import org.sigtable.exceptions.OutOfRangeException;
import org.sigtable.exceptions.SignalCodecException;
import org.sigtable.exceptions.SignalTableOpenException;
import org.sigtable.exceptions.SizeMismatchException;
import org.sigtable.options.Options;
import org.sigtable.table.schema.SchemaMetadata;
import org.sigtable.table.schema.SignalTableSchema;
import org.sigtable.table.schema.SignalTableSchemaDescription;
import org.sigtable.table.schema.SignalType;
import org.sigtable.table.source.SignalTableSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.sigtable.utils.Preconditions.checkNotNull;

/**
 * 信号表读取器。
 *
 * <p>打开时从 {@link SignalTableSource} 读取表模式和全部批次,校验每个批次的列与模式一致,
 * 然后构建 {@link SignalTableIndex} 和 {@link SignalExtractor}。之后的读取不再访问数据源。
 *
 * <p>使用示例:
 * <pre>{@code
 * try (SignalTableReader reader = SignalTableReader.open(source, new Options())) {
 *     long[] rows = {2236, 999};
 *     short[] samples = new short[(int) reader.extractSampleCount(rows)];
 *     reader.extractSamples(rows, samples);
 * }
 * }</pre>
 *
 * <p>读取器持有数据源,{@link #close()} 会关闭数据源。
 */
@Public
public class SignalTableReader implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(SignalTableReader.class);

    private final SignalTableSource source;

    private final SchemaMetadata schemaMetadata;

    private final SignalType signalType;

    private final SignalTableIndex index;

    private final SignalExtractor extractor;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    private SignalTableReader(
            SignalTableSource source,
            SchemaMetadata schemaMetadata,
            SignalType signalType,
            SignalTableIndex index) {
        this.source = source;
        this.schemaMetadata = schemaMetadata;
        this.signalType = signalType;
        this.index = index;
        this.extractor = new SignalExtractor(index);
    }

    /** 使用配置中的块压缩方式创建编解码器并打开表。 */
    public static SignalTableReader open(SignalTableSource source, Options options)
            throws SignalTableOpenException {
        SignalCodec codec =
                VbzSignalCodec.create(
                        options.get(SignalTableOptions.CODEC_BLOCK_COMPRESSION),
                        options.get(SignalTableOptions.CODEC_ZSTD_LEVEL));
        return open(source, options, codec);
    }

    /**
     * 打开表。失败时关闭数据源。
     *
     * @throws SignalTableOpenException 如果模式不符、元数据缺失或数据源读取失败
     */
    public static SignalTableReader open(
            SignalTableSource source, Options options, SignalCodec codec)
            throws SignalTableOpenException {
        checkNotNull(source, "source must not be null");
        checkNotNull(options, "options must not be null");
        checkNotNull(codec, "codec must not be null");
        try {
            return doOpen(source, options, codec);
        } catch (IOException | RuntimeException e) {
            try {
                source.close();
            } catch (IOException closeException) {
                e.addSuppressed(closeException);
            }
            if (e instanceof SignalTableOpenException) {
                throw (SignalTableOpenException) e;
            }
            throw new SignalTableOpenException("Failed to open signal table: " + e.getMessage(), e);
        }
    }

    private static SignalTableReader doOpen(
            SignalTableSource source, Options options, SignalCodec codec) throws IOException {
        SignalTableSchema schema = source.schema();
        SignalTableSchemaDescription fields = SignalTableSchemaDescription.of(schema);
        SchemaMetadata metadata = readMetadata(schema, options);

        int batchCount = source.batchCount();
        List<SignalTableBatch> batches = new ArrayList<>(batchCount);
        for (int i = 0; i < batchCount; i++) {
            VectorizedColumnBatch batch = source.readBatch(i);
            batches.add(new SignalTableBatch(batch, fields, codec));
        }

        SignalTableIndex index =
                new SignalTableIndex(
                        batches, options.get(SignalTableOptions.BATCH_SIZE_CACHE_ENABLED));
        LOG.info(
                "Opened signal table with {} batches, {} rows and {} signal, written by {} {}.",
                index.batchCount(),
                index.totalRowCount(),
                fields.signalType(),
                metadata.writingSoftware(),
                metadata.writingVersion());
        return new SignalTableReader(source, metadata, fields.signalType(), index);
    }

    private static SchemaMetadata readMetadata(SignalTableSchema schema, Options options) {
        if (options.get(SignalTableOptions.SCHEMA_VERIFY_METADATA)) {
            return SchemaMetadata.fromMap(schema.metadata());
        }
        try {
            return SchemaMetadata.fromMap(schema.metadata());
        } catch (SignalTableOpenException e) {
            LOG.warn("Ignoring unreadable schema metadata: {}", e.getMessage());
            return SchemaMetadata.unknown();
        }
    }

    /** 写入软件记录的元数据;关闭元数据校验且元数据不可读时为 {@link SchemaMetadata#unknown()}。 */
    public SchemaMetadata schemaMetadata() {
        return schemaMetadata;
    }

    /** 信号列的存储方式,由模式决定,所有批次相同。 */
    public SignalType signalType() {
        return signalType;
    }

    /** 批次数量。 */
    public int batchCount() {
        return index.batchCount();
    }

    public long totalRowCount() {
        return index.totalRowCount();
    }

    /** 第 batchIndex 个批次。 */
    public SignalTableBatch readRecordBatch(int batchIndex) {
        return index.batch(batchIndex);
    }

    /**
     * 把全局行号定位到批次和批次内行号。
     *
     * @throws OutOfRangeException 如果 rowId 为负或不小于总行数
     */
    public RowLocation resolve(long rowId) {
        return index.resolve(rowId);
    }

    /**
     * 给定各行的样本数之和,行可以重复。
     *
     * @throws OutOfRangeException 如果任一行号越界
     */
    public long extractSampleCount(long[] rowIds) {
        return extractor.extractSampleCount(rowIds);
    }

    /**
     * 按 rowIds 的顺序把各行样本依次写入 out。所有行号先定位,任何检查失败时 out 不被修改。
     *
     * @throws OutOfRangeException 如果任一行号越界
     * @throws SizeMismatchException 如果 out 的长度不等于样本总数
     * @throws SignalCodecException 如果某行的样本数据损坏
     */
    public void extractSamples(long[] rowIds, short[] out) {
        extractor.extractSamples(rowIds, out);
    }

    /**
     * 同 {@link #extractSamples(long[], short[])},写入 {@code out[offset, offset + length)}。
     *
     * @throws OutOfRangeException 如果任一行号越界
     * @throws SizeMismatchException 如果 length 不等于样本总数
     */
    public void extractSamples(long[] rowIds, short[] out, int offset, int length) {
        extractor.extractSamples(rowIds, out, offset, length);
    }

    /**
     * 分配恰好大小的数组并提取样本。
     *
     * @throws OutOfRangeException 如果任一行号越界
     * @throws SizeMismatchException 如果样本总数超出数组的最大长度
     */
    public short[] extractSamples(long[] rowIds) {
        return extractor.extractSamples(rowIds);
    }

    /** 每行的定位、样本数和存储字节数。 */
    public List<SignalRowInfo> signalRowInfo(long[] rowIds) {
        return extractor.signalRowInfo(rowIds);
    }

    /**
     * 读取单行的全部样本。
     *
     * @throws OutOfRangeException 如果 rowId 越界
     */
    public short[] extractSignalRow(long rowId) {
        RowLocation location = index.resolve(rowId);
        return index.batch(location.batchIndex()).extractSignalRow(location.batchRow());
    }

    @VisibleForTesting
    SignalTableIndex index() {
        return index;
    }

    @Override
    public void close() throws IOException {
        if (closed.compareAndSet(false, true)) {
            source.close();
        }
    }
}
