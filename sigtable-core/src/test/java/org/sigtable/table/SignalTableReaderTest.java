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

import org.sigtable.codec.VbzSignalCodec;
import org.sigtable.compression.BlockCompressionType;
import org.sigtable.data.columnar.VectorizedColumnBatch;
import org.sigtable.exceptions.OutOfRangeException;
import org.sigtable.exceptions.SignalTableException.ErrorKind;
import org.sigtable.exceptions.SignalTableOpenException;
import org.sigtable.options.Options;
import org.sigtable.table.schema.ColumnType;
import org.sigtable.table.schema.DataField;
import org.sigtable.table.schema.SchemaMetadata;
import org.sigtable.table.schema.SignalTableSchema;
import org.sigtable.table.schema.SignalType;
import org.sigtable.table.source.InMemorySignalTableSource;
import org.sigtable.table.source.SignalTableSource;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.sigtable.table.SignalTableTestUtils.FILE_IDENTIFIER;
import static org.sigtable.table.SignalTableTestUtils.expectedSamples;
import static org.sigtable.table.SignalTableTestUtils.metadata;
import static org.sigtable.table.SignalTableTestUtils.samples;
import static org.sigtable.table.SignalTableTestUtils.schema;
import static org.sigtable.table.SignalTableTestUtils.source;

/** Tests for {@link SignalTableReader}. */
class SignalTableReaderTest {

    @Test
    void testOpenAndRead() throws IOException {
        InMemorySignalTableSource source = source(SignalType.VBZ_SIGNAL, 1000, 1000, 237);
        try (SignalTableReader reader = SignalTableReader.open(source, new Options())) {
            assertThat(reader.signalType()).isEqualTo(SignalType.VBZ_SIGNAL);
            assertThat(reader.batchCount()).isEqualTo(3);
            assertThat(reader.totalRowCount()).isEqualTo(2237);
            assertThat(reader.readRecordBatch(2).rowCount()).isEqualTo(237);
            assertThat(reader.resolve(1000)).isEqualTo(new RowLocation(1, 0, 1000));

            SchemaMetadata metadata = reader.schemaMetadata();
            assertThat(metadata.fileIdentifier()).isEqualTo(FILE_IDENTIFIER);
            assertThat(metadata.writingSoftware()).isEqualTo("sigtable-tests");
            assertThat(metadata.writingVersion()).isEqualTo(new SchemaMetadata.Version(0, 3, 2));

            long[] rows = {2236, 999};
            short[] out = new short[(int) reader.extractSampleCount(rows)];
            reader.extractSamples(rows, out);
            assertThat(out).containsExactly(expectedSamples(rows));
            assertThat(reader.extractSamples(rows)).containsExactly(expectedSamples(rows));
            assertThat(reader.extractSignalRow(2236)).containsExactly(samples(2236));
            assertThat(reader.signalRowInfo(rows)).hasSize(2);

            assertThat(reader.index().cachedStandardBatchSize()).isEqualTo(1000);
        }
        assertThat(source.isClosed()).isTrue();
    }

    @ParameterizedTest
    @EnumSource(BlockCompressionType.class)
    void testConfiguredCompression(BlockCompressionType type) throws IOException {
        VbzSignalCodec codec = VbzSignalCodec.create(type, 3);
        InMemorySignalTableSource source =
                new InMemorySignalTableSource(
                        schema(SignalType.VBZ_SIGNAL),
                        SignalTableTestUtils.batches(SignalType.VBZ_SIGNAL, codec, 40, 40, 5));

        Options options =
                new Options()
                        .set(SignalTableOptions.CODEC_BLOCK_COMPRESSION, type)
                        .set(SignalTableOptions.CODEC_ZSTD_LEVEL, 3);
        try (SignalTableReader reader = SignalTableReader.open(source, options)) {
            for (long row = 0; row < reader.totalRowCount(); row++) {
                assertThat(reader.extractSignalRow(row)).containsExactly(samples(row));
            }
        }
    }

    @Test
    void testBatchSizeCacheDisabled() throws IOException {
        Options options = new Options();
        options.setString(SignalTableOptions.BATCH_SIZE_CACHE_ENABLED.key(), "false");
        try (SignalTableReader reader =
                SignalTableReader.open(source(SignalType.UNCOMPRESSED_SIGNAL, 10, 10, 3), options)) {
            assertThat(reader.resolve(22)).isEqualTo(new RowLocation(2, 2, 20));
            assertThat(reader.index().cachedStandardBatchSize()).isZero();
        }
    }

    @Test
    void testReadRecordBatchOutOfRange() throws IOException {
        try (SignalTableReader reader =
                SignalTableReader.open(source(SignalType.VBZ_SIGNAL, 5), new Options())) {
            assertThatThrownBy(() -> reader.readRecordBatch(1))
                    .isInstanceOf(OutOfRangeException.class);
            assertThatThrownBy(() -> reader.extractSignalRow(5))
                    .isInstanceOf(OutOfRangeException.class);
        }
    }

    @Test
    void testEmptyTable() throws IOException {
        try (SignalTableReader reader =
                SignalTableReader.open(source(SignalType.VBZ_SIGNAL), new Options())) {
            assertThat(reader.batchCount()).isZero();
            assertThat(reader.totalRowCount()).isZero();
            assertThatThrownBy(() -> reader.resolve(0)).isInstanceOf(OutOfRangeException.class);
        }
    }

    @Test
    void testMissingFieldFailsToOpen() {
        SignalTableSchema schema =
                new SignalTableSchema(
                        Arrays.asList(
                                new DataField(SignalTableSchema.READ_ID_FIELD, ColumnType.UUID),
                                new DataField(SignalTableSchema.SIGNAL_FIELD, ColumnType.VBZ_SIGNAL)),
                        metadata());
        InMemorySignalTableSource source =
                new InMemorySignalTableSource(schema, Collections.emptyList());

        assertThatThrownBy(() -> SignalTableReader.open(source, new Options()))
                .isInstanceOf(SignalTableOpenException.class)
                .hasMessageContaining("samples")
                .satisfies(
                        e -> assertThat(((SignalTableOpenException) e).kind())
                                .isEqualTo(ErrorKind.OPEN_ERROR));
        assertThat(source.isClosed()).isTrue();
    }

    @Test
    void testBatchNotMatchingSchemaFailsToOpen() {
        List<VectorizedColumnBatch> uncompressed =
                SignalTableTestUtils.batches(
                        SignalType.UNCOMPRESSED_SIGNAL, SignalTableTestUtils.DEFAULT_CODEC, 4);
        InMemorySignalTableSource source =
                new InMemorySignalTableSource(schema(SignalType.VBZ_SIGNAL), uncompressed);

        assertThatThrownBy(() -> SignalTableReader.open(source, new Options()))
                .isInstanceOf(SignalTableOpenException.class);
        assertThat(source.isClosed()).isTrue();
    }

    @Test
    void testMissingMetadata() throws IOException {
        Map<String, String> metadata = metadata();
        metadata.remove(SchemaMetadata.VERSION_KEY);
        InMemorySignalTableSource strict =
                new InMemorySignalTableSource(
                        schema(SignalType.VBZ_SIGNAL, metadata), Collections.emptyList());
        assertThatThrownBy(() -> SignalTableReader.open(strict, new Options()))
                .isInstanceOf(SignalTableOpenException.class)
                .hasMessageContaining(SchemaMetadata.VERSION_KEY);

        InMemorySignalTableSource lenient =
                new InMemorySignalTableSource(
                        schema(SignalType.VBZ_SIGNAL, metadata), Collections.emptyList());
        Options options = new Options().set(SignalTableOptions.SCHEMA_VERIFY_METADATA, false);
        try (SignalTableReader reader = SignalTableReader.open(lenient, options)) {
            assertThat(reader.schemaMetadata()).isEqualTo(SchemaMetadata.unknown());
        }
    }

    @Test
    void testSourceFailureBecomesOpenError() {
        FailingSource source = new FailingSource();
        assertThatThrownBy(() -> SignalTableReader.open(source, new Options()))
                .isInstanceOf(SignalTableOpenException.class)
                .hasCauseInstanceOf(IOException.class)
                .hasMessageContaining("disk gone");
        assertThat(source.closed).isTrue();
    }

    @Test
    void testCloseIsIdempotent() throws IOException {
        FailingSource source = new FailingSource();
        source.failOnRead = false;
        SignalTableReader reader = SignalTableReader.open(source, new Options());
        reader.close();
        reader.close();
        assertThat(source.closeCount.get()).isEqualTo(1);
    }

    @Test
    void testConcurrentCloseClosesSourceOnce() throws Exception {
        FailingSource source = new FailingSource();
        source.failOnRead = false;
        SignalTableReader reader = SignalTableReader.open(source, new Options());

        int threadCount = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threadCount; i++) {
                futures.add(
                        executor.submit(
                                () -> {
                                    start.await();
                                    reader.close();
                                    return null;
                                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        assertThat(source.closeCount.get()).isEqualTo(1);
    }

    /** 读取批次时失败的数据源。 */
    private static class FailingSource implements SignalTableSource {

        private boolean failOnRead = true;
        private volatile boolean closed;
        private final AtomicInteger closeCount = new AtomicInteger();

        @Override
        public SignalTableSchema schema() {
            return SignalTableTestUtils.schema(SignalType.VBZ_SIGNAL);
        }

        @Override
        public int batchCount() {
            return failOnRead ? 1 : 0;
        }

        @Override
        public VectorizedColumnBatch readBatch(int i) throws IOException {
            throw new IOException("disk gone");
        }

        @Override
        public void close() {
            closed = true;
            closeCount.incrementAndGet();
        }
    }
}
