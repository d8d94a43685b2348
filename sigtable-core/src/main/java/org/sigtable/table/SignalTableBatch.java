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

import org.sigtable.codec.SignalCodec;
import org.sigtable.data.columnar.ArrayColumnVector;
import org.sigtable.data.columnar.BytesColumnVector;
import org.sigtable.data.columnar.BytesColumnVector.Bytes;
import org.sigtable.data.columnar.ColumnVector;
import org.sigtable.data.columnar.IntColumnVector;
import org.sigtable.data.columnar.ShortColumnVector;
import org.sigtable.data.columnar.UuidColumnVector;
import org.sigtable.data.columnar.VectorizedColumnBatch;
import org.sigtable.exceptions.OutOfRangeException;
import org.sigtable.exceptions.SignalCodecException;
import org.sigtable.exceptions.SignalTableOpenException;
import org.sigtable.exceptions.SizeMismatchException;
import org.sigtable.table.schema.SignalTableSchemaDescription;
import org.sigtable.table.schema.SignalType;

import java.util.UUID;

import static org.sigtable.utils.Preconditions.checkFromIndexSize;

/**
 * 信号表的一个物理批次。
 *
 * <p>包装存储引擎物化出的 {@link VectorizedColumnBatch},按字段位置暴露列视图,
 * 并提供单行信号提取:未压缩表直接复制样本,压缩表交给 {@link SignalCodec} 解码。
 *
 * <h2>表示方式分派</h2>
 *
 * <p>信号的表示方式是整张表的属性,在构造批次时根据 {@link SignalType} 选定一个
 * {@link SignalRowReader},之后每行提取不再判断类型。
 *
 * <p>批次一旦构造即不可变,可以被多个线程并发读取。
 */
public class SignalTableBatch {

    private final VectorizedColumnBatch batch;

    private final SignalTableSchemaDescription fields;

    private final UuidColumnVector readIds;

    private final IntColumnVector samples;

    private final SignalRowReader signalReader;

    /**
     * 构造批次并校验列向量与表模式一致。
     *
     * @throws SignalTableOpenException 如果列缺失或列向量类型与模式不符
     */
    public SignalTableBatch(
            VectorizedColumnBatch batch, SignalTableSchemaDescription fields, SignalCodec codec)
            throws SignalTableOpenException {
        this.batch = batch;
        this.fields = fields;
        this.readIds = column(batch, fields.readIdIndex(), UuidColumnVector.class, "read_id");
        this.samples = column(batch, fields.samplesIndex(), IntColumnVector.class, "samples");

        if (fields.signalType() == SignalType.VBZ_SIGNAL) {
            BytesColumnVector signal =
                    column(batch, fields.signalIndex(), BytesColumnVector.class, "signal");
            this.signalReader = new VbzSignalRowReader(signal, codec);
        } else {
            ArrayColumnVector signal =
                    column(batch, fields.signalIndex(), ArrayColumnVector.class, "signal");
            if (!(signal.getColumnVector() instanceof ShortColumnVector)) {
                throw new SignalTableOpenException(
                        "Uncompressed signal column must hold 16 bit samples, found "
                                + signal.getColumnVector().getClass().getName());
            }
            this.signalReader = new UncompressedSignalRowReader(signal);
        }
    }

    private static <T extends ColumnVector> T column(
            VectorizedColumnBatch batch, int index, Class<T> clazz, String name) {
        if (index >= batch.getArity()) {
            throw new SignalTableOpenException(
                    String.format(
                            "Batch has %d columns, column '%s' is expected at position %d.",
                            batch.getArity(), name, index));
        }
        ColumnVector vector = batch.column(index);
        if (!clazz.isInstance(vector)) {
            throw new SignalTableOpenException(
                    String.format(
                            "Column '%s' is a %s, expected a %s.",
                            name,
                            vector == null ? "null" : vector.getClass().getName(),
                            clazz.getSimpleName()));
        }
        return clazz.cast(vector);
    }

    public int rowCount() {
        return batch.getNumRows();
    }

    public SignalType signalType() {
        return fields.signalType();
    }

    public UuidColumnVector readIdColumn() {
        return readIds;
    }

    /** 样本数列,值按无符号 32 位解释。 */
    public IntColumnVector samplesColumn() {
        return samples;
    }

    /**
     * 压缩信号列。
     *
     * @throws IllegalStateException 如果表使用未压缩信号
     */
    public BytesColumnVector vbzSignalColumn() {
        if (!(signalReader instanceof VbzSignalRowReader)) {
            throw new IllegalStateException("Signal table does not store compressed signal.");
        }
        return ((VbzSignalRowReader) signalReader).signal;
    }

    /**
     * 未压缩信号列。
     *
     * @throws IllegalStateException 如果表使用压缩信号
     */
    public ArrayColumnVector uncompressedSignalColumn() {
        if (!(signalReader instanceof UncompressedSignalRowReader)) {
            throw new IllegalStateException("Signal table does not store uncompressed signal.");
        }
        return ((UncompressedSignalRowReader) signalReader).signal;
    }

    public UUID readIdAt(int batchRow) {
        checkRow(batchRow);
        return readIds.getUuid(batchRow);
    }

    /** 第 batchRow 行记录的样本数,不需要解码。 */
    public long sampleCountAt(int batchRow) {
        checkRow(batchRow);
        return Integer.toUnsignedLong(samples.getInt(batchRow));
    }

    /** 第 batchRow 行信号占用的物理字节数。 */
    public long samplesByteCount(int batchRow) {
        checkRow(batchRow);
        return signalReader.byteCount(batchRow);
    }

    /**
     * 将第 batchRow 行的全部样本写入 {@code out[offset, offset + length)}。
     *
     * @throws OutOfRangeException 如果 batchRow 越界
     * @throws SizeMismatchException 如果 length 与该行样本数不一致,此时不会写入
     * @throws SignalCodecException 如果压缩信号无法解码
     */
    public void extractSignalRow(int batchRow, short[] out, int offset, int length) {
        checkFromIndexSize(offset, length, out.length);
        long sampleCount = sampleCountAt(batchRow);
        if (sampleCount != length) {
            throw new SizeMismatchException(sampleCount, length);
        }
        signalReader.read(batchRow, length, out, offset);
    }

    public void extractSignalRow(int batchRow, short[] out) {
        extractSignalRow(batchRow, out, 0, out.length);
    }

    /** 提取第 batchRow 行的样本到新分配的数组。 */
    public short[] extractSignalRow(int batchRow) {
        long sampleCount = sampleCountAt(batchRow);
        if (sampleCount > Integer.MAX_VALUE) {
            throw new SizeMismatchException(sampleCount, Integer.MAX_VALUE);
        }
        short[] out = new short[(int) sampleCount];
        signalReader.read(batchRow, out.length, out, 0);
        return out;
    }

    private void checkRow(int batchRow) {
        if (batchRow < 0 || batchRow >= batch.getNumRows()) {
            throw OutOfRangeException.forBatchRow(batchRow, batch.getNumRows());
        }
    }

    @Override
    public String toString() {
        return "SignalTableBatch{rowCount=" + rowCount() + ", signalType=" + signalType() + '}';
    }

    // ------------------------------------------------------------------------
    //  Signal representations
    // ------------------------------------------------------------------------

    /** 一种信号表示方式的单行读取逻辑。 */
    private interface SignalRowReader {

        long byteCount(int batchRow);

        void read(int batchRow, int sampleCount, short[] out, int offset);
    }

    private static final class VbzSignalRowReader implements SignalRowReader {

        private final BytesColumnVector signal;
        private final SignalCodec codec;

        private VbzSignalRowReader(BytesColumnVector signal, SignalCodec codec) {
            this.signal = signal;
            this.codec = codec;
        }

        @Override
        public long byteCount(int batchRow) {
            return signal.getBytes(batchRow).len;
        }

        @Override
        public void read(int batchRow, int sampleCount, short[] out, int offset) {
            Bytes blob = signal.getBytes(batchRow);
            codec.decompress(blob.data, blob.offset, blob.len, sampleCount, out, offset);
        }
    }

    private static final class UncompressedSignalRowReader implements SignalRowReader {

        private final ArrayColumnVector signal;
        private final ShortColumnVector values;

        private UncompressedSignalRowReader(ArrayColumnVector signal) {
            this.signal = signal;
            this.values = (ShortColumnVector) signal.getColumnVector();
        }

        @Override
        public long byteCount(int batchRow) {
            return (long) signal.getLength(batchRow) * Short.BYTES;
        }

        @Override
        public void read(int batchRow, int sampleCount, short[] out, int offset) {
            int stored = signal.getLength(batchRow);
            if (stored != sampleCount) {
                throw new SignalCodecException(
                        String.format(
                                "Row %d stores %d samples but its sample count is %d.",
                                batchRow, stored, sampleCount));
            }
            values.copyTo(signal.getOffset(batchRow), out, offset, sampleCount);
        }
    }
}
