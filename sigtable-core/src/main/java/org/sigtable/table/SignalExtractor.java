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

import org.sigtable.exceptions.OutOfRangeException;
import org.sigtable.exceptions.SizeMismatchException;

import java.util.ArrayList;
import java.util.List;

import static org.sigtable.utils.Preconditions.checkFromIndexSize;

/**
 * 按全局行号批量读取信号。
 *
 * <p>行号可以无序,也可以重复。输出按请求顺序依次拼接:第 k 个行号的样本紧跟在
 * 前 k - 1 个行号的样本之后。
 *
 * <p>提取前会先定位所有行并校验总样本数,输出缓冲区长度不符时不写入任何样本。
 * 解码过程中的失败直接抛出,此时缓冲区可能已被部分写入。
 */
public class SignalExtractor {

    private final SignalTableIndex index;

    public SignalExtractor(SignalTableIndex index) {
        this.index = index;
    }

    /**
     * 统计给定行的样本总数,只读取样本数列,不解码信号。
     *
     * @throws OutOfRangeException 如果任一行号越界
     */
    public long extractSampleCount(long[] rowIds) {
        long total = 0;
        for (long rowId : rowIds) {
            RowLocation location = index.resolve(rowId);
            total += index.batch(location.batchIndex()).sampleCountAt(location.batchRow());
        }
        return total;
    }

    public void extractSamples(long[] rowIds, short[] out) {
        extractSamples(rowIds, out, 0, out.length);
    }

    /**
     * 将给定行的样本按请求顺序写入 {@code out[offset, offset + length)}。
     *
     * @throws OutOfRangeException 如果任一行号越界,此时不会写入
     * @throws SizeMismatchException 如果 length 与样本总数不一致,此时不会写入
     */
    public void extractSamples(long[] rowIds, short[] out, int offset, int length) {
        checkFromIndexSize(offset, length, out.length);

        RowLocation[] locations = new RowLocation[rowIds.length];
        long[] sampleCounts = new long[rowIds.length];
        long total = 0;
        for (int i = 0; i < rowIds.length; i++) {
            locations[i] = index.resolve(rowIds[i]);
            sampleCounts[i] =
                    index.batch(locations[i].batchIndex()).sampleCountAt(locations[i].batchRow());
            total += sampleCounts[i];
        }
        if (total != length) {
            throw new SizeMismatchException(total, length);
        }

        int position = offset;
        for (int i = 0; i < locations.length; i++) {
            int count = (int) sampleCounts[i];
            index.batch(locations[i].batchIndex())
                    .extractSignalRow(locations[i].batchRow(), out, position, count);
            position += count;
        }
    }

    /** 读取给定行的全部样本到新分配的数组。 */
    public short[] extractSamples(long[] rowIds) {
        long total = extractSampleCount(rowIds);
        if (total > Integer.MAX_VALUE) {
            throw new SizeMismatchException(total, Integer.MAX_VALUE);
        }
        short[] out = new short[(int) total];
        extractSamples(rowIds, out);
        return out;
    }

    /** 给定行的存储信息,顺序与请求一致。 */
    public List<SignalRowInfo> signalRowInfo(long[] rowIds) {
        List<SignalRowInfo> infos = new ArrayList<>(rowIds.length);
        for (long rowId : rowIds) {
            RowLocation location = index.resolve(rowId);
            SignalTableBatch batch = index.batch(location.batchIndex());
            infos.add(
                    new SignalRowInfo(
                            location.batchIndex(),
                            location.batchRow(),
                            batch.sampleCountAt(location.batchRow()),
                            batch.samplesByteCount(location.batchRow())));
        }
        return infos;
    }
}
