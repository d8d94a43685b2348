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

import org.sigtable.annotation.VisibleForTesting;
import org.sigtable.exceptions.OutOfRangeException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 有序批次列表上的行定位索引,把全局行号翻译成 {@link RowLocation}。
 *
 * <h2>定位方式</h2>
 *
 * <ul>
 *   <li>线性扫描:按顺序累加每个批次的行数,直到找到包含该行的批次。
 *   <li>快速路径:写入方通常用固定行数切分批次,只有最后一个批次较短。此时第 i 个批次的
 *       起始行是 {@code i * standardSize},可以直接用除法定位。
 * </ul>
 *
 * <h2>标准批次大小缓存</h2>
 *
 * <p>缓存值保存在 {@link AtomicLong} 中:
 * <ul>
 *   <li>{@code 0}: 尚未计算
 *   <li>{@code -1}: 批次大小不规则,不使用快速路径
 *   <li>{@code > 0}: 标准批次大小
 * </ul>
 *
 * <p>首次走线性扫描时计算:至少两个批次,且除最后一个批次外所有批次行数相同。
 * 并发计算得到的值相同,用 compareAndSet 发布。快速路径的结果总会校验
 * {@code 0 <= rowId - start < rowCount},不满足时退回线性扫描。
 */
@ThreadSafe
public class SignalTableIndex {

    private static final Logger LOG = LoggerFactory.getLogger(SignalTableIndex.class);

    private static final long UNKNOWN = 0L;
    private static final long IRREGULAR = -1L;

    private final List<SignalTableBatch> batches;

    private final long totalRowCount;

    private final boolean batchSizeCacheEnabled;

    private final AtomicLong standardBatchSize = new AtomicLong(UNKNOWN);

    public SignalTableIndex(List<SignalTableBatch> batches, boolean batchSizeCacheEnabled) {
        this.batches = Collections.unmodifiableList(new ArrayList<>(batches));
        long total = 0;
        for (SignalTableBatch batch : this.batches) {
            total += batch.rowCount();
        }
        this.totalRowCount = total;
        this.batchSizeCacheEnabled = batchSizeCacheEnabled;
    }

    public int batchCount() {
        return batches.size();
    }

    public long totalRowCount() {
        return totalRowCount;
    }

    /**
     * 返回第 batchIndex 个批次。
     *
     * @throws OutOfRangeException 如果 batchIndex 越界
     */
    public SignalTableBatch batch(int batchIndex) {
        if (batchIndex < 0 || batchIndex >= batches.size()) {
            throw OutOfRangeException.forBatch(batchIndex, batches.size());
        }
        return batches.get(batchIndex);
    }

    /**
     * 定位全局行号。
     *
     * @throws OutOfRangeException 如果 rowId 为负或不小于总行数(空表总是越界)
     */
    public RowLocation resolve(long rowId) {
        if (rowId < 0 || rowId >= totalRowCount) {
            throw OutOfRangeException.forRow(rowId, totalRowCount);
        }

        if (batchSizeCacheEnabled) {
            long size = standardBatchSize.get();
            if (size > 0) {
                int batchIndex = (int) Math.min(rowId / size, batches.size() - 1);
                long start = batchIndex * size;
                long batchRow = rowId - start;
                if (batchRow >= 0 && batchRow < batches.get(batchIndex).rowCount()) {
                    return new RowLocation(batchIndex, (int) batchRow, start);
                }
                LOG.debug(
                        "Cached batch size {} does not locate row {}, falling back to scan.",
                        size,
                        rowId);
            }
        }

        RowLocation location = scan(rowId);
        if (batchSizeCacheEnabled && standardBatchSize.get() == UNKNOWN) {
            establishStandardBatchSize();
        }
        return location;
    }

    private RowLocation scan(long rowId) {
        long start = 0;
        for (int i = 0; i < batches.size(); i++) {
            int rowCount = batches.get(i).rowCount();
            if (rowId < start + rowCount) {
                return new RowLocation(i, (int) (rowId - start), start);
            }
            start += rowCount;
        }
        // rowId 已经过范围检查
        throw OutOfRangeException.forRow(rowId, totalRowCount);
    }

    private void establishStandardBatchSize() {
        long size = IRREGULAR;
        if (batches.size() >= 2) {
            int first = batches.get(0).rowCount();
            size = first > 0 ? first : IRREGULAR;
            for (int i = 1; i < batches.size() - 1 && size > 0; i++) {
                if (batches.get(i).rowCount() != first) {
                    size = IRREGULAR;
                }
            }
        }
        if (standardBatchSize.compareAndSet(UNKNOWN, size)) {
            if (size > 0) {
                LOG.debug(
                        "Established standard batch size {} over {} batches.",
                        size,
                        batches.size());
            } else {
                LOG.debug("Batch sizes are irregular, row ids will be resolved by scanning.");
            }
        }
    }

    /** 当前缓存的标准批次大小,未计算时为 0,不规则时为 -1。 */
    @VisibleForTesting
    long cachedStandardBatchSize() {
        return standardBatchSize.get();
    }
}
