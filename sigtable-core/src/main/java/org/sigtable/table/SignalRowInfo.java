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

import java.util.Objects;

/**
 * 单行信号的存储信息。
 *
 * <p>{@code storedByteCount} 是信号在表中占用的字节数:压缩表为字节块长度,
 * 未压缩表为样本数乘 2。
 */
@Public
public final class SignalRowInfo {

    private final int batchIndex;
    private final int batchRow;
    private final long sampleCount;
    private final long storedByteCount;

    public SignalRowInfo(int batchIndex, int batchRow, long sampleCount, long storedByteCount) {
        this.batchIndex = batchIndex;
        this.batchRow = batchRow;
        this.sampleCount = sampleCount;
        this.storedByteCount = storedByteCount;
    }

    public int batchIndex() {
        return batchIndex;
    }

    public int batchRow() {
        return batchRow;
    }

    public long sampleCount() {
        return sampleCount;
    }

    public long storedByteCount() {
        return storedByteCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SignalRowInfo that = (SignalRowInfo) o;
        return batchIndex == that.batchIndex
                && batchRow == that.batchRow
                && sampleCount == that.sampleCount
                && storedByteCount == that.storedByteCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(batchIndex, batchRow, sampleCount, storedByteCount);
    }

    @Override
    public String toString() {
        return String.format(
                "SignalRowInfo{batchIndex=%d, batchRow=%d, sampleCount=%d, storedByteCount=%d}",
                batchIndex, batchRow, sampleCount, storedByteCount);
    }
}
