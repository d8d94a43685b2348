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

/** 全局行号在表中的物理位置:所在批次、批次内行号以及批次起始行。 */
@Public
public final class RowLocation {

    private final int batchIndex;
    private final int batchRow;
    private final long batchStartRow;

    public RowLocation(int batchIndex, int batchRow, long batchStartRow) {
        this.batchIndex = batchIndex;
        this.batchRow = batchRow;
        this.batchStartRow = batchStartRow;
    }

    public int batchIndex() {
        return batchIndex;
    }

    public int batchRow() {
        return batchRow;
    }

    public long batchStartRow() {
        return batchStartRow;
    }

    /** 还原出的全局行号。 */
    public long rowId() {
        return batchStartRow + batchRow;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RowLocation that = (RowLocation) o;
        return batchIndex == that.batchIndex
                && batchRow == that.batchRow
                && batchStartRow == that.batchStartRow;
    }

    @Override
    public int hashCode() {
        return Objects.hash(batchIndex, batchRow, batchStartRow);
    }

    @Override
    public String toString() {
        return "RowLocation{batchIndex="
                + batchIndex
                + ", batchRow="
                + batchRow
                + ", batchStartRow="
                + batchStartRow
                + '}';
    }
}
