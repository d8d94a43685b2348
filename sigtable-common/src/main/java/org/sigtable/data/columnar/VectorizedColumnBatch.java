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

package org.sigtable.data.columnar;

import org.sigtable.data.columnar.BytesColumnVector.Bytes;

import java.io.Serializable;
import java.util.UUID;

/**
 * 向量化列批次,存储引擎物化出的一个物理批次(行组)。
 *
 * <p>批次由一组等长的列向量组成,列的顺序与表模式中字段的顺序一致。
 * 行数通过 {@link #setNumRows(int)} 设置,读取方只访问 {@code [0, numRows)} 范围内的行。
 *
 * <p>批次在交给读取路径之后视为不可变。
 */
public class VectorizedColumnBatch implements Serializable {

    private static final long serialVersionUID = 8180323238728166155L;

    /** 批次中的行数 */
    private int numRows;

    /** 列向量数组,下标即字段位置 */
    public final ColumnVector[] columns;

    public VectorizedColumnBatch(ColumnVector[] vectors) {
        this.columns = vectors;
    }

    public void setNumRows(int numRows) {
        this.numRows = numRows;
    }

    public int getNumRows() {
        return numRows;
    }

    /** 列数。 */
    public int getArity() {
        return columns.length;
    }

    public ColumnVector column(int colId) {
        return columns[colId];
    }

    public boolean isNullAt(int rowId, int colId) {
        return columns[colId].isNullAt(rowId);
    }

    public short getShort(int rowId, int colId) {
        return ((ShortColumnVector) columns[colId]).getShort(rowId);
    }

    public int getInt(int rowId, int colId) {
        return ((IntColumnVector) columns[colId]).getInt(rowId);
    }

    public UUID getUuid(int rowId, int colId) {
        return ((UuidColumnVector) columns[colId]).getUuid(rowId);
    }

    public Bytes getByteArray(int rowId, int colId) {
        return ((BytesColumnVector) columns[colId]).getBytes(rowId);
    }

    public byte[] getBinary(int rowId, int colId) {
        return getByteArray(rowId, colId).getBytes();
    }
}
