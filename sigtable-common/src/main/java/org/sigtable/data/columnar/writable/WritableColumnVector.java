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

package org.sigtable.data.columnar.writable;

import org.sigtable.data.columnar.ColumnVector;

/**
 * 可写列向量接口。
 *
 * <p>存储引擎在物化批次时通过该接口填充列向量,读取路径只使用只读的 {@link ColumnVector} 视图。
 */
public interface WritableColumnVector extends ColumnVector {

    /** 重置列向量,以便复用。 */
    void reset();

    void setNullAt(int rowId);

    default void appendNull() {
        int elementsAppended = getElementsAppended();
        reserve(elementsAppended + 1);
        setNullAt(elementsAppended);
        addElementsAppended(1);
    }

    /** 确保容量至少为 {@code capacity}。 */
    void reserve(int capacity);

    /** 已追加的元素个数。 */
    int getElementsAppended();

    void addElementsAppended(int num);
}
