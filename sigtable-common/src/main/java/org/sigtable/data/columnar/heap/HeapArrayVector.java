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

package org.sigtable.data.columnar.heap;

import org.sigtable.data.columnar.ArrayColumnVector;
import org.sigtable.data.columnar.ColumnVector;
import org.sigtable.data.columnar.writable.WritableColumnVector;

import java.util.Arrays;

/**
 * 堆上数组列向量。
 *
 * <p>每行记录其元素在子向量中的偏移和长度,元素本身由子向量存储。
 * 追加一行时,调用方先把元素写入子向量,再调用 {@link #appendArray(int)} 记录长度。
 */
public class HeapArrayVector extends AbstractHeapVector implements ArrayColumnVector {

    private static final long serialVersionUID = 1L;

    public int[] offsets;

    public int[] lengths;

    private final WritableColumnVector child;

    public HeapArrayVector(int len, WritableColumnVector child) {
        super(len);
        this.offsets = new int[len];
        this.lengths = new int[len];
        this.child = child;
    }

    /**
     * 追加一行,其元素为子向量中最近追加的 {@code length} 个元素。
     *
     * @param length 该行数组的元素个数
     */
    public void appendArray(int length) {
        reserve(elementsAppended + 1);
        offsets[elementsAppended] = child.getElementsAppended() - length;
        lengths[elementsAppended] = length;
        elementsAppended++;
    }

    @Override
    void reserveForHeapVector(int newCapacity) {
        if (offsets.length < newCapacity) {
            offsets = Arrays.copyOf(offsets, newCapacity);
            lengths = Arrays.copyOf(lengths, newCapacity);
        }
    }

    @Override
    public int getOffset(int i) {
        return offsets[i];
    }

    @Override
    public int getLength(int i) {
        return lengths[i];
    }

    @Override
    public ColumnVector getColumnVector() {
        return child;
    }

    @Override
    public void reset() {
        super.reset();
        child.reset();
        if (offsets.length != capacity) {
            offsets = new int[capacity];
            lengths = new int[capacity];
        } else {
            Arrays.fill(offsets, 0);
            Arrays.fill(lengths, 0);
        }
    }
}
