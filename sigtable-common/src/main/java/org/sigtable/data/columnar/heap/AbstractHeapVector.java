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

import org.sigtable.data.columnar.writable.AbstractWritableVector;

import java.util.Arrays;

/** 堆上列向量的基类,维护每行的空值标记。 */
public abstract class AbstractHeapVector extends AbstractWritableVector {

    private static final long serialVersionUID = 1L;

    /** 如果 {@code noNulls} 为 false,则 isNull[i] 为 true 表示第 i 行为空 */
    protected boolean[] isNull;

    public AbstractHeapVector(int capacity) {
        super(capacity);
        isNull = new boolean[capacity];
    }

    @Override
    public void reset() {
        super.reset();
        if (isNull.length != capacity) {
            isNull = new boolean[capacity];
        } else {
            Arrays.fill(isNull, false);
        }
    }

    @Override
    public void setNullAt(int i) {
        isNull[i] = true;
        noNulls = false;
    }

    @Override
    public boolean isNullAt(int i) {
        return !noNulls && isNull[i];
    }

    @Override
    protected void reserveInternal(int newCapacity) {
        if (isNull.length < newCapacity) {
            isNull = Arrays.copyOf(isNull, newCapacity);
        }
        reserveForHeapVector(newCapacity);
    }

    abstract void reserveForHeapVector(int newCapacity);
}
