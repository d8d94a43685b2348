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

import java.io.Serializable;

/** 可写列向量的公共状态:空值标记、容量与已追加元素数。 */
public abstract class AbstractWritableVector implements WritableColumnVector, Serializable {

    private static final long serialVersionUID = 1L;

    /** 是否没有任何空值 */
    protected boolean noNulls = true;

    protected int elementsAppended;

    protected int capacity;

    public AbstractWritableVector(int capacity) {
        this.capacity = capacity;
    }

    @Override
    public int getElementsAppended() {
        return elementsAppended;
    }

    @Override
    public final void addElementsAppended(int num) {
        elementsAppended += num;
    }

    @Override
    public int getCapacity() {
        return this.capacity;
    }

    @Override
    public void reserve(int requiredCapacity) {
        if (requiredCapacity < 0) {
            throw new IllegalArgumentException(
                    "Invalid capacity " + requiredCapacity + ", the vector would overflow.");
        }
        if (requiredCapacity > capacity) {
            int newCapacity = (int) Math.min(Integer.MAX_VALUE - 8, requiredCapacity * 2L);
            reserveInternal(newCapacity);
            capacity = newCapacity;
        }
    }

    @Override
    public void reset() {
        // the capacity is kept, so a reused vector does not expand again
        noNulls = true;
        elementsAppended = 0;
    }

    /** 扩展底层存储到 {@code newCapacity}。 */
    protected abstract void reserveInternal(int newCapacity);
}
