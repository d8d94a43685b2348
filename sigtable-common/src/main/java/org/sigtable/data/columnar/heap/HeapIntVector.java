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

import org.sigtable.data.columnar.writable.WritableIntVector;

import java.util.Arrays;

/** 堆上整型列向量。 */
public class HeapIntVector extends AbstractHeapVector implements WritableIntVector {

    private static final long serialVersionUID = -2749499358889718254L;

    public int[] vector;

    public HeapIntVector(int len) {
        super(len);
        vector = new int[len];
    }

    @Override
    void reserveForHeapVector(int newCapacity) {
        if (vector.length < newCapacity) {
            vector = Arrays.copyOf(vector, newCapacity);
        }
    }

    @Override
    public int getInt(int i) {
        return vector[i];
    }

    @Override
    public void setInt(int i, int value) {
        vector[i] = value;
    }

    @Override
    public void appendInt(int v) {
        reserve(elementsAppended + 1);
        setInt(elementsAppended, v);
        elementsAppended++;
    }

    @Override
    public void reset() {
        super.reset();
        if (vector.length != capacity) {
            vector = new int[capacity];
        } else {
            Arrays.fill(vector, 0);
        }
    }
}
