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

import org.sigtable.data.columnar.writable.WritableUuidVector;

import java.util.Arrays;
import java.util.UUID;

/** 堆上 128 位标识列向量,高低 64 位分别存放在两个 long 数组中。 */
public class HeapUuidVector extends AbstractHeapVector implements WritableUuidVector {

    private static final long serialVersionUID = 1L;

    public long[] mostSignificantBits;

    public long[] leastSignificantBits;

    public HeapUuidVector(int len) {
        super(len);
        mostSignificantBits = new long[len];
        leastSignificantBits = new long[len];
    }

    @Override
    void reserveForHeapVector(int newCapacity) {
        if (mostSignificantBits.length < newCapacity) {
            mostSignificantBits = Arrays.copyOf(mostSignificantBits, newCapacity);
            leastSignificantBits = Arrays.copyOf(leastSignificantBits, newCapacity);
        }
    }

    @Override
    public UUID getUuid(int i) {
        return new UUID(mostSignificantBits[i], leastSignificantBits[i]);
    }

    @Override
    public void setUuid(int i, UUID value) {
        mostSignificantBits[i] = value.getMostSignificantBits();
        leastSignificantBits[i] = value.getLeastSignificantBits();
    }

    @Override
    public void appendUuid(UUID value) {
        reserve(elementsAppended + 1);
        setUuid(elementsAppended, value);
        elementsAppended++;
    }

    @Override
    public void reset() {
        super.reset();
        if (mostSignificantBits.length != capacity) {
            mostSignificantBits = new long[capacity];
            leastSignificantBits = new long[capacity];
        } else {
            Arrays.fill(mostSignificantBits, 0L);
            Arrays.fill(leastSignificantBits, 0L);
        }
    }
}
