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

import org.sigtable.data.columnar.writable.WritableBytesVector;

import java.util.Arrays;

/**
 * 堆上字节数组列向量。
 *
 * <p>所有行的字节连续存放在 {@link #buffer} 中,{@link #start} 与 {@link #length}
 * 记录每行的位置。
 */
public class HeapBytesVector extends AbstractHeapVector implements WritableBytesVector {

    private static final long serialVersionUID = -8529155738773478597L;

    /** 每行在 buffer 中的起始位置 */
    public int[] start;

    /** 每行的字节长度 */
    public int[] length;

    /** 存放所有行数据的缓冲区 */
    public byte[] buffer;

    /** buffer 中已使用的字节数 */
    private int bytesAppended;

    public HeapBytesVector(int capacity) {
        super(capacity);
        buffer = new byte[capacity * 16];
        start = new int[capacity];
        length = new int[capacity];
    }

    @Override
    public void reset() {
        super.reset();
        if (start.length != capacity) {
            start = new int[capacity];
        } else {
            Arrays.fill(start, 0);
        }

        if (length.length != capacity) {
            length = new int[capacity];
        } else {
            Arrays.fill(length, 0);
        }

        // the buffer itself is kept to avoid reallocating it
        this.bytesAppended = 0;
    }

    @Override
    public void putByteArray(int elementNum, byte[] sourceBuf, int start, int length) {
        reserveBytes(bytesAppended + length);
        System.arraycopy(sourceBuf, start, buffer, bytesAppended, length);
        this.start[elementNum] = bytesAppended;
        this.length[elementNum] = length;
        bytesAppended += length;
    }

    @Override
    public void appendByteArray(byte[] value, int offset, int length) {
        reserve(elementsAppended + 1);
        putByteArray(elementsAppended, value, offset, length);
        elementsAppended++;
    }

    private void reserveBytes(int newCapacity) {
        if (newCapacity > buffer.length) {
            int newBytesCapacity = newCapacity * 2;
            try {
                buffer = Arrays.copyOf(buffer, newBytesCapacity);
            } catch (NegativeArraySizeException e) {
                throw new RuntimeException(
                        String.format(
                                "The new claimed capacity %s is too large, will overflow the "
                                        + "INTEGER.MAX after multiply by 2.",
                                newCapacity),
                        e);
            }
        }
    }

    @Override
    void reserveForHeapVector(int newCapacity) {
        if (start.length < newCapacity) {
            start = Arrays.copyOf(start, newCapacity);
            length = Arrays.copyOf(length, newCapacity);
        }
    }

    @Override
    public Bytes getBytes(int i) {
        return new Bytes(buffer, start[i], length[i]);
    }
}
