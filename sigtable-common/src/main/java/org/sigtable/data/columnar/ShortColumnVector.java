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

/** 短整型列向量接口,信号样本即为 16 位有符号整数。 */
public interface ShortColumnVector extends ColumnVector {

    short getShort(int i);

    /**
     * 将 {@code [from, from + length)} 的值复制到 {@code dst[dstOff, ...)}。
     *
     * <p>默认实现逐个读取,堆上实现会覆盖为整块复制。
     */
    default void copyTo(int from, short[] dst, int dstOff, int length) {
        for (int i = 0; i < length; i++) {
            dst[dstOff + i] = getShort(from + i);
        }
    }
}
