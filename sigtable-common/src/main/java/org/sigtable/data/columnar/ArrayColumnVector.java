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

/**
 * 数组列向量接口。
 *
 * <p>第 i 行的数组元素存放在子向量的 {@code [getOffset(i), getOffset(i) + getLength(i))} 区间,
 * 对应 Arrow 的 large list 布局。未压缩信号列的子向量是 {@link ShortColumnVector}。
 */
public interface ArrayColumnVector extends ColumnVector {

    /** 第 i 行数组在子向量中的起始位置。 */
    int getOffset(int i);

    /** 第 i 行数组的元素个数。 */
    int getLength(int i);

    /** 存放所有元素的子向量。 */
    ColumnVector getColumnVector();
}
