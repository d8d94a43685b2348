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
 * 列向量的基础接口,表示一列可为空的数据。
 *
 * <p>列向量是存储引擎交给读取路径的列访问器:一个批次的每一列以一个列向量表示,
 * 读取路径只通过类型特定的子接口按行号读取数据,不关心数据如何物化。
 *
 * <h2>信号表使用的列向量</h2>
 * <ul>
 *   <li>{@link UuidColumnVector}: 读取标识(128 位)
 *   <li>{@link IntColumnVector}: 样本数(按无符号 32 位解释)
 *   <li>{@link BytesColumnVector}: 压缩后的信号字节块
 *   <li>{@link ArrayColumnVector}: 未压缩的信号样本列表,子向量为 {@link ShortColumnVector}
 * </ul>
 */
public interface ColumnVector {

    /**
     * 检查指定位置的值是否为 NULL。
     *
     * @param i 行索引(从0开始)
     */
    boolean isNullAt(int i);

    /** 获取此列向量的容量(最大行数),默认不受限制。 */
    default int getCapacity() {
        return Integer.MAX_VALUE;
    }
}
