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

package org.sigtable.table.schema;

/**
 * 存储引擎暴露的列类型。
 *
 * <p>只列出信号表读取路径关心的物理类型,其余列统一视为 {@link #OTHER}。
 */
public enum ColumnType {
    /** 128 位标识,Arrow 中为 fixed_size_binary(16) 扩展类型 */
    UUID,
    /** 无符号 32 位整数 */
    UINT32,
    /** 16 位有符号整数的 large list,即未压缩信号 */
    INT16_LIST,
    /** large binary,存放压缩后的信号 */
    VBZ_SIGNAL,
    /** 其他类型 */
    OTHER
}
