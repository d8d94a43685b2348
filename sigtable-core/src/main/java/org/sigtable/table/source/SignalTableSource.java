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

package org.sigtable.table.source;

import org.sigtable.annotation.Public;
import org.sigtable.data.columnar.VectorizedColumnBatch;
import org.sigtable.table.schema.SignalTableSchema;

import java.io.Closeable;
import java.io.IOException;

/**
 * 存储引擎一侧的信号表数据源。
 *
 * <p>数据源负责打开物理文件、解析其布局并把每个批次物化为 {@link VectorizedColumnBatch};
 * 读取路径只在打开时调用一次 {@link #schema()} 与 {@link #readBatch(int)},
 * 之后不再访问数据源,直到 {@link #close()}。
 */
@Public
public interface SignalTableSource extends Closeable {

    /** 表模式,包含字段列表与模式元数据。 */
    SignalTableSchema schema() throws IOException;

    /** 批次数。 */
    int batchCount() throws IOException;

    /**
     * 物化第 i 个批次。
     *
     * @param i 批次下标,从 0 开始
     * @throws IOException 如果无法读取该批次
     */
    VectorizedColumnBatch readBatch(int i) throws IOException;
}
