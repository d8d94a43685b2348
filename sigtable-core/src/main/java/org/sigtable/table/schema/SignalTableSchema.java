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

import org.sigtable.annotation.Public;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.sigtable.utils.Preconditions.checkNotNull;

/**
 * 存储引擎报告的表模式:有序字段列表加上字符串形式的模式元数据。
 *
 * <p>字段顺序与 {@link org.sigtable.data.columnar.VectorizedColumnBatch#columns} 中
 * 列向量的顺序一致。
 */
@Public
public final class SignalTableSchema implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String READ_ID_FIELD = "read_id";
    public static final String SIGNAL_FIELD = "signal";
    public static final String SAMPLES_FIELD = "samples";

    private final List<DataField> fields;

    private final Map<String, String> metadata;

    public SignalTableSchema(List<DataField> fields, Map<String, String> metadata) {
        this.fields = Collections.unmodifiableList(new ArrayList<>(checkNotNull(fields)));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(checkNotNull(metadata)));
    }

    public List<DataField> fields() {
        return fields;
    }

    public Map<String, String> metadata() {
        return metadata;
    }

    /**
     * 按名称查找字段位置。
     *
     * @return 字段下标,不存在时返回 -1
     */
    public int getFieldIndex(String fieldName) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).name().equals(fieldName)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return "SignalTableSchema{fields=" + fields + ", metadata=" + metadata + '}';
    }
}
