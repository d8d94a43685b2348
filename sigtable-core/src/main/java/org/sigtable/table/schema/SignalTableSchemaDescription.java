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

import org.sigtable.exceptions.SignalTableOpenException;

import static org.sigtable.table.schema.SignalTableSchema.READ_ID_FIELD;
import static org.sigtable.table.schema.SignalTableSchema.SAMPLES_FIELD;
import static org.sigtable.table.schema.SignalTableSchema.SIGNAL_FIELD;

/**
 * 信号表的字段位置描述。
 *
 * <p>由 {@link #of(SignalTableSchema)} 在打开表时解析一次:定位 read_id、signal、samples
 * 三个必需列,并根据 signal 列的类型确定整张表的 {@link SignalType}。
 */
public final class SignalTableSchemaDescription {

    private final SignalType signalType;

    private final int readIdIndex;

    private final int signalIndex;

    private final int samplesIndex;

    public SignalTableSchemaDescription(
            SignalType signalType, int readIdIndex, int signalIndex, int samplesIndex) {
        this.signalType = signalType;
        this.readIdIndex = readIdIndex;
        this.signalIndex = signalIndex;
        this.samplesIndex = samplesIndex;
    }

    /**
     * 从表模式解析字段位置。
     *
     * @throws SignalTableOpenException 如果缺少必需列或列类型不符
     */
    public static SignalTableSchemaDescription of(SignalTableSchema schema)
            throws SignalTableOpenException {
        int readIdIndex = findField(schema, READ_ID_FIELD);
        checkType(schema, readIdIndex, ColumnType.UUID);

        int samplesIndex = findField(schema, SAMPLES_FIELD);
        checkType(schema, samplesIndex, ColumnType.UINT32);

        int signalIndex = findField(schema, SIGNAL_FIELD);
        ColumnType signalColumnType = schema.fields().get(signalIndex).type();
        SignalType signalType;
        switch (signalColumnType) {
            case VBZ_SIGNAL:
                signalType = SignalType.VBZ_SIGNAL;
                break;
            case INT16_LIST:
                signalType = SignalType.UNCOMPRESSED_SIGNAL;
                break;
            default:
                throw new SignalTableOpenException(
                        String.format(
                                "Schema field '%s' has unsupported type %s, expected %s or %s.",
                                SIGNAL_FIELD,
                                signalColumnType,
                                ColumnType.VBZ_SIGNAL,
                                ColumnType.INT16_LIST));
        }

        return new SignalTableSchemaDescription(
                signalType, readIdIndex, signalIndex, samplesIndex);
    }

    private static int findField(SignalTableSchema schema, String name) {
        int index = schema.getFieldIndex(name);
        if (index < 0) {
            throw new SignalTableOpenException(
                    String.format(
                            "Schema is missing required field '%s', fields are %s.",
                            name, schema.fields()));
        }
        return index;
    }

    private static void checkType(SignalTableSchema schema, int index, ColumnType expected) {
        DataField field = schema.fields().get(index);
        if (field.type() != expected) {
            throw new SignalTableOpenException(
                    String.format(
                            "Schema field '%s' has type %s, expected %s.",
                            field.name(), field.type(), expected));
        }
    }

    public SignalType signalType() {
        return signalType;
    }

    public int readIdIndex() {
        return readIdIndex;
    }

    public int signalIndex() {
        return signalIndex;
    }

    public int samplesIndex() {
        return samplesIndex;
    }

    @Override
    public String toString() {
        return "SignalTableSchemaDescription{"
                + "signalType="
                + signalType
                + ", readIdIndex="
                + readIdIndex
                + ", signalIndex="
                + signalIndex
                + ", samplesIndex="
                + samplesIndex
                + '}';
    }
}
