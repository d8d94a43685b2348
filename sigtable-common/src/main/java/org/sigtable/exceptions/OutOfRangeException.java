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

package org.sigtable.exceptions;

import org.sigtable.annotation.Public;

/** 行号、批次号或批内行号超出有效范围时抛出。 */
@Public
public class OutOfRangeException extends SignalTableException {

    private static final long serialVersionUID = 1L;

    public OutOfRangeException(String message) {
        super(message);
    }

    public static OutOfRangeException forRow(long rowId, long rowCount) {
        return new OutOfRangeException(
                String.format("Row %d is out of range, the table has %d rows.", rowId, rowCount));
    }

    public static OutOfRangeException forBatchRow(int batchRow, int batchRowCount) {
        return new OutOfRangeException(
                String.format(
                        "Batch row %d is out of range, the batch has %d rows.",
                        batchRow, batchRowCount));
    }

    public static OutOfRangeException forBatch(int batchIndex, int batchCount) {
        return new OutOfRangeException(
                String.format(
                        "Batch %d is out of range, the table has %d batches.",
                        batchIndex, batchCount));
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.OUT_OF_RANGE;
    }
}
