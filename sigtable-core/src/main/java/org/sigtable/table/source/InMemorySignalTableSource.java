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

import org.sigtable.data.columnar.VectorizedColumnBatch;
import org.sigtable.table.schema.SignalTableSchema;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.sigtable.utils.Preconditions.checkNotNull;

/** 由已物化的堆上批次组成的数据源。 */
public class InMemorySignalTableSource implements SignalTableSource {

    private final SignalTableSchema schema;

    private final List<VectorizedColumnBatch> batches;

    private volatile boolean closed;

    public InMemorySignalTableSource(
            SignalTableSchema schema, List<VectorizedColumnBatch> batches) {
        this.schema = checkNotNull(schema);
        this.batches = Collections.unmodifiableList(new ArrayList<>(batches));
    }

    @Override
    public SignalTableSchema schema() throws IOException {
        ensureOpen();
        return schema;
    }

    @Override
    public int batchCount() throws IOException {
        ensureOpen();
        return batches.size();
    }

    @Override
    public VectorizedColumnBatch readBatch(int i) throws IOException {
        ensureOpen();
        if (i < 0 || i >= batches.size()) {
            throw new IOException(
                    String.format("Batch %d does not exist, source has %d.", i, batches.size()));
        }
        return batches.get(i);
    }

    public boolean isClosed() {
        return closed;
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("Signal table source is already closed.");
        }
    }

    @Override
    public void close() {
        closed = true;
    }
}
