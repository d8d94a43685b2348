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

/**
 * 调用方提供的输出缓冲区长度与所需样本数不一致时抛出。
 *
 * <p>该异常总是在写入缓冲区之前抛出,缓冲区内容保持调用前的状态。
 */
@Public
public class SizeMismatchException extends SignalTableException {

    private static final long serialVersionUID = 1L;

    private final long expected;
    private final long actual;

    public SizeMismatchException(long expected, long actual) {
        super(
                String.format(
                        "Output buffer holds %d samples but %d samples are required.",
                        actual, expected));
        this.expected = expected;
        this.actual = actual;
    }

    /** 需要的样本数。 */
    public long expected() {
        return expected;
    }

    /** 调用方缓冲区的实际长度。 */
    public long actual() {
        return actual;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SIZE_MISMATCH;
    }
}
