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
 * 从存储源构建读取器失败时抛出。
 *
 * <p>包括存储源读取失败(原始的 {@link java.io.IOException} 作为 cause 保留)、
 * 缺少必需的列、列类型不符以及模式元数据缺失或格式错误。
 */
@Public
public class SignalTableOpenException extends SignalTableException {

    private static final long serialVersionUID = 1L;

    public SignalTableOpenException(String message) {
        super(message);
    }

    public SignalTableOpenException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.OPEN_ERROR;
    }
}
