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
 * 信号表读取路径上所有可区分错误的基类。
 *
 * <p>每个子类对应一种 {@link ErrorKind},调用方既可以按异常类型捕获,也可以通过
 * {@link #kind()} 统一分派。所有错误对产生它的调用都是终止性的:本层不做任何重试,
 * 也不会把错误降级为默认值。
 *
 * <p>错误语义:
 * <ul>
 *   <li>{@link ErrorKind#OUT_OF_RANGE}: 行号或批次号超出范围
 *   <li>{@link ErrorKind#SIZE_MISMATCH}: 调用方缓冲区大小与所需样本数不一致
 *   <li>{@link ErrorKind#CODEC_ERROR}: 压缩信号被解码器拒绝或解码长度不符
 *   <li>{@link ErrorKind#OPEN_ERROR}: 从存储源构建读取器时失败
 * </ul>
 */
@Public
public abstract class SignalTableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected SignalTableException(String message) {
        super(message);
    }

    protected SignalTableException(String message, Throwable cause) {
        super(message, cause);
    }

    /** 错误类别。 */
    public abstract ErrorKind kind();

    /** 读取路径上的错误类别。 */
    public enum ErrorKind {
        OUT_OF_RANGE,
        SIZE_MISMATCH,
        CODEC_ERROR,
        OPEN_ERROR
    }
}
