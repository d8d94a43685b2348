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
 * 压缩信号无法被解码时抛出。
 *
 * <p>常见场景:
 * <ul>
 *   <li>压缩数据已损坏或被截断
 *   <li>块压缩头部记录的长度非法
 *   <li>解码得到的样本数与行上记录的样本数不一致
 * </ul>
 */
@Public
public class SignalCodecException extends SignalTableException {

    private static final long serialVersionUID = 1L;

    public SignalCodecException(String message) {
        super(message);
    }

    public SignalCodecException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CODEC_ERROR;
    }
}
