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

package org.sigtable.compression;

/**
 * 缓冲区解压缩异常。
 *
 * <p>当数据块无法被解压缩时抛出,例如:
 * <ul>
 *   <li>压缩数据已损坏或被截断</li>
 *   <li>头部记录的长度非法</li>
 *   <li>目标缓冲区太小,无法容纳解压缩后的数据</li>
 * </ul>
 *
 * <p>信号解码器会将其包装为 {@link org.sigtable.exceptions.SignalCodecException}。
 */
public class BufferDecompressionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public BufferDecompressionException(String message) {
        super(message);
    }

    public BufferDecompressionException(String message, Throwable e) {
        super(message, e);
    }
}
