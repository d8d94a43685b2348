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

package org.sigtable.codec;

import org.sigtable.exceptions.SignalCodecException;

/**
 * 16 位样本序列的差分 + ZigZag + Varints 编码。
 *
 * <p>相邻样本的差值通常很小,ZigZag 变换把有符号差值映射为无符号数,
 * 再用每字节 7 位的变长编码写出。一个 16 位样本的差值最多占 3 个字节。
 */
final class ZigZagDeltaVarints {

    /** 单个样本编码后的最大字节数 */
    static final int MAX_BYTES_PER_SAMPLE = 3;

    private ZigZagDeltaVarints() {}

    /**
     * 编码 {@code samples[offset, offset + length)} 到 {@code dst}。
     *
     * @return 写入的字节数
     */
    static int encode(short[] samples, int offset, int length, byte[] dst) {
        int position = 0;
        int previous = 0;
        for (int i = offset; i < offset + length; i++) {
            int delta = samples[i] - previous;
            previous = samples[i];

            int zigzag = (delta << 1) ^ (delta >> 31);
            while ((zigzag & ~0x7F) != 0) {
                dst[position++] = (byte) ((zigzag & 0x7F) | 0x80);
                zigzag >>>= 7;
            }
            dst[position++] = (byte) zigzag;
        }
        return position;
    }

    /**
     * 从 {@code src[srcOff, srcOff + srcLen)} 解码恰好 {@code count} 个样本。
     *
     * <p>样本先解码到临时数组,整段校验通过后才复制到 {@code out};失败时 {@code out}
     * 保持原样。
     *
     * @throws SignalCodecException 如果输入提前结束、存在多余字节或样本值溢出 16 位
     */
    static void decode(byte[] src, int srcOff, int srcLen, int count, short[] out, int outOff)
            throws SignalCodecException {
        short[] decoded = new short[count];
        decodeInto(src, srcOff, srcLen, decoded);
        System.arraycopy(decoded, 0, out, outOff, count);
    }

    private static void decodeInto(byte[] src, int srcOff, int srcLen, short[] out)
            throws SignalCodecException {
        int count = out.length;
        int position = srcOff;
        int end = srcOff + srcLen;
        int previous = 0;
        for (int i = 0; i < count; i++) {
            int result = 0;
            int shift = 0;
            while (true) {
                if (position >= end) {
                    throw new SignalCodecException(
                            String.format(
                                    "Unexpected end of signal data after %d of %d samples.",
                                    i, count));
                }
                int b = src[position++];
                result |= (b & 0x7F) << shift;
                if ((b & 0x80) == 0) {
                    break;
                }
                shift += 7;
                if (shift >= 7 * MAX_BYTES_PER_SAMPLE) {
                    throw new SignalCodecException("Varint overflow in signal data.");
                }
            }

            int delta = (result >>> 1) ^ -(result & 1);
            int value = previous + delta;
            if (value < Short.MIN_VALUE || value > Short.MAX_VALUE) {
                throw new SignalCodecException(
                        String.format("Decoded sample %d overflows 16 bits: %d.", i, value));
            }
            out[i] = (short) value;
            previous = value;
        }

        if (position != end) {
            throw new SignalCodecException(
                    String.format(
                            "Signal data holds more than the expected %d samples "
                                    + "(%d trailing bytes).",
                            count, end - position));
        }
    }
}
