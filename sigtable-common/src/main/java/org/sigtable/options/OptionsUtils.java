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

package org.sigtable.options;

import java.util.Arrays;
import java.util.Locale;

/**
 * 配置值与字符串之间的转换。
 *
 * <p>{@link Options} 内部只保存字符串,读取时按 {@link ConfigOption} 声明的类型解析,
 * 解析前会去掉首尾空白。布尔值和枚举值不区分大小写。
 */
public class OptionsUtils {

    @SuppressWarnings("unchecked")
    public static <T> T convertValue(String rawValue, Class<?> clazz) {
        String value = rawValue.trim();
        if (clazz == String.class) {
            return (T) rawValue;
        }
        if (clazz == Integer.class) {
            return (T) Integer.valueOf(value);
        }
        if (clazz == Boolean.class) {
            return (T) parseBoolean(value);
        }
        if (clazz.isEnum()) {
            return (T) parseEnum(value, clazz);
        }
        throw new IllegalArgumentException("Unsupported option type: " + clazz.getName());
    }

    static String convertToString(Object value) {
        return value instanceof Enum ? ((Enum<?>) value).name() : value.toString();
    }

    private static Boolean parseBoolean(String value) {
        if ("true".equalsIgnoreCase(value)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(value)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException(
                String.format("'%s' is not a boolean, expected true or false.", value));
    }

    private static Enum<?> parseEnum(String value, Class<?> enumClass) {
        String upper = value.toUpperCase(Locale.ROOT);
        for (Object constant : enumClass.getEnumConstants()) {
            Enum<?> e = (Enum<?>) constant;
            if (e.name().equals(upper)) {
                return e;
            }
        }
        throw new IllegalArgumentException(
                String.format(
                        "'%s' is not one of %s.",
                        value, Arrays.toString(enumClass.getEnumConstants())));
    }

    private OptionsUtils() {}
}
