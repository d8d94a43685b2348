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

import org.sigtable.annotation.Public;

import static org.sigtable.utils.Preconditions.checkNotNull;

/**
 * {@link ConfigOption} 的构建入口。
 *
 * <pre>{@code
 * ConfigOption<Integer> level =
 *         ConfigOptions.key("signal.codec.zstd-level")
 *                 .intType()
 *                 .defaultValue(1)
 *                 .withDescription("Zstandard level used when compressing signal.");
 * }</pre>
 */
@Public
public class ConfigOptions {

    public static OptionBuilder key(String key) {
        checkNotNull(key);
        return new OptionBuilder(key);
    }

    // ------------------------------------------------------------------------

    /** 选择配置值类型的构建器。 */
    public static final class OptionBuilder {

        private final String key;

        OptionBuilder(String key) {
            this.key = key;
        }

        public TypedConfigOptionBuilder<Boolean> booleanType() {
            return new TypedConfigOptionBuilder<>(key, Boolean.class);
        }

        public TypedConfigOptionBuilder<Integer> intType() {
            return new TypedConfigOptionBuilder<>(key, Integer.class);
        }


        public TypedConfigOptionBuilder<String> stringType() {
            return new TypedConfigOptionBuilder<>(key, String.class);
        }

        public <T extends Enum<T>> TypedConfigOptionBuilder<T> enumType(Class<T> enumClass) {
            return new TypedConfigOptionBuilder<>(key, enumClass);
        }
    }

    /** 设置默认值的构建器。 */
    public static class TypedConfigOptionBuilder<T> {
        private final String key;
        private final Class<T> clazz;

        TypedConfigOptionBuilder(String key, Class<T> clazz) {
            this.key = key;
            this.clazz = clazz;
        }

        public ConfigOption<T> defaultValue(T value) {
            return new ConfigOption<>(key, clazz, "", value);
        }

        public ConfigOption<T> noDefaultValue() {
            return new ConfigOption<>(key, clazz, "", null);
        }
    }

    // ------------------------------------------------------------------------

    private ConfigOptions() {}
}
