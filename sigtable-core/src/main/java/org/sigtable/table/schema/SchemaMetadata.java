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

package org.sigtable.table.schema;

import org.sigtable.annotation.Public;
import org.sigtable.exceptions.SignalTableOpenException;

import javax.annotation.Nullable;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * 表模式上附带的写入方元数据。
 *
 * <p>存储在模式元数据的三个键中:
 * <ul>
 *   <li>{@value #FILE_IDENTIFIER_KEY}: 文件标识(UUID 字符串)
 *   <li>{@value #SOFTWARE_KEY}: 写入软件名称
 *   <li>{@value #VERSION_KEY}: 写入时的格式版本,形如 {@code major.minor.revision}
 * </ul>
 */
@Public
public final class SchemaMetadata {

    public static final String FILE_IDENTIFIER_KEY = "MINKNOW:file_identifier";
    public static final String SOFTWARE_KEY = "MINKNOW:software";
    public static final String VERSION_KEY = "MINKNOW:pod5_version";

    private static final SchemaMetadata UNKNOWN =
            new SchemaMetadata(null, "unknown", new Version(0, 0, 0));

    @Nullable private final UUID fileIdentifier;

    private final String writingSoftware;

    private final Version writingVersion;

    public SchemaMetadata(
            @Nullable UUID fileIdentifier, String writingSoftware, Version writingVersion) {
        this.fileIdentifier = fileIdentifier;
        this.writingSoftware = writingSoftware;
        this.writingVersion = writingVersion;
    }

    /** 元数据缺失且不要求校验时使用的占位值。 */
    public static SchemaMetadata unknown() {
        return UNKNOWN;
    }

    /**
     * 从模式元数据解析。
     *
     * @throws SignalTableOpenException 如果缺少任一键或值格式错误
     */
    public static SchemaMetadata fromMap(Map<String, String> metadata)
            throws SignalTableOpenException {
        String fileIdentifier = require(metadata, FILE_IDENTIFIER_KEY);
        String software = require(metadata, SOFTWARE_KEY);
        String version = require(metadata, VERSION_KEY);

        UUID identifier;
        try {
            identifier = UUID.fromString(fileIdentifier);
        } catch (IllegalArgumentException e) {
            throw new SignalTableOpenException(
                    String.format(
                            "Schema metadata '%s' is not a valid UUID: '%s'.",
                            FILE_IDENTIFIER_KEY, fileIdentifier),
                    e);
        }
        return new SchemaMetadata(identifier, software, Version.parse(version));
    }

    private static String require(Map<String, String> metadata, String key) {
        String value = metadata.get(key);
        if (value == null || value.isEmpty()) {
            throw new SignalTableOpenException(
                    String.format("Schema metadata is missing required key '%s'.", key));
        }
        return value;
    }

    @Nullable
    public UUID fileIdentifier() {
        return fileIdentifier;
    }

    public String writingSoftware() {
        return writingSoftware;
    }

    public Version writingVersion() {
        return writingVersion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SchemaMetadata that = (SchemaMetadata) o;
        return Objects.equals(fileIdentifier, that.fileIdentifier)
                && writingSoftware.equals(that.writingSoftware)
                && writingVersion.equals(that.writingVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fileIdentifier, writingSoftware, writingVersion);
    }

    @Override
    public String toString() {
        return "SchemaMetadata{"
                + "fileIdentifier="
                + fileIdentifier
                + ", writingSoftware='"
                + writingSoftware
                + '\''
                + ", writingVersion="
                + writingVersion
                + '}';
    }

    /** 三段式版本号。 */
    public static final class Version implements Comparable<Version> {

        private final int major;
        private final int minor;
        private final int revision;

        public Version(int major, int minor, int revision) {
            this.major = major;
            this.minor = minor;
            this.revision = revision;
        }

        /**
         * 解析 {@code major.minor.revision} 形式的版本号。
         *
         * @throws SignalTableOpenException 如果格式错误
         */
        public static Version parse(String text) throws SignalTableOpenException {
            String[] parts = text.trim().split("\\.");
            if (parts.length != 3) {
                throw new SignalTableOpenException(
                        String.format("Invalid version '%s', expected major.minor.revision.", text));
            }
            try {
                int major = Integer.parseInt(parts[0]);
                int minor = Integer.parseInt(parts[1]);
                int revision = Integer.parseInt(parts[2]);
                if (major < 0 || minor < 0 || revision < 0) {
                    throw new SignalTableOpenException(
                            String.format("Invalid version '%s', components are negative.", text));
                }
                return new Version(major, minor, revision);
            } catch (NumberFormatException e) {
                throw new SignalTableOpenException(
                        String.format("Invalid version '%s', expected major.minor.revision.", text),
                        e);
            }
        }

        public int major() {
            return major;
        }

        public int minor() {
            return minor;
        }

        public int revision() {
            return revision;
        }

        @Override
        public int compareTo(Version o) {
            if (major != o.major) {
                return Integer.compare(major, o.major);
            }
            if (minor != o.minor) {
                return Integer.compare(minor, o.minor);
            }
            return Integer.compare(revision, o.revision);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            Version version = (Version) o;
            return major == version.major && minor == version.minor && revision == version.revision;
        }

        @Override
        public int hashCode() {
            return Objects.hash(major, minor, revision);
        }

        @Override
        public String toString() {
            return major + "." + minor + "." + revision;
        }
    }
}
