/*
 * Copyright (c) 2023-2025 Burak Sezer
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.redlite.server.resp;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * Represents a RESP2 protocol value.
 */
public sealed interface RespValue permits
        RespValue.SimpleString,
        RespValue.Error,
        RespValue.Integer,
        RespValue.BulkString,
        RespValue.Array {

    RespType type();

    private static void checkLine(String value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (value.indexOf('\r') >= 0 || value.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("value cannot contain CR or LF");
        }
    }

    /**
     * Returns true if the given text can be sent as a simple string or an error.
     */
    static boolean isLine(String value) {
        return value != null && value.indexOf('\r') < 0 && value.indexOf('\n') < 0;
    }

    record SimpleString(String value) implements RespValue {
        public SimpleString {
            checkLine(value);
        }

        @Override
        public RespType type() {
            return RespType.SIMPLE_STRING;
        }
    }

    record Error(String value) implements RespValue {
        public Error {
            checkLine(value);
        }

        @Override
        public RespType type() {
            return RespType.ERROR;
        }
    }

    record Integer(long value) implements RespValue {
        @Override
        public RespType type() {
            return RespType.INTEGER;
        }
    }

    /**
     * Binary-safe string. A {@code null} content is the RESP null bulk string.
     */
    record BulkString(byte[] content) implements RespValue {
        public static final BulkString NULL = new BulkString(null);

        public static BulkString of(String value) {
            return new BulkString(value.getBytes(StandardCharsets.UTF_8));
        }

        public boolean isNull() {
            return content == null;
        }

        public String asString() {
            return content == null ? null : new String(content, StandardCharsets.UTF_8);
        }

        @Override
        public RespType type() {
            return RespType.BULK_STRING;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BulkString other)) return false;
            return Arrays.equals(content, other.content);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(content);
        }

        @Override
        public String toString() {
            return content == null ? "BulkString[null]" : "BulkString[" + asString() + "]";
        }
    }

    /**
     * Ordered sequence of values. A {@code null} item list is the RESP null array.
     */
    record Array(List<RespValue> items) implements RespValue {
        public static final Array NULL = new Array(null);

        public Array {
            if (items != null) {
                items = List.copyOf(items);
            }
        }

        public static Array of(RespValue... items) {
            return new Array(List.of(items));
        }

        public boolean isNull() {
            return items == null;
        }

        @Override
        public RespType type() {
            return RespType.ARRAY;
        }
    }
}
