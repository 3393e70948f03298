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

/**
 * RESP2 data types, identified by the first byte of their encoding.
 */
public enum RespType {
    SIMPLE_STRING('+'),
    ERROR('-'),
    INTEGER(':'),
    BULK_STRING('$'),
    ARRAY('*');

    private final byte prefix;

    RespType(char prefix) {
        this.prefix = (byte) prefix;
    }

    public byte getPrefix() {
        return prefix;
    }

    /**
     * Resolves the type identified by the given type tag.
     *
     * @param prefix the first byte of an encoded value
     * @return the matching type, or {@code null} if the byte is not a RESP2 type tag
     */
    public static RespType fromPrefix(byte prefix) {
        for (RespType type : values()) {
            if (type.prefix == prefix) {
                return type;
            }
        }
        return null;
    }
}
