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

package com.redlite.redis.storage;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The StringValue class represents a string value stored as a byte array.
 * Two values are equal when their bytes are equal.
 */
public final class StringValue {
    private final byte[] value;

    public StringValue(byte[] value) {
        this.value = checkNotNull(value, "value cannot be null");
    }

    /**
     * Retrieves the value of the StringValue object.
     *
     * @return the byte array representing the value
     */
    public byte[] getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StringValue other)) {
            return false;
        }
        return Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "StringValue{length=" + value.length + "}";
    }
}
