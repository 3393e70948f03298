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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RespValueTest {

    @Test
    public void test_simple_string_rejects_line_breaks() {
        assertThrows(IllegalArgumentException.class, () -> new RespValue.SimpleString("a\r\nb"));
        assertThrows(IllegalArgumentException.class, () -> new RespValue.Error("a\nb"));
        assertThrows(IllegalArgumentException.class, () -> new RespValue.SimpleString(null));
    }

    @Test
    public void test_bulk_string_value_equality() {
        assertEquals(new RespValue.BulkString(new byte[]{1, 2}), new RespValue.BulkString(new byte[]{1, 2}));
        assertEquals(RespValue.BulkString.NULL, new RespValue.BulkString(null));
        assertNotEquals(RespValue.BulkString.NULL, new RespValue.BulkString(new byte[0]));
        assertEquals(RespValue.BulkString.of("x").hashCode(), RespValue.BulkString.of("x").hashCode());
    }

    @Test
    public void test_array_is_immutable() {
        List<RespValue> items = new ArrayList<>();
        items.add(new RespValue.Integer(1));
        RespValue.Array array = new RespValue.Array(items);
        items.add(new RespValue.Integer(2));

        assertEquals(1, array.items().size());
        assertThrows(UnsupportedOperationException.class, () -> array.items().add(new RespValue.Integer(3)));
    }

    @Test
    public void test_null_array() {
        assertTrue(RespValue.Array.NULL.isNull());
        assertFalse(RespValue.Array.of().isNull());
        assertNotEquals(RespValue.Array.NULL, RespValue.Array.of());
    }

    @Test
    public void test_types() {
        assertEquals(RespType.SIMPLE_STRING, new RespValue.SimpleString("a").type());
        assertEquals(RespType.ERROR, new RespValue.Error("a").type());
        assertEquals(RespType.INTEGER, new RespValue.Integer(1).type());
        assertEquals(RespType.BULK_STRING, RespValue.BulkString.NULL.type());
        assertEquals(RespType.ARRAY, RespValue.Array.NULL.type());
        assertEquals(RespType.ARRAY, RespType.fromPrefix((byte) '*'));
        assertNull(RespType.fromPrefix((byte) '?'));
    }
}
