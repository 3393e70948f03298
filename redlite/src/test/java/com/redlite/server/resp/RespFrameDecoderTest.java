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

import com.redlite.BaseTest;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class RespFrameDecoderTest extends BaseTest {

    private EmbeddedChannel newChannel() {
        return new EmbeddedChannel(new RespFrameDecoder(new RespCodec()));
    }

    @Test
    public void test_one_value() {
        EmbeddedChannel channel = newChannel();
        assertTrue(channel.writeInbound(resp("*1\r\n$4\r\nPING\r\n")));

        RespValue value = channel.readInbound();
        assertEquals(RespValue.Array.of(RespValue.BulkString.of("PING")), value);
        assertNull(channel.readInbound());
        assertFalse(channel.finish());
    }

    @Test
    public void test_pipelined_values_in_one_read() {
        EmbeddedChannel channel = newChannel();
        channel.writeInbound(resp("*1\r\n$4\r\nPING\r\n*2\r\n$3\r\nGET\r\n$1\r\na\r\n"));

        assertEquals(RespValue.Array.of(RespValue.BulkString.of("PING")), channel.readInbound());
        assertEquals(RespValue.Array.of(RespValue.BulkString.of("GET"), RespValue.BulkString.of("a")), channel.readInbound());
        assertNull(channel.readInbound());
        channel.finishAndReleaseAll();
    }

    @Test
    public void test_value_split_across_reads() {
        String request = "*3\r\n$3\r\nSET\r\n$3\r\nfoo\r\n$3\r\nbar\r\n";
        for (int chunk = 1; chunk <= request.length(); chunk++) {
            EmbeddedChannel channel = newChannel();
            for (int i = 0; i < request.length(); i += chunk) {
                channel.writeInbound(resp(request.substring(i, Math.min(request.length(), i + chunk))));
            }
            RespValue expected = RespValue.Array.of(
                    RespValue.BulkString.of("SET"),
                    RespValue.BulkString.of("foo"),
                    RespValue.BulkString.of("bar")
            );
            assertEquals(expected, channel.readInbound(), "chunk size " + chunk);
            assertNull(channel.readInbound());
            channel.finishAndReleaseAll();
        }
    }

    @Test
    public void test_malformed_input_replies_and_closes() {
        EmbeddedChannel channel = newChannel();
        channel.writeInbound(resp(":abc\r\n"));

        RespValue reply = channel.readOutbound();
        assertInstanceOf(RespValue.Error.class, reply);
        assertTrue(((RespValue.Error) reply).value().startsWith("ERR Protocol error: MalformedInteger"));
        assertFalse(channel.isOpen());
        assertNull(channel.readInbound());
    }

    @Test
    public void test_values_before_malformed_input_are_emitted() {
        EmbeddedChannel channel = newChannel();
        channel.writeInbound(resp("*1\r\n$4\r\nPING\r\n?garbage\r\n"));

        assertEquals(RespValue.Array.of(RespValue.BulkString.of("PING")), channel.readInbound());
        RespValue reply = channel.readOutbound();
        assertEquals("ERR Protocol error: InvalidTypeTag unexpected type tag '?'", ((RespValue.Error) reply).value());
        assertFalse(channel.isOpen());
    }

    @Test
    public void test_nested_arrays_split_byte_by_byte() {
        String request = "*2\r\n*2\r\n:1\r\n$-1\r\n$3\r\nabc\r\n";
        EmbeddedChannel channel = newChannel();
        for (int i = 0; i < request.length(); i++) {
            channel.writeInbound(resp(request.substring(i, i + 1)));
        }
        RespValue expected = RespValue.Array.of(
                RespValue.Array.of(new RespValue.Integer(1), RespValue.BulkString.NULL),
                RespValue.BulkString.of("abc")
        );
        assertEquals(expected, channel.readInbound());
        assertNull(channel.readInbound());
        channel.finishAndReleaseAll();
    }

    @Test
    public void test_large_bulk_string_trickled_in_small_reads() {
        int size = 8 * 1024 * 1024;
        int chunk = 1024;
        byte[] payload = new byte[size];
        Arrays.fill(payload, (byte) 'x');

        EmbeddedChannel channel = newChannel();
        channel.writeInbound(resp("*3\r\n$3\r\nSET\r\n$3\r\nkey\r\n$" + size + "\r\n"));

        // Each read has to cost in proportion to its own size, not to what is already buffered.
        assertTimeout(Duration.ofSeconds(20), () -> {
            for (int offset = 0; offset < size; offset += chunk) {
                channel.writeInbound(Unpooled.wrappedBuffer(payload, offset, chunk));
                assertNull(channel.readInbound());
            }
        });
        channel.writeInbound(resp("\r\n"));

        RespValue.Array request = channel.readInbound();
        assertEquals(3, request.items().size());
        assertEquals(RespValue.BulkString.of("key"), request.items().get(1));
        assertArrayEquals(payload, ((RespValue.BulkString) request.items().get(2)).content());
        channel.finishAndReleaseAll();
    }

    @Test
    public void test_value_after_a_trickled_frame() {
        EmbeddedChannel channel = newChannel();
        channel.writeInbound(resp("*2\r\n$4\r\nECHO\r\n$5\r\nhe"));
        assertNull(channel.readInbound());
        channel.writeInbound(resp("llo\r\n*1\r\n$4\r\nPI"));
        assertEquals(RespValue.Array.of(RespValue.BulkString.of("ECHO"), RespValue.BulkString.of("hello")), channel.readInbound());
        assertNull(channel.readInbound());
        channel.writeInbound(resp("NG\r\n"));
        assertEquals(RespValue.Array.of(RespValue.BulkString.of("PING")), channel.readInbound());
        channel.finishAndReleaseAll();
    }

    @Test
    public void test_nesting_limit_is_enforced_across_reads() {
        RespLimits limits = new RespLimits(1024, 1024, 16, 1);
        EmbeddedChannel channel = new EmbeddedChannel(new RespFrameDecoder(new RespCodec(limits)));
        channel.writeInbound(resp("*1\r\n"));
        assertTrue(channel.isOpen());
        channel.writeInbound(resp("*1\r\n:1\r\n"));

        RespValue.Error reply = channel.readOutbound();
        assertTrue(reply.value().startsWith("ERR Protocol error: MalformedLength"));
        assertFalse(channel.isOpen());
        assertNull(channel.readInbound());
    }

    @Test
    public void test_bulk_payload_without_terminator_after_split() {
        EmbeddedChannel channel = newChannel();
        channel.writeInbound(resp("*1\r\n$3\r\nab"));
        assertTrue(channel.isOpen());
        channel.writeInbound(Unpooled.copiedBuffer("cXY", StandardCharsets.US_ASCII));

        RespValue.Error reply = channel.readOutbound();
        assertEquals("ERR Protocol error: MissingTerminator bulk string payload is not followed by CRLF", reply.value());
        assertFalse(channel.isOpen());
    }
}
