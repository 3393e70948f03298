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

package com.redlite.protocol;

import io.lettuce.core.codec.StringCodec;
import io.lettuce.core.protocol.Command;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class RedliteCommandBuilderTest {
    private static String encode(Command<String, String, ?> command) {
        ByteBuf buf = Unpooled.buffer();
        command.encode(buf);
        byte[] raw = new byte[buf.readableBytes()];
        buf.readBytes(raw);
        return new String(raw);
    }

    @Test
    public void testPing() {
        RedliteCommandBuilder<String, String> cmd = new RedliteCommandBuilder<>(StringCodec.ASCII);
        RESPCommandBuilder expectedCommand = new RESPCommandBuilder().
                append("*1").
                append("$4").
                append("PING");
        assertEquals(expectedCommand.toString(), encode(cmd.ping()));
    }

    @Test
    public void testPingWithMessage() {
        RedliteCommandBuilder<String, String> cmd = new RedliteCommandBuilder<>(StringCodec.ASCII);
        RESPCommandBuilder expectedCommand = new RESPCommandBuilder().
                append("*2").
                append("$4").
                append("PING").
                append("$5").
                append("hello");
        assertEquals(expectedCommand.toString(), encode(cmd.ping("hello")));
    }

    @Test
    public void testEcho() {
        RedliteCommandBuilder<String, String> cmd = new RedliteCommandBuilder<>(StringCodec.ASCII);
        RESPCommandBuilder expectedCommand = new RESPCommandBuilder().
                append("*2").
                append("$4").
                append("ECHO").
                append("$3").
                append("hey");
        assertEquals(expectedCommand.toString(), encode(cmd.echo("hey")));
    }

    @Test
    public void testSet() {
        RedliteCommandBuilder<String, String> cmd = new RedliteCommandBuilder<>(StringCodec.ASCII);
        RESPCommandBuilder expectedCommand = new RESPCommandBuilder().
                append("*3").
                append("$3").
                append("SET").
                append("$3").
                append("foo").
                append("$3").
                append("bar");
        assertEquals(expectedCommand.toString(), encode(cmd.set("foo", "bar")));
    }

    @Test
    public void testGet() {
        RedliteCommandBuilder<String, String> cmd = new RedliteCommandBuilder<>(StringCodec.ASCII);
        RESPCommandBuilder expectedCommand = new RESPCommandBuilder().
                append("*2").
                append("$3").
                append("GET").
                append("$7").
                append("missing");
        assertEquals(expectedCommand.toString(), encode(cmd.get("missing")));
    }

    @Test
    public void testDel() {
        RedliteCommandBuilder<String, String> cmd = new RedliteCommandBuilder<>(StringCodec.ASCII);
        RESPCommandBuilder expectedCommand = new RESPCommandBuilder().
                append("*3").
                append("$3").
                append("DEL").
                append("$1").
                append("a").
                append("$1").
                append("b");
        assertEquals(expectedCommand.toString(), encode(cmd.del(List.of("a", "b"))));
    }

    @Test
    public void testExists() {
        RedliteCommandBuilder<String, String> cmd = new RedliteCommandBuilder<>(StringCodec.ASCII);
        RESPCommandBuilder expectedCommand = new RESPCommandBuilder().
                append("*2").
                append("$6").
                append("EXISTS").
                append("$1").
                append("a");
        assertEquals(expectedCommand.toString(), encode(cmd.exists(List.of("a"))));
    }

    @Test
    public void testDbsize() {
        RedliteCommandBuilder<String, String> cmd = new RedliteCommandBuilder<>(StringCodec.ASCII);
        RESPCommandBuilder expectedCommand = new RESPCommandBuilder().
                append("*1").
                append("$6").
                append("DBSIZE");
        assertEquals(expectedCommand.toString(), encode(cmd.dbsize()));
    }

    @Test
    public void testFlushdb() {
        RedliteCommandBuilder<String, String> cmd = new RedliteCommandBuilder<>(StringCodec.ASCII);
        RESPCommandBuilder expectedCommand = new RESPCommandBuilder().
                append("*1").
                append("$7").
                append("FLUSHDB");
        assertEquals(expectedCommand.toString(), encode(cmd.flushdb()));
    }
}
