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

package com.redlite.redis.handlers.connection;

import com.redlite.protocol.RedliteCommandBuilder;
import com.redlite.redis.handlers.BaseHandlerTest;
import com.redlite.server.resp.RespValue;
import io.lettuce.core.codec.StringCodec;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

public class EchoHandlerTest extends BaseHandlerTest {

    @Test
    public void test_ECHO() {
        RedliteCommandBuilder<String, String> cmd = new RedliteCommandBuilder<>(StringCodec.ASCII);
        ByteBuf buf = Unpooled.buffer();
        cmd.echo("hello world").encode(buf);

        Object msg = runCommand(channel, buf);
        assertInstanceOf(RespValue.BulkString.class, msg);
        assertEquals("hello world", ((RespValue.BulkString) msg).asString());
    }

    @Test
    public void test_ECHO_empty_string() {
        Object msg = runCommand(channel, resp("*2\r\n$4\r\nECHO\r\n$0\r\n\r\n"));
        assertEquals(new RespValue.BulkString(new byte[0]), msg);
    }

    @Test
    public void test_ECHO_without_argument() {
        Object msg = runCommand(channel, resp("*1\r\n$4\r\nECHO\r\n"));
        assertEquals(new RespValue.Error("ERR WrongArity wrong number of arguments for 'echo' command"), msg);
    }
}
