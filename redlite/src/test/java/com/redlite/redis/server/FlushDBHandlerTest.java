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

package com.redlite.redis.server;

import com.redlite.protocol.RedliteCommandBuilder;
import com.redlite.redis.handlers.BaseHandlerTest;
import com.redlite.server.Response;
import com.redlite.server.resp.RespValue;
import io.lettuce.core.codec.StringCodec;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FlushDBHandlerTest extends BaseHandlerTest {

    @Test
    public void test_FLUSHDB() {
        RedliteCommandBuilder<String, String> cmd = new RedliteCommandBuilder<>(StringCodec.ASCII);
        for (int i = 0; i < 10; i++) {
            ByteBuf buf = Unpooled.buffer();
            cmd.set("key-" + i, "value").encode(buf);
            runCommand(channel, buf);
        }

        {
            ByteBuf buf = Unpooled.buffer();
            cmd.flushdb().encode(buf);
            assertEquals(new RespValue.SimpleString(Response.OK), runCommand(channel, buf));
        }

        assertEquals(0, redisService.getStore().size());

        {
            ByteBuf buf = Unpooled.buffer();
            cmd.get("key-1").encode(buf);
            RespValue.BulkString msg = (RespValue.BulkString) runCommand(channel, buf);
            assertTrue(msg.isNull());
        }
    }
}
