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

package com.redlite.redis.handlers;

import com.redlite.BaseTest;
import com.redlite.Context;
import com.redlite.ContextImpl;
import com.redlite.redis.RedisService;
import com.redlite.server.ConnectionHandler;
import com.redlite.server.Dispatcher;
import com.redlite.server.resp.RespCodec;
import com.redlite.server.resp.RespFrameDecoder;
import com.redlite.server.resp.RespLimits;
import com.typesafe.config.Config;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

/**
 * Runs commands through a channel without the encoder, so replies are read back as values.
 */
public class BaseHandlerTest extends BaseTest {
    protected Context context;
    protected RedisService redisService;
    protected EmbeddedChannel channel;

    protected EmbeddedChannel newChannel() {
        RespCodec codec = new RespCodec(RespLimits.fromConfig(context.getConfig()));
        return new EmbeddedChannel(new RespFrameDecoder(codec), new ConnectionHandler(new Dispatcher(context)));
    }

    @BeforeEach
    public void setup() {
        Config config = loadConfig("test.conf");
        context = new ContextImpl(config);
        redisService = new RedisService(context);
        context.registerService(RedisService.NAME, redisService);
        channel = newChannel();
    }

    @AfterEach
    public void tearDown() {
        if (channel != null) {
            channel.finishAndReleaseAll();
        }
    }
}
