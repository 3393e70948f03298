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

package com.redlite.server;

import com.redlite.Context;
import com.redlite.server.resp.RespCodec;
import com.redlite.server.resp.RespEncoder;
import com.redlite.server.resp.RespFrameDecoder;
import com.redlite.server.resp.RespLimits;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.timeout.IdleStateHandler;

import java.util.concurrent.TimeUnit;

/**
 * Installs the RESP pipeline on every accepted channel.
 */
public class RedliteChannelInitializer extends ChannelInitializer<Channel> {
    private static final RespEncoder ENCODER = new RespEncoder();

    private final RespCodec codec;
    private final Dispatcher dispatcher;
    private final long idleTimeout;

    public RedliteChannelInitializer(Context context) {
        this.codec = new RespCodec(RespLimits.fromConfig(context.getConfig()));
        this.dispatcher = new Dispatcher(context);
        this.idleTimeout = context.getConfig().hasPath("network.idle_timeout") ?
                context.getConfig().getLong("network.idle_timeout") : 0;
    }

    @Override
    protected void initChannel(Channel ch) {
        ChannelPipeline p = ch.pipeline();
        if (idleTimeout > 0) {
            p.addLast(new IdleStateHandler(idleTimeout, 0, 0, TimeUnit.SECONDS));
        }
        p.addLast(new RespFrameDecoder(codec));
        p.addLast(ENCODER);
        p.addLast(new ConnectionHandler(dispatcher));
    }
}
