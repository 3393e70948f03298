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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.redlite.Context;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;

import java.util.concurrent.ThreadFactory;

/**
 * The NioRESPServer class represents a RESP server that uses NIO for network transport.
 *
 * @see RESPServer
 */
public class NioRESPServer extends RESPServer {
    public NioRESPServer(Context context) {
        super(
                context,
                NioServerSocketChannel.class,
                new NioEventLoopGroup(1, threadFactory("redlite-acceptor-%d")),
                new NioEventLoopGroup(0, threadFactory("redlite-worker-%d"))
        );
    }

    private static ThreadFactory threadFactory(String nameFormat) {
        return new ThreadFactoryBuilder().setNameFormat(nameFormat).build();
    }
}
