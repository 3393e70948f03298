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
import com.redlite.RedliteService;
import com.redlite.network.Address;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.ServerSocketChannel;

import java.net.InetSocketAddress;

/**
 * This abstract class represents a RESP server that implements the RedliteService interface.
 * It provides the basic functionality for starting and shutting down a server.
 */
public abstract class RESPServer implements RedliteService {
    public static final String NAME = "RESP";

    private final EventLoopGroup parentGroup;
    private final EventLoopGroup childGroup;
    private final Context context;
    private final Class<? extends ServerSocketChannel> channel;
    private ChannelFuture channelFuture;

    public RESPServer(
            Context context,
            Class<? extends ServerSocketChannel> channel,
            EventLoopGroup parentGroup,
            EventLoopGroup childGroup
    ) {
        this.context = context;
        this.parentGroup = parentGroup;
        this.childGroup = childGroup;
        this.channel = channel;
    }

    /**
     * Binds the server to the given address and blocks until the socket is listening.
     *
     * @param address the address to listen on, port 0 picks an ephemeral port
     * @throws InterruptedException if the calling thread is interrupted while binding
     */
    public void start(Address address) throws InterruptedException {
        int backlog = context.getConfig().hasPath("network.so_backlog") ?
                context.getConfig().getInt("network.so_backlog") : 1 << 9;

        ServerBootstrap b = new ServerBootstrap();
        b.group(parentGroup, childGroup)
                .channel(channel)
                .childHandler(new RedliteChannelInitializer(context))
                .option(ChannelOption.SO_BACKLOG, backlog)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true);

        channelFuture = b.bind(address.getHost(), address.getPort()).sync();
    }

    /**
     * @return the address the server socket is bound to
     */
    public InetSocketAddress getLocalAddress() {
        if (channelFuture == null) {
            throw new IllegalStateException("server has not been started");
        }
        return (InetSocketAddress) channelFuture.channel().localAddress();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Context getContext() {
        return context;
    }

    @Override
    public void shutdown() {
        if (channelFuture != null) {
            channelFuture.channel().close().syncUninterruptibly();
        }
        childGroup.shutdownGracefully().syncUninterruptibly();
        parentGroup.shutdownGracefully().syncUninterruptibly();
    }
}
