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

package com.redlite.instance;

import com.google.common.collect.Lists;
import com.redlite.Context;
import com.redlite.ContextImpl;
import com.redlite.RedliteService;
import com.redlite.network.Address;
import com.redlite.redis.RedisService;
import com.redlite.server.NioRESPServer;
import com.redlite.server.RESPServer;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * A Redlite instance wires the services together: the Redis service that owns the store and its
 * commands, and the RESP server that accepts client connections.
 */
public class RedliteInstance {
    private static final Logger LOGGER = LoggerFactory.getLogger(RedliteInstance.class);

    private final Context context;
    private volatile RedliteInstanceStatus status;
    private RESPServer server;

    public RedliteInstance() {
        this(ConfigFactory.load());
    }

    public RedliteInstance(Config config) {
        this.context = new ContextImpl(config);
    }

    /**
     * Registers the services and binds the server to the configured address.
     * <p>
     * 1. Creates the Redis service, which registers the command handlers.
     * 2. Starts the RESP server on {@code network.host}:{@code network.port}.
     * 3. Sets the status of the instance to RUNNING.
     *
     * @throws InterruptedException if interrupted while binding the server socket
     */
    public synchronized void start() throws InterruptedException {
        if (status == RedliteInstanceStatus.RUNNING) {
            throw new IllegalStateException("Redlite instance is already running");
        }
        LOGGER.info("Initializing a new Redlite instance");
        setStatus(RedliteInstanceStatus.INITIALIZING);

        try {
            RedisService redisService = new RedisService(context);
            context.registerService(RedisService.NAME, redisService);

            server = new NioRESPServer(context);
            context.registerService(RESPServer.NAME, server);
            server.start(Address.fromConfig(context.getConfig()));
        } catch (Exception e) {
            LOGGER.error("Failed to initialize the instance", e);
            shutdown();
            throw e;
        }

        setStatus(RedliteInstanceStatus.RUNNING);
        LOGGER.info("Ready to accept connections");
    }

    /**
     * Shuts the services down in reverse registration order. Calling it more than once is a no-op.
     */
    public synchronized void shutdown() {
        if (status == null || status == RedliteInstanceStatus.STOPPED) {
            return;
        }
        LOGGER.info("Shutting down Redlite");
        setStatus(RedliteInstanceStatus.STOPPED);

        for (RedliteService service : Lists.reverse(context.getServices())) {
            try {
                LOGGER.debug("{} service has been shutting down", service.getName());
                service.shutdown();
            } catch (Exception e) {
                LOGGER.error("{} service cannot be closed due to errors", service.getName(), e);
            }
        }
    }

    public RedliteInstanceStatus getStatus() {
        return status;
    }

    private void setStatus(RedliteInstanceStatus status) {
        this.status = status;
        LOGGER.info("Setting instance status to {}", status);
    }

    /**
     * @return the address the server is listening on
     */
    public InetSocketAddress getListeningAddress() {
        if (server == null) {
            throw new IllegalStateException("Redlite instance has not been started");
        }
        return server.getLocalAddress();
    }

    public Context getContext() {
        return context;
    }
}
