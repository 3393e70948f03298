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

package com.redlite.redis;

import com.redlite.CommandHandlerService;
import com.redlite.Context;
import com.redlite.RedliteService;
import com.redlite.redis.handlers.connection.EchoHandler;
import com.redlite.redis.handlers.connection.PingHandler;
import com.redlite.redis.handlers.generic.DelHandler;
import com.redlite.redis.handlers.generic.ExistsHandler;
import com.redlite.redis.handlers.string.GetHandler;
import com.redlite.redis.handlers.string.SetHandler;
import com.redlite.redis.server.DBSizeHandler;
import com.redlite.redis.server.FlushDBHandler;
import com.redlite.redis.storage.InMemoryKeyValueStore;
import com.redlite.redis.storage.KeyValueStore;
import com.redlite.server.CommandAlreadyRegisteredException;

/**
 * Owns the key-value store and exposes the Redis-compatible commands that operate on it.
 */
public class RedisService extends CommandHandlerService implements RedliteService {
    public static final String NAME = "Redis";

    private final KeyValueStore store;

    public RedisService(Context context) throws CommandAlreadyRegisteredException {
        this(context, new InMemoryKeyValueStore());
    }

    public RedisService(Context context, KeyValueStore store) throws CommandAlreadyRegisteredException {
        super(context);
        this.store = store;

        registerHandler(new PingHandler());
        registerHandler(new EchoHandler());
        registerHandler(new GetHandler(this));
        registerHandler(new SetHandler(this));
        registerHandler(new DelHandler(this));
        registerHandler(new ExistsHandler(this));
        registerHandler(new DBSizeHandler(this));
        registerHandler(new FlushDBHandler(this));
    }

    public KeyValueStore getStore() {
        return store;
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
        // In-memory only, nothing to release.
    }
}
