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

package com.redlite;

import com.redlite.server.Handlers;
import com.typesafe.config.Config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

public class ContextImpl implements Context {
    private final Config config;
    private final Handlers handlers = new Handlers();
    private final LinkedHashMap<String, RedliteService> services = new LinkedHashMap<>();

    public ContextImpl(Config config) {
        this.config = checkNotNull(config, "config cannot be null");
    }

    @Override
    public Config getConfig() {
        return config;
    }

    @Override
    public Handlers getHandlers() {
        return handlers;
    }

    @Override
    public synchronized void registerService(String id, RedliteService service) {
        // Services are shut down in reverse registration order.
        services.putIfAbsent(id, service);
    }

    @SuppressWarnings("unchecked")
    @Override
    public synchronized <T> T getService(String id) {
        return (T) services.get(id);
    }

    @Override
    public synchronized List<RedliteService> getServices() {
        return new ArrayList<>(services.values());
    }
}
