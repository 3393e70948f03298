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

package com.redlite.redis.storage;

import java.util.concurrent.ConcurrentHashMap;

import static com.google.common.base.Preconditions.checkNotNull;

public class InMemoryKeyValueStore implements KeyValueStore {
    private final ConcurrentHashMap<String, StringValue> storage = new ConcurrentHashMap<>();

    @Override
    public StringValue get(String key) {
        return storage.get(key);
    }

    @Override
    public void set(String key, StringValue value) {
        checkNotNull(key, "key cannot be null");
        checkNotNull(value, "value cannot be null");
        storage.put(key, value);
    }

    @Override
    public boolean remove(String key) {
        return storage.remove(key) != null;
    }

    @Override
    public boolean exists(String key) {
        return storage.containsKey(key);
    }

    @Override
    public long size() {
        return storage.mappingCount();
    }

    @Override
    public void clear() {
        storage.clear();
    }
}
