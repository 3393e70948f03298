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

/**
 * Key-value storage shared by every connection. Each operation is atomic on its own, no operation
 * spans more than one call.
 */
public interface KeyValueStore {
    /**
     * @return the value stored under the key, or {@code null} if the key does not exist
     */
    StringValue get(String key);

    /**
     * Stores the value under the key, replacing any previous value.
     */
    void set(String key, StringValue value);

    /**
     * @return true if the key existed and has been removed
     */
    boolean remove(String key);

    boolean exists(String key);

    /**
     * @return number of keys in the store
     */
    long size();

    /**
     * Removes all keys.
     */
    void clear();
}
