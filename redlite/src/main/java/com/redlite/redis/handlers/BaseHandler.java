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

import com.redlite.redis.RedisService;

import java.nio.charset.StandardCharsets;

public class BaseHandler {
    protected final RedisService service;

    public BaseHandler(RedisService service) {
        this.service = service;
    }

    /**
     * Keys arrive as raw bytes. ISO-8859-1 maps every byte to exactly one char, so distinct
     * byte sequences always give distinct keys, and ASCII keys read as themselves.
     */
    public static String toKey(byte[] raw) {
        return new String(raw, StandardCharsets.ISO_8859_1);
    }
}
