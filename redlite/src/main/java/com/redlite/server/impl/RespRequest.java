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

package com.redlite.server.impl;

import com.redlite.server.NotACommandException;
import com.redlite.server.Request;
import com.redlite.server.resp.RespValue;
import io.netty.util.DefaultAttributeMap;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Builds a {@link Request} from a decoded value. Only a non-empty array of non-null bulk strings
 * is accepted, anything else is rejected with {@link NotACommandException}.
 */
public class RespRequest extends DefaultAttributeMap implements Request {
    private final RespValue respValue;
    private final String command;
    private final List<byte[]> params;

    public RespRequest(RespValue respValue) {
        this.respValue = respValue;

        if (!(respValue instanceof RespValue.Array array) || array.isNull() || array.items().isEmpty()) {
            throw new NotACommandException();
        }

        List<byte[]> parts = new ArrayList<>(array.items().size());
        for (RespValue item : array.items()) {
            if (!(item instanceof RespValue.BulkString bulkString) || bulkString.isNull()) {
                throw new NotACommandException();
            }
            parts.add(bulkString.content());
        }

        this.command = new String(parts.get(0), StandardCharsets.UTF_8).toUpperCase(Locale.ROOT);
        this.params = Collections.unmodifiableList(parts.subList(1, parts.size()));
    }

    @Override
    public String getCommand() {
        return command;
    }

    @Override
    public List<byte[]> getParams() {
        return params;
    }

    @Override
    public RespValue getRespValue() {
        return respValue;
    }
}
