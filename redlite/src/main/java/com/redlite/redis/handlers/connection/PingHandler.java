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

package com.redlite.redis.handlers.connection;

import com.redlite.redis.handlers.connection.protocol.PingMessage;
import com.redlite.server.Handler;
import com.redlite.server.MessageTypes;
import com.redlite.server.Request;
import com.redlite.server.Response;
import com.redlite.server.annotation.Command;
import com.redlite.server.annotation.MaximumParameterCount;
import com.google.common.base.Utf8;
import com.redlite.server.resp.RespValue;

import java.nio.charset.StandardCharsets;

/**
 * Replies {@code +PONG}, or echoes the argument as a simple string. An argument that cannot be
 * carried verbatim by a simple string, because it spans lines or is not UTF-8 text, is returned
 * as a bulk string.
 */
@Command(PingMessage.COMMAND)
@MaximumParameterCount(PingMessage.MAXIMUM_PARAMETER_COUNT)
public class PingHandler implements Handler {
    @Override
    public void beforeExecute(Request request) {
        request.attr(MessageTypes.PING).set(new PingMessage(request));
    }

    @Override
    public void execute(Request request, Response response) {
        PingMessage pingMessage = request.attr(MessageTypes.PING).get();
        byte[] message = pingMessage.getMessage();
        if (message == null) {
            response.writeSimpleString(Response.PONG);
            return;
        }
        // A simple string is written as UTF-8, only well-formed text goes back byte for byte.
        if (Utf8.isWellFormed(message)) {
            String text = new String(message, StandardCharsets.UTF_8);
            if (RespValue.isLine(text)) {
                response.writeSimpleString(text);
                return;
            }
        }
        response.writeBulkString(message);
    }
}
