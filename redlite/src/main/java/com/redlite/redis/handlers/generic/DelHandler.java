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

package com.redlite.redis.handlers.generic;

import com.redlite.redis.RedisService;
import com.redlite.redis.handlers.BaseHandler;
import com.redlite.redis.handlers.generic.protocol.DelMessage;
import com.redlite.server.Handler;
import com.redlite.server.MessageTypes;
import com.redlite.server.Request;
import com.redlite.server.Response;
import com.redlite.server.annotation.Command;
import com.redlite.server.annotation.MinimumParameterCount;

@Command(DelMessage.COMMAND)
@MinimumParameterCount(DelMessage.MINIMUM_PARAMETER_COUNT)
public class DelHandler extends BaseHandler implements Handler {
    public DelHandler(RedisService service) {
        super(service);
    }

    @Override
    public void beforeExecute(Request request) {
        request.attr(MessageTypes.DEL).set(new DelMessage(request));
    }

    @Override
    public void execute(Request request, Response response) {
        DelMessage message = request.attr(MessageTypes.DEL).get();

        long removed = 0;
        for (String key : message.getKeys()) {
            if (service.getStore().remove(key)) {
                removed++;
            }
        }
        response.writeInteger(removed);
    }
}
