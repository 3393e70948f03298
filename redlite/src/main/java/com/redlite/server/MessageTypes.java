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

import com.redlite.redis.handlers.connection.protocol.EchoMessage;
import com.redlite.redis.handlers.connection.protocol.PingMessage;
import com.redlite.redis.handlers.generic.protocol.DelMessage;
import com.redlite.redis.handlers.generic.protocol.ExistsMessage;
import com.redlite.redis.handlers.string.protocol.GetMessage;
import com.redlite.redis.handlers.string.protocol.SetMessage;
import com.redlite.redis.server.protocol.DBSizeMessage;
import com.redlite.redis.server.protocol.FlushDBMessage;
import io.netty.util.AttributeKey;

/**
 * Attribute keys under which handlers store their parsed protocol messages on a request.
 */
public class MessageTypes {
    public static final AttributeKey<PingMessage> PING = AttributeKey.valueOf(PingMessage.COMMAND);
    public static final AttributeKey<EchoMessage> ECHO = AttributeKey.valueOf(EchoMessage.COMMAND);
    public static final AttributeKey<GetMessage> GET = AttributeKey.valueOf(GetMessage.COMMAND);
    public static final AttributeKey<SetMessage> SET = AttributeKey.valueOf(SetMessage.COMMAND);
    public static final AttributeKey<DelMessage> DEL = AttributeKey.valueOf(DelMessage.COMMAND);
    public static final AttributeKey<ExistsMessage> EXISTS = AttributeKey.valueOf(ExistsMessage.COMMAND);
    public static final AttributeKey<DBSizeMessage> DBSIZE = AttributeKey.valueOf(DBSizeMessage.COMMAND);
    public static final AttributeKey<FlushDBMessage> FLUSHDB = AttributeKey.valueOf(FlushDBMessage.COMMAND);
}
