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

import com.redlite.server.resp.RespValue;
import io.netty.util.AttributeMap;

import java.util.List;

/**
 * The Request interface represents a validated command invocation.
 * It extends the AttributeMap interface so that handlers can attach their parsed protocol messages.
 */
public interface Request extends AttributeMap {
    /**
     * Retrieves the command name associated with the Request, in upper case.
     *
     * @return the command associated with the Request
     */
    String getCommand();

    /**
     * Retrieves the parameters of the Request, the command name excluded.
     *
     * @return the list of raw parameters
     */
    List<byte[]> getParams();

    /**
     * Retrieves the decoded value the Request was built from.
     *
     * @return the RespValue object associated with the Request
     */
    RespValue getRespValue();
}
