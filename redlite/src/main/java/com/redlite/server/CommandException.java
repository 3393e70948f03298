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

import com.redlite.common.RedliteException;

/**
 * Base class of the errors a request can fail with before it reaches a handler. They are
 * reported to the client as error replies and never close the connection.
 */
public abstract class CommandException extends RedliteException {
    public CommandException(String message) {
        super(message);
    }

    /**
     * @return the failure kind written in front of the message in the error reply
     */
    public abstract String getKind();
}
