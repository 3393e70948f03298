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

package com.redlite.common;

import com.redlite.common.resp.RESPError;

/**
 * Base unchecked exception of Redlite. Every instance carries the {@link RESPError} prefix used when the
 * exception is reported back to a client as a RESP error reply.
 */
public class RedliteException extends RuntimeException {
    private final RESPError prefix;

    public RedliteException() {
        this(RESPError.ERR, (String) null);
    }

    public RedliteException(String message) {
        this(RESPError.ERR, message);
    }

    public RedliteException(RESPError prefix, String message) {
        super(message);
        this.prefix = prefix;
    }

    public RedliteException(String message, Throwable cause) {
        super(message, cause);
        this.prefix = RESPError.ERR;
    }

    public RedliteException(Throwable cause) {
        super(cause);
        this.prefix = RESPError.ERR;
    }

    public RESPError getPrefix() {
        return prefix;
    }
}
