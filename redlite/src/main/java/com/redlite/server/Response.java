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

import com.redlite.common.resp.RESPError;
import com.redlite.server.resp.RespValue;

import java.util.List;

/**
 * The `Response` interface collects the reply of a single request.
 * Every request is answered with exactly one reply.
 */
public interface Response {
    String OK = "OK";
    String PONG = "PONG";

    /**
     * Writes an "OK" simple string reply.
     */
    void writeOK();

    /**
     * Writes a simple string reply.
     *
     * @param msg the simple string message to be written, it cannot contain CR or LF
     */
    void writeSimpleString(String msg);

    /**
     * Writes a long integer value as a reply.
     *
     * @param value the long integer value to be written
     */
    void writeInteger(long value);

    /**
     * Writes a bulk string reply.
     *
     * @param content the binary-safe content
     */
    void writeBulkString(byte[] content);

    /**
     * Writes the null bulk string.
     */
    void writeNULL();

    /**
     * Writes an array of values as a reply.
     *
     * @param children the items of the array
     */
    void writeArray(List<RespValue> children);

    /**
     * Writes an error message with the default {@link RESPError#ERR} prefix.
     *
     * @param content the content of the error message
     */
    void writeError(String content);

    /**
     * Writes an error message.
     *
     * @param prefix  the prefix of the error message
     * @param content the content of the error message
     */
    void writeError(RESPError prefix, String content);
}
