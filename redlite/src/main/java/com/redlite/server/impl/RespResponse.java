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

import com.redlite.common.resp.RESPError;
import com.redlite.server.Response;
import com.redlite.server.resp.RespValue;

import java.util.List;

/**
 * A {@link Response} that keeps the reply in memory until the caller picks it up.
 */
public class RespResponse implements Response {
    private RespValue reply;

    private void write(RespValue value) {
        if (reply != null) {
            throw new IllegalStateException("a reply has already been written");
        }
        reply = value;
    }

    private static String sanitize(String content) {
        if (content == null) {
            return "";
        }
        return content.replace('\r', ' ').replace('\n', ' ');
    }

    /**
     * Returns the written reply, or the null bulk string if the handler wrote nothing.
     */
    public RespValue getReply() {
        return reply == null ? RespValue.BulkString.NULL : reply;
    }

    public boolean isWritten() {
        return reply != null;
    }

    @Override
    public void writeOK() {
        write(new RespValue.SimpleString(OK));
    }

    @Override
    public void writeSimpleString(String msg) {
        write(new RespValue.SimpleString(msg));
    }

    @Override
    public void writeInteger(long value) {
        write(new RespValue.Integer(value));
    }

    @Override
    public void writeBulkString(byte[] content) {
        write(new RespValue.BulkString(content));
    }

    @Override
    public void writeNULL() {
        write(RespValue.BulkString.NULL);
    }

    @Override
    public void writeArray(List<RespValue> children) {
        write(new RespValue.Array(children));
    }

    @Override
    public void writeError(String content) {
        writeError(RESPError.ERR, content);
    }

    @Override
    public void writeError(RESPError prefix, String content) {
        write(new RespValue.Error(String.format("%s %s", prefix, sanitize(content))));
    }
}
