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

package com.redlite.server.resp;

/**
 * Outcome of an attempt to decode one RESP value from a buffer.
 */
public sealed interface DecodeResult permits DecodeResult.Complete, DecodeResult.Incomplete, DecodeResult.Malformed {

    static Complete complete(RespValue value) {
        return new Complete(value);
    }

    static Incomplete incomplete(FramingError reason, String message) {
        return new Incomplete(reason, message);
    }

    static Malformed malformed(FramingError error, String message) {
        return new Malformed(error, message);
    }

    default boolean isComplete() {
        return false;
    }

    /**
     * A whole value has been decoded. The bytes after it are left unread in the buffer.
     */
    record Complete(RespValue value) implements DecodeResult {
        @Override
        public boolean isComplete() {
            return true;
        }
    }

    /**
     * The buffer ends before the value does. {@code reason} is the error the input
     * stands for if no more bytes ever arrive.
     */
    record Incomplete(FramingError reason, String message) implements DecodeResult {
    }

    /**
     * The buffer can never be framed, no matter how many bytes follow.
     */
    record Malformed(FramingError error, String message) implements DecodeResult {
    }
}
