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
 * Thrown when an input cannot be decoded into a RESP value.
 */
public class RespDecodeException extends Exception {
    private final FramingError error;

    public RespDecodeException(FramingError error, String message) {
        super(message);
        this.error = error;
    }

    public FramingError getError() {
        return error;
    }
}
