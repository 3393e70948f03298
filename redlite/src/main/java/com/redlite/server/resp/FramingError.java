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
 * Reasons a byte stream cannot be framed into a RESP value.
 */
public enum FramingError {
    UNEXPECTED_EOF("UnexpectedEof"),
    INVALID_TYPE_TAG("InvalidTypeTag"),
    UNTERMINATED_LINE("UnterminatedLine"),
    MALFORMED_INTEGER("MalformedInteger"),
    MALFORMED_LENGTH("MalformedLength"),
    LENGTH_MISMATCH("LengthMismatch"),
    MISSING_TERMINATOR("MissingTerminator");

    private final String label;

    FramingError(String label) {
        this.label = label;
    }

    /**
     * @return the name used for this error in RESP error replies
     */
    public String getLabel() {
        return label;
    }
}
