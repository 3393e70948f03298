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

package com.redlite.common.resp;

/**
 * Error prefixes used in the first word of a RESP error reply.
 */
public enum RESPError {
    ERR;

    public final static String NOT_A_COMMAND_MESSAGE = "expected an array of bulk strings";
    public final static String PROTOCOL_ERROR_MESSAGE = "Protocol error";

    public static String decapitalize(String string) {
        if (string == null || string.isEmpty()) {
            return string;
        }

        char[] c = string.toCharArray();
        c[0] = Character.toLowerCase(c[0]);

        return new String(c);
    }

    public String toString() {
        return this.name();
    }
}
