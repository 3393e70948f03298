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

import com.typesafe.config.Config;

/**
 * Upper bounds enforced while decoding untrusted input.
 */
public record RespLimits(int maxLineLength, int maxBulkLength, int maxArrayLength, int maxNestingDepth) {
    public static final RespLimits DEFAULT = new RespLimits(64 * 1024, 512 * 1024 * 1024, 1024 * 1024, 32);

    public RespLimits {
        if (maxLineLength <= 0 || maxBulkLength < 0 || maxArrayLength < 0 || maxNestingDepth <= 0) {
            throw new IllegalArgumentException("RESP limits must be positive");
        }
    }

    /**
     * Reads the limits from the {@code resp} block of the given configuration.
     */
    public static RespLimits fromConfig(Config config) {
        return new RespLimits(
                config.getInt("resp.max_line_length"),
                config.getInt("resp.max_bulk_length"),
                config.getInt("resp.max_array_length"),
                config.getInt("resp.max_nesting_depth")
        );
    }
}
