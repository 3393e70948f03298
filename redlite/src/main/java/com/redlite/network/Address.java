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

package com.redlite.network;

import com.typesafe.config.Config;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Host and port a server listens on. Port {@code 0} lets the operating system pick a free port.
 */
public final class Address {
    private final String host;
    private final int port;

    public Address(String host, int port) {
        checkNotNull(host, "host cannot be null");
        checkArgument(port >= 0 && port <= 65535, "invalid port: %s", port);
        this.host = host;
        this.port = port;
    }

    /**
     * Reads {@code network.host} and {@code network.port}.
     */
    public static Address fromConfig(Config config) {
        return new Address(config.getString("network.host"), config.getInt("network.port"));
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Address address)) {
            return false;
        }
        return port == address.port && host.equals(address.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port);
    }

    @Override
    public String toString() {
        return '[' + host + "]:" + port;
    }
}
