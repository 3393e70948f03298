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

package com.redlite.protocol;

import io.lettuce.core.codec.RedisCodec;
import io.lettuce.core.output.CommandOutput;
import io.lettuce.core.output.IntegerOutput;
import io.lettuce.core.output.StatusOutput;
import io.lettuce.core.output.ValueOutput;
import io.lettuce.core.protocol.Command;
import io.lettuce.core.protocol.CommandArgs;
import io.lettuce.core.protocol.ProtocolKeyword;

import java.util.List;

/**
 * Builds the requests understood by a Redlite server. Encoding a command with
 * {@link Command#encode(io.netty.buffer.ByteBuf)} produces a RESP array of bulk strings.
 */
public class RedliteCommandBuilder<K, V> {
    private final RedisCodec<K, V> codec;

    public RedliteCommandBuilder(RedisCodec<K, V> codec) {
        this.codec = codec;
    }

    public Command<K, V, String> ping() {
        return createCommand(CommandType.PING, new StatusOutput<>(codec));
    }

    public Command<K, V, String> ping(V message) {
        CommandArgs<K, V> args = new CommandArgs<>(codec).addValue(message);
        return createCommand(CommandType.PING, new StatusOutput<>(codec), args);
    }

    public Command<K, V, V> echo(V message) {
        CommandArgs<K, V> args = new CommandArgs<>(codec).addValue(message);
        return createCommand(CommandType.ECHO, new ValueOutput<>(codec), args);
    }

    public Command<K, V, V> get(K key) {
        CommandArgs<K, V> args = new CommandArgs<>(codec).addKey(key);
        return createCommand(CommandType.GET, new ValueOutput<>(codec), args);
    }

    public Command<K, V, String> set(K key, V value) {
        CommandArgs<K, V> args = new CommandArgs<>(codec).addKey(key).addValue(value);
        return createCommand(CommandType.SET, new StatusOutput<>(codec), args);
    }

    public Command<K, V, Long> del(List<K> keys) {
        CommandArgs<K, V> args = new CommandArgs<>(codec).addKeys(keys);
        return createCommand(CommandType.DEL, new IntegerOutput<>(codec), args);
    }

    public Command<K, V, Long> exists(List<K> keys) {
        CommandArgs<K, V> args = new CommandArgs<>(codec).addKeys(keys);
        return createCommand(CommandType.EXISTS, new IntegerOutput<>(codec), args);
    }

    public Command<K, V, Long> dbsize() {
        return createCommand(CommandType.DBSIZE, new IntegerOutput<>(codec));
    }

    public Command<K, V, String> flushdb() {
        return createCommand(CommandType.FLUSHDB, new StatusOutput<>(codec));
    }

    private <T> Command<K, V, T> createCommand(ProtocolKeyword type, CommandOutput<K, V, T> output) {
        return new Command<>(type, output);
    }

    private <T> Command<K, V, T> createCommand(ProtocolKeyword type, CommandOutput<K, V, T> output, CommandArgs<K, V> args) {
        return new Command<>(type, output, args);
    }
}
