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

import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Registry of command handlers, keyed by upper-case command name.
 */
public class Handlers {
    private final ConcurrentHashMap<String, Handler> handlers;

    public Handlers() {
        handlers = new ConcurrentHashMap<>();
    }

    /**
     * Registers a command handler with a specified command.
     *
     * @param command the command to register
     * @param handler the handler for the command
     * @throws CommandAlreadyRegisteredException if the command is already registered
     */
    public void register(String command, Handler handler) throws CommandAlreadyRegisteredException {
        checkNotNull(handler, "handler cannot be null");
        if (handlers.putIfAbsent(command, handler) != null) {
            throw new CommandAlreadyRegisteredException(String.format("command already registered '%s'", command));
        }
    }

    /**
     * Retrieves the registered handler for the given command.
     *
     * @param command the command for which to retrieve the handler
     * @return the registered handler
     * @throws CommandNotFoundException if the command is not registered
     */
    public Handler get(String command) throws CommandNotFoundException {
        Handler handler = handlers.get(command);
        if (handler == null) {
            throw new CommandNotFoundException(String.format("unknown command '%s'", command.toLowerCase(Locale.ROOT)));
        }
        return handler;
    }

    /**
     * Retrieves the set of registered commands.
     *
     * @return the Set of registered commands
     */
    public Set<String> getCommands() {
        return handlers.keySet();
    }
}
