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

package com.redlite;

import com.redlite.server.CommandAlreadyRegisteredException;
import com.redlite.server.Handler;
import com.redlite.server.Handlers;
import com.redlite.server.annotation.Command;

import java.util.Locale;

/**
 * Base class of the services that expose commands. Registers handlers under the name declared
 * by their {@link Command} annotation.
 */
public class CommandHandlerService {
    protected final Context context;
    protected final Handlers handlers;

    public CommandHandlerService(Context context) {
        this.context = context;
        this.handlers = context.getHandlers();
    }

    /**
     * Registers the given command handlers.
     *
     * @param handlers the handlers to register
     * @throws CommandAlreadyRegisteredException if a command is already registered
     */
    protected void registerHandler(Handler... handlers) throws CommandAlreadyRegisteredException {
        for (Handler handler : handlers) {
            Command command = handler.getClass().getAnnotation(Command.class);
            if (command == null) {
                throw new IllegalArgumentException(
                        String.format("%s is not annotated with @Command", handler.getClass().getName())
                );
            }
            this.handlers.register(command.value().toUpperCase(Locale.ROOT), handler);
        }
    }
}
