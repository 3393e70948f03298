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

import com.redlite.Context;
import com.redlite.common.RedliteException;
import com.redlite.common.resp.RESPError;
import com.redlite.server.annotation.MaximumParameterCount;
import com.redlite.server.annotation.MinimumParameterCount;
import com.redlite.server.impl.RespRequest;
import com.redlite.server.impl.RespResponse;
import com.redlite.server.resp.RespValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a decoded request value into exactly one reply value.
 * <p>
 * Command failures are reported as error replies; nothing thrown by a handler escapes
 * {@link #dispatch(RespValue)}. The dispatcher itself is stateless and can be shared by every
 * connection.
 */
public class Dispatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(Dispatcher.class);

    private final Handlers handlers;
    private final boolean logCommandForDebugging;

    public Dispatcher(Context context) {
        this.handlers = context.getHandlers();
        this.logCommandForDebugging = context.getConfig().hasPath("log_command_for_debugging") &&
                context.getConfig().getBoolean("log_command_for_debugging");
    }

    private void checkMinimumParameterCount(Handler handler, Request request) throws WrongNumberOfArgumentsException {
        MinimumParameterCount annotation = handler.getClass().getAnnotation(MinimumParameterCount.class);
        if (annotation != null) {
            if (request.getParams().size() < annotation.value()) {
                throw new WrongNumberOfArgumentsException(
                        String.format("wrong number of arguments for '%s' command", request.getCommand().toLowerCase(Locale.ROOT))
                );
            }
        }
    }

    private void checkMaximumParameterCount(Handler handler, Request request) throws WrongNumberOfArgumentsException {
        MaximumParameterCount annotation = handler.getClass().getAnnotation(MaximumParameterCount.class);
        if (annotation != null) {
            if (request.getParams().size() > annotation.value()) {
                throw new WrongNumberOfArgumentsException(
                        String.format("wrong number of arguments for '%s' command", request.getCommand().toLowerCase(Locale.ROOT))
                );
            }
        }
    }

    private void logCommandForDebugging(Request request) {
        LOGGER.debug("Received command: {}", describe(request));
    }

    private String describe(Request request) {
        List<String> command = new ArrayList<>(List.of(request.getCommand()));
        for (byte[] param : request.getParams()) {
            command.add(new String(param, StandardCharsets.UTF_8));
        }
        return String.join(" ", command);
    }

    private void exceptionToRespError(Request request, Response response, Exception exception) {
        if (exception instanceof CommandException exp) {
            response.writeError(exp.getPrefix(), String.format("%s %s", exp.getKind(), exp.getMessage()));
        } else if (exception instanceof RedliteException exp) {
            if (exp.getCause() != null) {
                response.writeError(exp.getPrefix(), exp.getCause().getMessage());
            } else {
                response.writeError(exp.getPrefix(), exp.getMessage());
            }
        } else {
            String command = request == null ? "<none>" : describe(request);
            LOGGER.debug("Unhandled error while serving command: {}", command, exception);
            String message = exception.getMessage();
            response.writeError(message == null ? exception.getClass().getSimpleName() : RESPError.decapitalize(message));
        }
    }

    /**
     * Executes the command carried by the given value.
     *
     * @param message a decoded request value
     * @return the reply to send back
     */
    public RespValue dispatch(RespValue message) {
        Request request = null;
        RespResponse response = new RespResponse();
        try {
            request = new RespRequest(message);
            if (logCommandForDebugging) {
                logCommandForDebugging(request);
            }

            Handler handler = handlers.get(request.getCommand());
            checkMinimumParameterCount(handler, request);
            checkMaximumParameterCount(handler, request);

            handler.beforeExecute(request);
            handler.execute(request, response);
            return response.getReply();
        } catch (Exception e) {
            // The failed handler may have written a partial reply already.
            RespResponse errorResponse = new RespResponse();
            exceptionToRespError(request, errorResponse, e);
            return errorResponse.getReply();
        }
    }
}
