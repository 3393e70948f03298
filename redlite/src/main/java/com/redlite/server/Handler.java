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

public interface Handler {
    /**
     * Parses and validates the parameters of the request before it is executed.
     * <p>
     * Implementations attach the parsed protocol message to the request. A request that passes
     * this step is guaranteed to be well-formed for {@link #execute(Request, Response)}.
     *
     * @param request the request object
     */
    void beforeExecute(Request request);

    /**
     * Executes the given request.
     * <p>
     * The response object is used to write exactly one reply for the request.
     *
     * @param request  the request object to be executed
     * @param response the Response object used to write the reply
     * @throws Exception if an error occurs during execution
     */
    void execute(Request request, Response response) throws Exception;
}
