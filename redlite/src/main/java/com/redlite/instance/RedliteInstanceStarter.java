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

package com.redlite.instance;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: starts a RedliteInstance and stops it when the JVM exits.
 */
public class RedliteInstanceStarter {
    private static final Logger LOGGER = LoggerFactory.getLogger(RedliteInstanceStarter.class);

    private static void greeting(RedliteInstance instance) {
        LOGGER.info("pid: {} has been started", ProcessHandle.current().pid());
        LOGGER.info("Redlite on {}/{} Java {}",
                System.getProperty("os.name"),
                System.getProperty("os.arch"),
                System.getProperty("java.version"));
        LOGGER.info("Listening client connections on {}", instance.getListeningAddress());
    }

    public static void main(String[] args) {
        RedliteInstance instance = new RedliteInstance();
        Runtime.getRuntime().addShutdownHook(createShutdownHook(instance));
        try {
            instance.start();
            greeting(instance);
        } catch (Exception e) {
            LOGGER.error("Failed to start Redlite instance", e);
            System.exit(1);
        }
    }

    private static Thread createShutdownHook(RedliteInstance instance) {
        return new Thread(() -> {
            try {
                instance.shutdown();
            } finally {
                LOGGER.info("Quit!");
            }
        }, "redlite-shutdown-hook");
    }
}
