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

import com.redlite.BaseTest;
import com.redlite.Context;
import com.redlite.ContextImpl;
import com.redlite.network.Address;
import com.redlite.redis.RedisService;
import com.redlite.server.resp.DecodeResult;
import com.redlite.server.resp.RespCodec;
import com.redlite.server.resp.RespValue;
import com.typesafe.config.Config;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives a server bound to an ephemeral port over real sockets.
 */
public class NioRESPServerTest extends BaseTest {
    private NioRESPServer server;

    private InetSocketAddress startServer(Config config) throws InterruptedException {
        Context context = new ContextImpl(config);
        context.registerService(RedisService.NAME, new RedisService(context));
        server = new NioRESPServer(context);
        server.start(Address.fromConfig(config));
        return server.getLocalAddress();
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.shutdown();
        }
    }

    /**
     * Minimal blocking client, one instance per thread.
     */
    private static class Client implements AutoCloseable {
        private final RespCodec codec = new RespCodec();
        private final Socket socket;
        private final InputStream in;
        private final OutputStream out;
        private final ByteBuf pending = Unpooled.buffer();

        Client(InetSocketAddress address) throws IOException {
            socket = new Socket(address.getHostString(), address.getPort());
            socket.setSoTimeout(10_000);
            in = socket.getInputStream();
            out = socket.getOutputStream();
        }

        void send(String raw) throws IOException {
            out.write(raw.getBytes(StandardCharsets.UTF_8));
            out.flush();
        }

        RespValue command(String... parts) throws IOException {
            StringBuilder builder = new StringBuilder();
            builder.append('*').append(parts.length).append("\r\n");
            for (String part : parts) {
                byte[] raw = part.getBytes(StandardCharsets.UTF_8);
                builder.append('$').append(raw.length).append("\r\n").append(part).append("\r\n");
            }
            send(builder.toString());
            return read();
        }

        RespValue read() throws IOException {
            byte[] chunk = new byte[4096];
            while (true) {
                DecodeResult result = codec.decode(pending);
                if (result instanceof DecodeResult.Complete complete) {
                    pending.discardReadBytes();
                    return complete.value();
                }
                int n = in.read(chunk);
                if (n < 0) {
                    throw new IOException("connection closed by server");
                }
                pending.writeBytes(chunk, 0, n);
            }
        }

        /**
         * @return true if the server closed the connection before the timeout
         */
        boolean awaitClose() throws IOException {
            return in.read() == -1;
        }

        @Override
        public void close() throws IOException {
            pending.release();
            socket.close();
        }
    }

    @Test
    public void test_command_examples() throws Exception {
        InetSocketAddress address = startServer(loadConfig("test.conf"));
        try (Client client = new Client(address)) {
            assertEquals(new RespValue.SimpleString("PONG"), client.command("PING"));
            assertEquals(new RespValue.SimpleString("hello"), client.command("PING", "hello"));
            assertEquals(new RespValue.SimpleString("OK"), client.command("SET", "foo", "bar"));
            assertEquals(RespValue.BulkString.of("bar"), client.command("GET", "foo"));
            assertEquals(RespValue.BulkString.NULL, client.command("GET", "missing"));
            assertEquals(new RespValue.Error("ERR UnknownCommand unknown command 'nope'"), client.command("NOPE"));
            assertEquals(new RespValue.SimpleString("PONG"), client.command("PING"));
        }
    }

    @Test
    public void test_pipelined_requests() throws Exception {
        InetSocketAddress address = startServer(loadConfig("test.conf"));
        try (Client client = new Client(address)) {
            client.send("*1\r\n$4\r\nPING\r\n*2\r\n$4\r\nECHO\r\n$1\r\nx\r\n*1\r\n$6\r\nDBSIZE\r\n");
            assertEquals(new RespValue.SimpleString("PONG"), client.read());
            assertEquals(RespValue.BulkString.of("x"), client.read());
            assertEquals(new RespValue.Integer(0), client.read());
        }
    }

    @Test
    public void test_malformed_input_closes_only_that_connection() throws Exception {
        InetSocketAddress address = startServer(loadConfig("test.conf"));
        try (Client healthy = new Client(address); Client broken = new Client(address)) {
            broken.send("*1\r\n$4\r\nPI");
            broken.send("NG\r\n!!!\r\n");
            assertEquals(new RespValue.SimpleString("PONG"), broken.read());
            RespValue error = broken.read();
            assertInstanceOf(RespValue.Error.class, error);
            assertTrue(((RespValue.Error) error).value().startsWith("ERR Protocol error: InvalidTypeTag"));
            assertTrue(broken.awaitClose());

            assertEquals(new RespValue.SimpleString("PONG"), healthy.command("PING"));
        }
    }

    @Test
    public void test_concurrent_clients_observe_their_own_writes() throws Exception {
        InetSocketAddress address = startServer(loadConfig("test.conf"));
        int clients = 8;
        int iterations = 200;

        ExecutorService executor = Executors.newFixedThreadPool(clients);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int c = 0; c < clients; c++) {
                final int id = c;
                futures.add(executor.submit(() -> {
                    try (Client client = new Client(address)) {
                        start.await();
                        for (int i = 0; i < iterations; i++) {
                            String key = "key-" + id + "-" + i;
                            String value = "value-" + id + "-" + i;
                            assertEquals(new RespValue.SimpleString("OK"), client.command("SET", key, value));
                            assertEquals(RespValue.BulkString.of(value), client.command("GET", key));

                            String shared = (i % 2 == 0) ? "even-" + "x".repeat(512) : "odd-" + "y".repeat(512);
                            client.command("SET", "shared", shared);
                            RespValue observed = client.command("GET", "shared");
                            String text = ((RespValue.BulkString) observed).asString();
                            assertTrue(text.equals("even-" + "x".repeat(512)) || text.equals("odd-" + "y".repeat(512)));
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        try (Client client = new Client(address)) {
            assertEquals(new RespValue.Integer((long) clients * iterations + 1), client.command("DBSIZE"));
        }
    }

    @Test
    public void test_idle_connection_is_closed() throws Exception {
        InetSocketAddress address = startServer(loadConfig("test.conf", "network.idle_timeout", 1));
        try (Client client = new Client(address)) {
            assertEquals(new RespValue.SimpleString("PONG"), client.command("PING"));
            assertTrue(client.awaitClose());
        }
    }
}
