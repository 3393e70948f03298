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

import com.redlite.common.resp.RESPError;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Frames the inbound byte stream of a connection into {@link RespValue} requests.
 * <p>
 * Decoding is resumable: elements of an array that are already complete are consumed from the
 * cumulation buffer and kept, and a bulk string payload is not looked at until all of its bytes
 * have arrived. Every inbound byte is therefore parsed once, however the stream is split into reads.
 * Values that are already buffered are emitted one after another, which is how pipelined requests
 * are served without waiting for more I/O. A malformed frame is answered with a protocol error and
 * the connection is closed, since the stream cannot be resynchronized.
 * <p>
 * Holds per-connection state, a new instance is required for every channel.
 */
public class RespFrameDecoder extends ByteToMessageDecoder {
    private static final Logger LOGGER = LoggerFactory.getLogger(RespFrameDecoder.class);
    private static final int CRLF_LENGTH = 2;

    private final RespCodec codec;
    private final Deque<PendingArray> arrays = new ArrayDeque<>();
    private int bulkLength = -1;
    private boolean discarding;

    public RespFrameDecoder(RespCodec codec) {
        this.codec = codec;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (discarding) {
            in.skipBytes(in.readableBytes());
            return;
        }

        try {
            RespValue value = decodeFrame(in);
            if (value != null) {
                out.add(value);
            }
        } catch (RespDecodeException e) {
            discarding = true;
            arrays.clear();
            bulkLength = -1;
            in.skipBytes(in.readableBytes());
            LOGGER.debug("Closing {} after a framing error: {} {}",
                    ctx.channel().remoteAddress(), e.getError().getLabel(), e.getMessage());

            RespValue.Error reply = new RespValue.Error(String.format("%s %s: %s %s",
                    RESPError.ERR, RESPError.PROTOCOL_ERROR_MESSAGE, e.getError().getLabel(), e.getMessage()));
            ctx.channel().writeAndFlush(reply).addListener(ChannelFutureListener.CLOSE);
        }
    }

    /**
     * Consumes as many bytes as possible towards the next top-level value.
     *
     * @return the value, or {@code null} if more bytes are needed
     */
    private RespValue decodeFrame(ByteBuf in) throws RespDecodeException {
        for (; ; ) {
            RespValue value;
            if (bulkLength >= 0) {
                if (in.readableBytes() < (long) bulkLength + CRLF_LENGTH) {
                    return null;
                }
                value = RespCodec.readBulkPayload(in, bulkLength);
                bulkLength = -1;
            } else {
                if (!in.isReadable()) {
                    return null;
                }
                int start = in.readerIndex();
                RespType type = codec.readType(in);
                String line = codec.readLine(in);
                if (line == null) {
                    in.readerIndex(start);
                    return null;
                }
                value = decodeHeader(type, line);
                if (value == null) {
                    // A bulk payload or the elements of an array follow.
                    continue;
                }
            }
            RespValue frame = addToParents(value);
            if (frame != null) {
                return frame;
            }
        }
    }

    private RespValue decodeHeader(RespType type, String line) throws RespDecodeException {
        return switch (type) {
            case BULK_STRING -> startBulkString(codec.parseBulkLength(line));
            case ARRAY -> startArray(codec.parseArrayLength(line));
            default -> RespCodec.lineValue(type, line);
        };
    }

    private RespValue startBulkString(long length) {
        if (length == -1) {
            return RespValue.BulkString.NULL;
        }
        bulkLength = (int) length;
        return null;
    }

    private RespValue startArray(long count) throws RespDecodeException {
        if (count == -1) {
            return RespValue.Array.NULL;
        }
        codec.checkNestingDepth(arrays.size());
        if (count == 0) {
            return new RespValue.Array(List.of());
        }
        arrays.push(new PendingArray((int) count));
        return null;
    }

    /**
     * Appends a decoded value to the innermost open array, closing every array it completes.
     *
     * @return the top-level value once it is complete, otherwise {@code null}
     */
    private RespValue addToParents(RespValue value) {
        while (!arrays.isEmpty()) {
            PendingArray parent = arrays.peek();
            parent.items.add(value);
            if (parent.items.size() < parent.count) {
                return null;
            }
            arrays.pop();
            value = new RespValue.Array(parent.items);
        }
        return value;
    }

    private static final class PendingArray {
        private final int count;
        private final List<RespValue> items;

        PendingArray(int count) {
            this.count = count;
            this.items = new ArrayList<>(Math.min(count, 64));
        }
    }
}
