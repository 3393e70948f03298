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

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.util.ByteProcessor;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Encoder and decoder of the RESP2 wire format.
 * <p>
 * Decoding works on the readable bytes of a {@link ByteBuf}. A complete value moves the reader index past
 * exactly the bytes of that value, so the values of a pipeline can be decoded one after another from the
 * same buffer. An incomplete or malformed input leaves the reader index untouched.
 * <p>
 * Instances are immutable and can be shared between connections.
 */
public class RespCodec {
    private static final byte CR = '\r';
    private static final byte LF = '\n';
    private static final byte[] CRLF = {CR, LF};

    private final RespLimits limits;

    public RespCodec() {
        this(RespLimits.DEFAULT);
    }

    public RespCodec(RespLimits limits) {
        this.limits = limits;
    }

    /**
     * Writes the encoding of the given value to the buffer.
     *
     * @param value the value to encode
     * @param out   the destination buffer
     */
    public static void encode(RespValue value, ByteBuf out) {
        if (value instanceof RespValue.SimpleString simpleString) {
            writeLine(out, RespType.SIMPLE_STRING, simpleString.value());
        } else if (value instanceof RespValue.Error error) {
            writeLine(out, RespType.ERROR, error.value());
        } else if (value instanceof RespValue.Integer integer) {
            writeLine(out, RespType.INTEGER, Long.toString(integer.value()));
        } else if (value instanceof RespValue.BulkString bulkString) {
            if (bulkString.isNull()) {
                writeLine(out, RespType.BULK_STRING, "-1");
                return;
            }
            byte[] content = bulkString.content();
            writeLine(out, RespType.BULK_STRING, Integer.toString(content.length));
            out.writeBytes(content);
            out.writeBytes(CRLF);
        } else if (value instanceof RespValue.Array array) {
            if (array.isNull()) {
                writeLine(out, RespType.ARRAY, "-1");
                return;
            }
            writeLine(out, RespType.ARRAY, Integer.toString(array.items().size()));
            for (RespValue item : array.items()) {
                encode(item, out);
            }
        }
    }

    /**
     * Returns the encoding of the given value.
     *
     * @param value the value to encode
     * @return the encoded bytes
     */
    public static byte[] encode(RespValue value) {
        ByteBuf buf = Unpooled.buffer();
        try {
            encode(value, buf);
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }

    private static void writeLine(ByteBuf out, RespType type, String text) {
        out.writeByte(type.getPrefix());
        out.writeCharSequence(text, StandardCharsets.UTF_8);
        out.writeBytes(CRLF);
    }

    /**
     * Tries to decode one value from the readable bytes of the buffer.
     *
     * @param in the buffer, possibly holding a partial value or several pipelined values
     * @return the outcome; on {@link DecodeResult.Complete} the reader index points at the remainder
     */
    public DecodeResult decode(ByteBuf in) {
        return decode(in, false);
    }

    private DecodeResult decode(ByteBuf in, boolean finalInput) {
        int start = in.readerIndex();
        DecodeResult result;
        try {
            result = decodeValue(in, 0, finalInput);
        } catch (RespDecodeException e) {
            in.readerIndex(start);
            return DecodeResult.malformed(e.getError(), e.getMessage());
        }
        if (!result.isComplete()) {
            in.readerIndex(start);
        }
        return result;
    }

    /**
     * Decodes one value from an input that is known to be final: a value cut short by the end
     * of the input is an error here.
     *
     * @param input the encoded bytes
     * @return the value and the bytes following it
     * @throws RespDecodeException if the input does not start with a whole, well-formed value
     */
    public Decoded decode(byte[] input) throws RespDecodeException {
        ByteBuf in = Unpooled.wrappedBuffer(input);
        DecodeResult result = decode(in, true);
        if (result instanceof DecodeResult.Complete complete) {
            return new Decoded(complete.value(), ByteBufUtil.getBytes(in));
        }
        if (result instanceof DecodeResult.Incomplete incomplete) {
            throw new RespDecodeException(incomplete.reason(), incomplete.message());
        }
        DecodeResult.Malformed malformed = (DecodeResult.Malformed) result;
        throw new RespDecodeException(malformed.error(), malformed.message());
    }

    private DecodeResult decodeValue(ByteBuf in, int depth, boolean finalInput) throws RespDecodeException {
        if (!in.isReadable()) {
            return DecodeResult.incomplete(FramingError.UNEXPECTED_EOF, "input ended before a type tag");
        }
        RespType type = readType(in);
        return switch (type) {
            case SIMPLE_STRING, ERROR, INTEGER -> decodeLineValue(in, type);
            case BULK_STRING -> decodeBulkString(in, finalInput);
            case ARRAY -> decodeArray(in, depth, finalInput);
        };
    }

    /**
     * Reads the type tag of the next value. The buffer must be readable.
     */
    RespType readType(ByteBuf in) throws RespDecodeException {
        byte tag = in.readByte();
        RespType type = RespType.fromPrefix(tag);
        if (type == null) {
            throw new RespDecodeException(
                    FramingError.INVALID_TYPE_TAG,
                    String.format("unexpected type tag '%s'", describe(tag))
            );
        }
        return type;
    }

    /**
     * Builds a simple string, error or integer from the line that follows its type tag.
     */
    static RespValue lineValue(RespType type, String line) throws RespDecodeException {
        return switch (type) {
            case SIMPLE_STRING -> new RespValue.SimpleString(line);
            case ERROR -> new RespValue.Error(line);
            case INTEGER -> new RespValue.Integer(parseInteger(line));
            default -> throw new IllegalArgumentException("not a line value: " + type);
        };
    }

    long parseBulkLength(String line) throws RespDecodeException {
        return parseLength(line, limits.maxBulkLength(), "bulk string");
    }

    long parseArrayLength(String line) throws RespDecodeException {
        return parseLength(line, limits.maxArrayLength(), "array");
    }

    void checkNestingDepth(int depth) throws RespDecodeException {
        if (depth >= limits.maxNestingDepth()) {
            throw new RespDecodeException(
                    FramingError.MALFORMED_LENGTH,
                    String.format("arrays nested deeper than %d levels", limits.maxNestingDepth())
            );
        }
    }

    /**
     * Reads a bulk string payload of the given size and its terminating CRLF.
     * The buffer must hold at least {@code size + 2} readable bytes.
     */
    static RespValue.BulkString readBulkPayload(ByteBuf in, int size) throws RespDecodeException {
        byte[] content = new byte[size];
        in.readBytes(content);
        if (in.readByte() != CR || in.readByte() != LF) {
            throw new RespDecodeException(FramingError.MISSING_TERMINATOR, "bulk string payload is not followed by CRLF");
        }
        return new RespValue.BulkString(content);
    }

    private DecodeResult decodeLineValue(ByteBuf in, RespType type) throws RespDecodeException {
        String line = readLine(in);
        if (line == null) {
            return DecodeResult.incomplete(FramingError.UNTERMINATED_LINE, "line is not terminated by CRLF");
        }
        return DecodeResult.complete(lineValue(type, line));
    }

    private DecodeResult decodeBulkString(ByteBuf in, boolean finalInput) throws RespDecodeException {
        String line = readLine(in);
        if (line == null) {
            return DecodeResult.incomplete(FramingError.UNTERMINATED_LINE, "bulk string length is not terminated by CRLF");
        }
        long length = parseBulkLength(line);
        if (length == -1) {
            return DecodeResult.complete(RespValue.BulkString.NULL);
        }

        int size = (int) length;
        if (in.readableBytes() < (long) size + CRLF.length) {
            // Only a final input reports the received length, a stream just waits for more bytes.
            String message = finalInput
                    ? String.format("declared %d, actual %d", size, availablePayload(in))
                    : String.format("declared %d", size);
            return DecodeResult.incomplete(FramingError.LENGTH_MISMATCH, message);
        }
        return DecodeResult.complete(readBulkPayload(in, size));
    }

    private DecodeResult decodeArray(ByteBuf in, int depth, boolean finalInput) throws RespDecodeException {
        String line = readLine(in);
        if (line == null) {
            return DecodeResult.incomplete(FramingError.UNTERMINATED_LINE, "array length is not terminated by CRLF");
        }
        long count = parseArrayLength(line);
        if (count == -1) {
            return DecodeResult.complete(RespValue.Array.NULL);
        }
        checkNestingDepth(depth);

        List<RespValue> items = new ArrayList<>((int) Math.min(count, 64));
        for (long i = 0; i < count; i++) {
            DecodeResult item = decodeValue(in, depth + 1, finalInput);
            if (!(item instanceof DecodeResult.Complete complete)) {
                return item;
            }
            items.add(complete.value());
        }
        return DecodeResult.complete(new RespValue.Array(items));
    }

    /**
     * Reads the text up to the next CRLF and moves the reader index past it.
     *
     * At most {@code maxLineLength + 1} bytes are scanned.
     *
     * @return the line, or {@code null} if the buffer ends before the CRLF
     */
    String readLine(ByteBuf in) throws RespDecodeException {
        int start = in.readerIndex();
        int scan = (int) Math.min(in.readableBytes(), (long) limits.maxLineLength() + 1);
        int end = in.forEachByte(start, scan, ByteProcessor.FIND_CRLF);
        if (end < 0) {
            if (in.readableBytes() > limits.maxLineLength()) {
                throw lineTooLong();
            }
            return null;
        }
        if (end - start > limits.maxLineLength()) {
            throw lineTooLong();
        }
        if (in.getByte(end) == LF) {
            throw new RespDecodeException(FramingError.UNTERMINATED_LINE, "line contains a bare LF");
        }
        if (end + 1 >= in.writerIndex()) {
            return null;
        }
        if (in.getByte(end + 1) != LF) {
            throw new RespDecodeException(FramingError.UNTERMINATED_LINE, "line contains a bare CR");
        }
        String line = in.toString(start, end - start, StandardCharsets.UTF_8);
        in.readerIndex(end + CRLF.length);
        return line;
    }

    private RespDecodeException lineTooLong() {
        return new RespDecodeException(
                FramingError.UNTERMINATED_LINE,
                String.format("no CRLF within %d bytes", limits.maxLineLength())
        );
    }

    private static long parseInteger(String line) throws RespDecodeException {
        try {
            return Long.parseLong(line);
        } catch (NumberFormatException e) {
            throw new RespDecodeException(
                    FramingError.MALFORMED_INTEGER,
                    String.format("'%s' is not a base-10 signed integer", line)
            );
        }
    }

    private static long parseLength(String line, long max, String kind) throws RespDecodeException {
        long length;
        try {
            length = Long.parseLong(line);
        } catch (NumberFormatException e) {
            throw new RespDecodeException(
                    FramingError.MALFORMED_LENGTH,
                    String.format("'%s' is not a valid %s length", line, kind)
            );
        }
        if (length < -1) {
            throw new RespDecodeException(
                    FramingError.MALFORMED_LENGTH,
                    String.format("negative %s length %d", kind, length)
            );
        }
        if (length > max) {
            throw new RespDecodeException(
                    FramingError.MALFORMED_LENGTH,
                    String.format("%s length %d exceeds the limit of %d", kind, length, max)
            );
        }
        return length;
    }

    // Bytes before the next CRLF, or all readable bytes when there is none.
    private static int availablePayload(ByteBuf in) {
        int from = in.readerIndex();
        int to = in.writerIndex();
        for (int i = from; i < to - 1; i++) {
            if (in.getByte(i) == CR && in.getByte(i + 1) == LF) {
                return i - from;
            }
        }
        return to - from;
    }

    private static String describe(byte tag) {
        if (tag >= 0x20 && tag < 0x7f) {
            return String.valueOf((char) tag);
        }
        return String.format("0x%02x", tag & 0xff);
    }

    /**
     * A value decoded from a final input, with the bytes that follow it.
     */
    public record Decoded(RespValue value, byte[] remainder) {
    }
}
