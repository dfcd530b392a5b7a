package io.chatstreams.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Incremental SSE line framing over arbitrary byte chunks.
 *
 * <p>Bytes are decoded with a stateful UTF-8 decoder, so a multi-byte character split across two
 * chunks is decoded once both halves arrived. Complete lines (terminated by {@code \n}, with one
 * trailing {@code \r} stripped) are returned in order; the unterminated tail stays buffered until
 * more bytes arrive and is discarded by {@link #finish()}.
 *
 * <p>Not thread-safe: one assembler per stream.
 */
public final class FrameAssembler {

    private static final Logger log = LoggerFactory.getLogger(FrameAssembler.class);
    private static final int DEBUG_PREVIEW_CHARS = 120;

    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
    private final StringBuilder lineBuffer = new StringBuilder();
    private final boolean debug;
    private ByteBuffer carry = ByteBuffer.allocate(0);

    public FrameAssembler() {
        this(false);
    }

    /**
     * @param debug log a preview of every decoded chunk at DEBUG level
     */
    public FrameAssembler(boolean debug) {
        this.debug = debug;
    }

    /**
     * Feeds the next chunk of the body.
     *
     * @return the lines completed by this chunk, possibly empty
     */
    public List<String> feed(byte[] chunk, int offset, int length) {
        Objects.checkFromIndexSize(offset, length, chunk.length);
        ByteBuffer in = ByteBuffer.allocate(carry.remaining() + length);
        in.put(carry).put(chunk, offset, length).flip();

        String decoded = decode(in, false);
        // incomplete trailing sequence waits for the next chunk
        carry = ByteBuffer.allocate(in.remaining()).put(in).flip();

        if (debug && log.isDebugEnabled()) {
            log.debug("[chat-stream] chunk {}", decoded.length() > DEBUG_PREVIEW_CHARS
                    ? decoded.substring(0, DEBUG_PREVIEW_CHARS)
                    : decoded);
        }
        lineBuffer.append(decoded);
        return drainLines();
    }

    public List<String> feed(byte[] chunk) {
        return feed(chunk, 0, chunk.length);
    }

    /**
     * Ends the input. Flushes the decoder and discards any unterminated line.
     *
     * @return the number of buffered characters that were discarded
     */
    public int finish() {
        String tail = decode(carry, true);
        carry = ByteBuffer.allocate(0);
        CharBuffer flushed = CharBuffer.allocate(8);
        decoder.flush(flushed);
        lineBuffer.append(tail).append(flushed.flip());

        int discarded = lineBuffer.length();
        lineBuffer.setLength(0);
        decoder.reset();
        return discarded;
    }

    /**
     * Returns the number of buffered characters that do not yet form a complete line.
     */
    public int pendingLength() {
        return lineBuffer.length();
    }

    /**
     * Extracts the payload of a {@code data:} line.
     *
     * <p>Blank lines, comments (heartbeats) and non-data fields yield {@code null}, as does a data
     * line whose payload is empty after left-trimming.
     */
    public static String payloadOf(String line) {
        if (line == null || line.isEmpty() || line.startsWith(Protocol.COMMENT_PREFIX)) {
            return null;
        }
        if (!line.startsWith(Protocol.DATA_PREFIX)) {
            return null;
        }
        String payload = line.substring(Protocol.DATA_PREFIX.length()).stripLeading();
        return payload.isEmpty() ? null : payload;
    }

    /**
     * Returns whether a payload is the success sentinel.
     */
    public static boolean isDone(String payload) {
        return Protocol.DONE_SENTINEL.equals(payload);
    }

    private String decode(ByteBuffer in, boolean endOfInput) {
        CharBuffer out = CharBuffer.allocate(Math.max(16, in.remaining() * 2));
        StringBuilder sb = new StringBuilder(out.capacity());
        while (true) {
            CoderResult result = decoder.decode(in, out, endOfInput);
            out.flip();
            sb.append(out);
            out.clear();
            if (!result.isOverflow()) {
                return sb.toString();
            }
        }
    }

    private List<String> drainLines() {
        List<String> lines = new ArrayList<>();
        int start = 0;
        int newline;
        while ((newline = lineBuffer.indexOf("\n", start)) >= 0) {
            int end = newline;
            if (end > start && lineBuffer.charAt(end - 1) == '\r') {
                end--;
            }
            lines.add(lineBuffer.substring(start, end));
            start = newline + 1;
        }
        if (start > 0) {
            lineBuffer.delete(0, start);
        }
        return lines;
    }
}
