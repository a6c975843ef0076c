package com.vidsum.chatbot.client;

import com.vidsum.chatbot.codec.StreamEventCodec;
import com.vidsum.chatbot.model.StreamEvent;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Pull based decoder for a chat event stream. Bytes are fed as they arrive from the network in
 * whatever pieces the transport delivers; a frame or a multi-byte character split across two
 * reads is held back until the rest arrives. Not thread safe: one instance per stream.
 */
public class StreamFrameDecoder {

    private static final byte[] NO_BYTES = new byte[0];

    private final StreamEventCodec codec;
    private final CharsetDecoder charsetDecoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
    private final StringBuilder buffer = new StringBuilder();
    private byte[] pendingBytes = NO_BYTES;

    public StreamFrameDecoder(StreamEventCodec codec) {
        this.codec = codec;
    }

    /**
     * Appends raw bytes and returns the events of every line completed by them.
     */
    public List<StreamEvent> feed(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return List.of();
        }
        ByteBuffer in = ByteBuffer.allocate(pendingBytes.length + bytes.length);
        in.put(pendingBytes).put(bytes).flip();
        decodeChars(in, false);
        pendingBytes = new byte[in.remaining()];
        in.get(pendingBytes);
        return drainCompleteLines();
    }

    /**
     * Signals end of stream: flushes any incomplete character and parses a trailing line that was
     * not newline terminated.
     */
    public List<StreamEvent> finish() {
        ByteBuffer in = ByteBuffer.wrap(pendingBytes);
        decodeChars(in, true);
        CharBuffer out = CharBuffer.allocate(8);
        charsetDecoder.flush(out);
        out.flip();
        buffer.append(out);
        pendingBytes = NO_BYTES;
        charsetDecoder.reset();

        List<StreamEvent> events = new ArrayList<>(drainCompleteLines());
        if (buffer.length() > 0) {
            codec.decodeLine(buffer.toString()).ifPresent(events::add);
            buffer.setLength(0);
        }
        return events;
    }

    private void decodeChars(ByteBuffer in, boolean endOfInput) {
        CharBuffer out = CharBuffer.allocate(Math.max(8, in.remaining() * 2));
        CoderResult result = charsetDecoder.decode(in, out, endOfInput);
        if (result.isOverflow()) {
            throw new IllegalStateException("Character buffer overflow while decoding stream");
        }
        out.flip();
        buffer.append(out);
    }

    private List<StreamEvent> drainCompleteLines() {
        List<StreamEvent> events = new ArrayList<>();
        int newline;
        while ((newline = buffer.indexOf("\n")) >= 0) {
            String line = buffer.substring(0, newline);
            buffer.delete(0, newline + 1);
            if (!line.isEmpty()) {
                codec.decodeLine(line).ifPresent(events::add);
            }
        }
        return events;
    }
}
