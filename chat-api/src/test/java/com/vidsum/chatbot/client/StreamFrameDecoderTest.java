package com.vidsum.chatbot.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidsum.chatbot.codec.StreamEventCodec;
import com.vidsum.chatbot.model.Source;
import com.vidsum.chatbot.model.StreamEvent;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class StreamFrameDecoderTest {

    private final StreamEventCodec codec = new StreamEventCodec(new ObjectMapper());

    @Test
    void reconstructsContentForEveryTwoWaySplitOfTheByteStream() {
        byte[] stream = encode(
                StreamEvent.chunk("Grüße aus "),
                StreamEvent.chunk("東京 🚀"),
                StreamEvent.chunk(" and done"),
                StreamEvent.sources(List.of(new Source("s3://kb/Tokyo_Trip.md", 0.91))),
                StreamEvent.done("session-7"));

        for (int split = 0; split <= stream.length; split++) {
            ReplySnapshot snapshot = decode(List.of(
                    Arrays.copyOfRange(stream, 0, split),
                    Arrays.copyOfRange(stream, split, stream.length)));

            assertThat(snapshot.content()).as("split at %d", split).isEqualTo("Grüße aus 東京 🚀 and done");
            assertThat(snapshot.sessionId()).isEqualTo("session-7");
            assertThat(snapshot.sources()).containsExactly(new Source("s3://kb/Tokyo_Trip.md", 0.91));
        }
    }

    @Test
    void reconstructsContentForRandomReadSizes() {
        byte[] stream = encode(
                StreamEvent.chunk("Ünïcödé "),
                StreamEvent.chunk("chunks 😀😀"),
                StreamEvent.chunk(" end"),
                StreamEvent.done("s"));
        Random random = new Random(42);

        for (int run = 0; run < 200; run++) {
            List<byte[]> reads = new ArrayList<>();
            int offset = 0;
            while (offset < stream.length) {
                int size = Math.min(stream.length - offset, 1 + random.nextInt(7));
                reads.add(Arrays.copyOfRange(stream, offset, offset + size));
                offset += size;
            }

            assertThat(decode(reads).content()).isEqualTo("Ünïcödé chunks 😀😀 end");
        }
    }

    @Test
    void malformedFrameDoesNotCorruptFollowingFrames() {
        byte[] stream = ("data: {\"type\":\"chunk\",\"content\":\"before \"}\n\n"
                + "data: {not json\n\n"
                + "data: {\"type\":\"chunk\",\"content\":\"ok\"}\n\n"
                + "data: {\"type\":\"done\",\"session_id\":\"x\"}\n\n").getBytes(StandardCharsets.UTF_8);

        ReplySnapshot snapshot = decode(List.of(stream));

        assertThat(snapshot.content()).isEqualTo("before ok");
        assertThat(snapshot.completed()).isTrue();
    }

    @Test
    void incompleteLineIsHeldUntilTheRestArrives() {
        StreamFrameDecoder decoder = new StreamFrameDecoder(codec);

        assertThat(decoder.feed("data: {\"type\":\"chunk\",".getBytes(StandardCharsets.UTF_8))).isEmpty();
        assertThat(decoder.feed("\"content\":\"hi\"}".getBytes(StandardCharsets.UTF_8))).isEmpty();
        assertThat(decoder.feed("\n\n".getBytes(StandardCharsets.UTF_8)))
                .containsExactly(StreamEvent.chunk("hi"));
    }

    @Test
    void finishParsesTrailingLineWithoutNewline() {
        StreamFrameDecoder decoder = new StreamFrameDecoder(codec);

        decoder.feed("data: {\"type\":\"done\",\"session_id\":\"tail\"}".getBytes(StandardCharsets.UTF_8));

        assertThat(decoder.finish()).containsExactly(StreamEvent.done("tail"));
    }

    private ReplySnapshot decode(List<byte[]> reads) {
        StreamFrameDecoder decoder = new StreamFrameDecoder(codec);
        ReplyAccumulator accumulator = new ReplyAccumulator();
        for (byte[] read : reads) {
            decoder.feed(read).forEach(accumulator::apply);
        }
        decoder.finish().forEach(accumulator::apply);
        return accumulator.snapshot();
    }

    private byte[] encode(StreamEvent... events) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (StreamEvent event : events) {
            out.writeBytes(codec.encode(event).getBytes(StandardCharsets.UTF_8));
        }
        return out.toByteArray();
    }
}
