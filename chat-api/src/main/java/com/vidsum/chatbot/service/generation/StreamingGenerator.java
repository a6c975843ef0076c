package com.vidsum.chatbot.service.generation;

import com.vidsum.chatbot.service.context.AssembledPrompt;
import reactor.core.publisher.Flux;

public interface StreamingGenerator {

    /**
     * Streams the answer as text deltas in the order the generation service produced them. The
     * sequence is lazy: nothing is requested until subscription, and cancelling the subscription
     * releases the upstream call. A mid-stream failure is signalled as
     * {@link GenerationFailedException} after the deltas already emitted.
     */
    Flux<String> generate(AssembledPrompt prompt);
}
