package com.vidsum.chatbot.service;

import com.vidsum.chatbot.client.ReplyAccumulator;
import com.vidsum.chatbot.client.ReplySnapshot;
import com.vidsum.chatbot.model.ChatMessageRole;
import com.vidsum.chatbot.model.ChatRequest;
import com.vidsum.chatbot.model.ChatResponse;
import com.vidsum.chatbot.model.ChatTurn;
import com.vidsum.chatbot.model.RetrievalResult;
import com.vidsum.chatbot.model.StreamEvent;
import com.vidsum.chatbot.service.context.AssembledPrompt;
import com.vidsum.chatbot.service.context.ContextAssembler;
import com.vidsum.chatbot.service.generation.GenerationFailedException;
import com.vidsum.chatbot.service.generation.StreamingGenerator;
import com.vidsum.chatbot.service.guardrail.GuardrailDecision;
import com.vidsum.chatbot.service.guardrail.GuardrailDirection;
import com.vidsum.chatbot.service.guardrail.GuardrailGate;
import com.vidsum.chatbot.service.guardrail.GuardrailUnavailableException;
import com.vidsum.chatbot.service.retrieval.RetrievalUnavailableException;
import com.vidsum.chatbot.service.retrieval.Retriever;
import com.vidsum.chatbot.service.session.SessionCorrelator;
import com.vidsum.chatbot.telemetry.LogValues;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

@Service
public class DefaultChatService implements ChatService {

    private static final Logger log = LoggerFactory.getLogger(DefaultChatService.class);
    private static final String GUARDRAIL_METRIC = "chat.guardrail.blocks";
    private static final String RETRIEVAL_UNAVAILABLE_METRIC = "chat.retrieval.unavailable";
    private static final String GENERATION_FAILURE_METRIC = "chat.generation.failures";
    private static final String CITATION_METRIC = "chat.citations";
    private static final String TTFT_METRIC = "chat.ttft";

    static final String EMPTY_QUERY_MESSAGE = "Please provide a question.";
    static final String NOTICE_SEPARATOR = "\n\n";
    static final String GENERIC_FAILURE = "The assistant failed to answer. Please try again.";

    private final Retriever retriever;
    private final GuardrailGate guardrailGate;
    private final ContextAssembler contextAssembler;
    private final StreamingGenerator generator;
    private final SessionCorrelator sessionCorrelator;
    private final MeterRegistry meterRegistry;
    private final String knowledgeBase;
    private final int topK;
    private final double threshold;

    public DefaultChatService(Retriever retriever,
                              GuardrailGate guardrailGate,
                              ContextAssembler contextAssembler,
                              StreamingGenerator generator,
                              SessionCorrelator sessionCorrelator,
                              MeterRegistry meterRegistry,
                              @Value("${chat.retrieval.collection:video_summaries}") String knowledgeBase,
                              @Value("${chat.retrieval.top-k:5}") int topK,
                              @Value("${chat.retrieval.threshold:0.5}") double threshold) {
        this.retriever = retriever;
        this.guardrailGate = guardrailGate;
        this.contextAssembler = contextAssembler;
        this.generator = generator;
        this.sessionCorrelator = sessionCorrelator;
        this.meterRegistry = meterRegistry;
        this.knowledgeBase = knowledgeBase;
        this.topK = topK;
        this.threshold = threshold;
    }

    @Override
    public Flux<StreamEvent> streamChat(ChatRequest request) {
        return Flux.defer(() -> {
            if (knowledgeBase == null || knowledgeBase.isBlank()) {
                return Flux.error(new ChatServiceUnavailableException("Knowledge Base not configured"));
            }
            Session session = Session.of(sessionCorrelator.correlate(request.sessionId()));
            String query = latestUserUtterance(request.messages());
            if (query.isBlank()) {
                return Flux.just(StreamEvent.chunk(EMPTY_QUERY_MESSAGE), StreamEvent.done(session.id()));
            }
            log.debug("Session {} query: {}", session.label(), LogValues.abbreviate(query, 100));

            Timer.Sample ttft = Timer.start(meterRegistry);
            AtomicBoolean firstChunk = new AtomicBoolean(true);
            return guardrailGate.evaluate(query, GuardrailDirection.INPUT)
                    .flatMapMany(decision -> decision.blocked()
                            ? inputBlocked(decision, session)
                            : answer(request, query, session))
                    .doOnNext(event -> {
                        if (event instanceof StreamEvent.Chunk && firstChunk.compareAndSet(true, false)) {
                            ttft.stop(meterRegistry.timer(TTFT_METRIC));
                        }
                    })
                    .doOnCancel(() -> log.info("Session {} disconnected, generation released", session.label()));
        });
    }

    @Override
    public Mono<ChatResponse> completeChat(ChatRequest request) {
        return streamChat(request)
                .reduceWith(ReplyAccumulator::new, ReplyAccumulator::apply)
                .map(ReplyAccumulator::snapshot)
                .map(this::toResponse);
    }

    private ChatResponse toResponse(ReplySnapshot snapshot) {
        if (snapshot.failed()) {
            throw new GenerationFailedException(snapshot.errorDetail());
        }
        return new ChatResponse(snapshot.content(), snapshot.sources(), snapshot.sessionId());
    }

    private Flux<StreamEvent> inputBlocked(GuardrailDecision decision, Session session) {
        log.info("Session {} input blocked by guardrail", session.label());
        meterRegistry.counter(GUARDRAIL_METRIC, "direction", "input").increment();
        return Flux.just(StreamEvent.chunk(decision.message()), StreamEvent.done(session.id()));
    }

    private Flux<StreamEvent> answer(ChatRequest request, String query, Session session) {
        return retriever.search(query, topK, threshold)
                .onErrorResume(RetrievalUnavailableException.class, ex -> {
                    log.warn("Session {} answering without context, retrieval unavailable: {}", session.label(), ex.getMessage());
                    meterRegistry.counter(RETRIEVAL_UNAVAILABLE_METRIC).increment();
                    return Mono.just(List.of());
                })
                .flatMapMany(passages -> generate(request.messages(), passages, session));
    }

    private Flux<StreamEvent> generate(List<ChatTurn> turns, List<RetrievalResult> passages, Session session) {
        AssembledPrompt prompt = contextAssembler.assemble(turns, passages);
        StringBuilder answer = new StringBuilder();
        // concatMap keeps deltas in arrival order; the tail is only subscribed once generation completes
        return generator.generate(prompt)
                .filter(delta -> !delta.isEmpty())
                .concatMap(delta -> {
                    answer.append(delta);
                    return Mono.just(StreamEvent.chunk(delta));
                })
                .concatWith(Flux.defer(() -> finishAnswer(answer.toString(), prompt, session)))
                .onErrorResume(ex -> generationFailed(ex, session));
    }

    private Flux<StreamEvent> finishAnswer(String answer, AssembledPrompt prompt, Session session) {
        return guardrailGate.evaluate(answer, GuardrailDirection.OUTPUT)
                .onErrorResume(GuardrailUnavailableException.class, ex -> {
                    log.warn("Session {} output check skipped: {}", session.label(), ex.getMessage());
                    return Mono.just(GuardrailDecision.allowed());
                })
                .flatMapMany(decision -> {
                    if (decision.blocked()) {
                        log.info("Session {} output blocked by guardrail after {} chars", session.label(), answer.length());
                        meterRegistry.counter(GUARDRAIL_METRIC, "direction", "output").increment();
                        String notice = answer.isEmpty() ? decision.message() : NOTICE_SEPARATOR + decision.message();
                        return Flux.just(StreamEvent.chunk(notice), StreamEvent.done(session.id()));
                    }
                    meterRegistry.counter(CITATION_METRIC, "present", Boolean.toString(!prompt.sources().isEmpty()))
                            .increment();
                    return Flux.just(StreamEvent.sources(prompt.sources()), StreamEvent.done(session.id()));
                });
    }

    private Flux<StreamEvent> generationFailed(Throwable ex, Session session) {
        meterRegistry.counter(GENERATION_FAILURE_METRIC).increment();
        if (ex instanceof GenerationFailedException) {
            log.error("Session {} generation failed: {}", session.label(), ex.getMessage());
            return Flux.just(StreamEvent.error(ex.getMessage() == null ? GENERIC_FAILURE : ex.getMessage()));
        }
        log.error("Session {} stream failed unexpectedly", session.label(), ex);
        return Flux.just(StreamEvent.error(GENERIC_FAILURE));
    }

    private String latestUserUtterance(List<ChatTurn> turns) {
        if (turns == null) {
            return "";
        }
        for (int i = turns.size() - 1; i >= 0; i--) {
            ChatTurn turn = turns.get(i);
            if (turn.role() == ChatMessageRole.USER) {
                return turn.content() == null ? "" : turn.content().trim();
            }
        }
        return "";
    }

    /**
     * The correlated id echoed to the caller, and the same id flattened for log lines.
     */
    private record Session(String id, String label) {

        static Session of(String id) {
            return new Session(id, LogValues.abbreviate(id, 64));
        }
    }
}
