package com.vidsum.chatbot.service.context;

import com.vidsum.chatbot.model.ChatMessageRole;
import com.vidsum.chatbot.model.ChatTurn;
import com.vidsum.chatbot.model.RetrievalResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the generation prompt from the fixed instruction, the caller's conversation and the
 * retrieved passages. When the input budget is exceeded, history is dropped oldest turn first;
 * only then are the lowest scoring passages dropped. The current user turn and the best passage
 * are always kept.
 */
@Component
public class ContextAssembler {

    private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);

    static final String SYSTEM_PROMPT = """
            You are a helpful assistant that answers questions about YouTube videos that have been analyzed and summarized.

            You ONLY answer based on the retrieved context provided below. If the context does not contain relevant information to answer the question, respond with: "I don't have information about that in my video summaries."

            Do NOT make up information or use knowledge outside of the provided context. Always cite which video(s) your answer comes from when possible, using the [Source N] labels.

            Retrieved context:
            %s""";
    static final String NO_CONTEXT = "No relevant context found.";
    private static final String PASSAGE_SEPARATOR = "\n\n---\n\n";
    private static final int TURN_OVERHEAD_TOKENS = 4;

    private final TokenBudget budget;

    public ContextAssembler(@Value("${chat.context.max-input-tokens:6000}") int maxInputTokens) {
        this.budget = new TokenBudget(Math.max(256, maxInputTokens));
    }

    public AssembledPrompt assemble(List<ChatTurn> turns, List<RetrievalResult> passages) {
        List<RetrievalResult> ranked = new ArrayList<>(passages == null ? List.<RetrievalResult>of() : passages);
        ranked.sort(Comparator.comparingDouble(RetrievalResult::score).reversed());

        List<ChatTurn> conversation = conversationTurns(turns);
        int currentIndex = currentUserTurn(conversation);
        ChatTurn current = currentIndex < 0 ? null : conversation.get(currentIndex);
        LinkedList<ChatTurn> history = new LinkedList<>(currentIndex < 0 ? conversation : conversation.subList(0, currentIndex));

        boolean truncated = false;
        int tokens = estimate(ranked, history, current);
        while (!budget.fits(tokens) && !history.isEmpty()) {
            history.removeFirst();
            truncated = true;
            tokens = estimate(ranked, history, current);
        }
        while (!budget.fits(tokens) && ranked.size() > 1) {
            ranked.remove(ranked.size() - 1);
            truncated = true;
            tokens = estimate(ranked, history, current);
        }
        if (truncated) {
            log.debug("Prompt truncated to {} history turns and {} passages (~{} tokens, budget {})",
                    history.size(), ranked.size(), tokens, budget.maxTokens());
        }

        List<ChatTurn> retained = new ArrayList<>(history);
        if (current != null) {
            retained.add(current);
        }
        Map<Integer, String> citations = new LinkedHashMap<>();
        for (int i = 0; i < ranked.size(); i++) {
            citations.put(i + 1, ranked.get(i).uri());
        }
        return new AssembledPrompt(
                renderSystemPrompt(ranked),
                List.copyOf(retained),
                Collections.unmodifiableMap(citations),
                SourceRanking.deduplicate(ranked),
                truncated
        );
    }

    static String renderSystemPrompt(List<RetrievalResult> passages) {
        if (passages.isEmpty()) {
            return SYSTEM_PROMPT.formatted(NO_CONTEXT);
        }
        List<String> parts = new ArrayList<>(passages.size());
        for (int i = 0; i < passages.size(); i++) {
            parts.add(renderPassage(i + 1, passages.get(i)));
        }
        return SYSTEM_PROMPT.formatted(String.join(PASSAGE_SEPARATOR, parts));
    }

    private static String renderPassage(int index, RetrievalResult passage) {
        String uri = passage.uri() == null || passage.uri().isBlank() ? "unknown" : passage.uri();
        return String.format(Locale.ROOT, "[Source %d] (uri: %s, score: %.2f)\n%s",
                index, uri, passage.score(), passage.text() == null ? "" : passage.text().trim());
    }

    private int estimate(List<RetrievalResult> passages, List<ChatTurn> history, ChatTurn current) {
        int tokens = TokenBudget.estimate(renderSystemPrompt(passages));
        for (ChatTurn turn : history) {
            tokens += TokenBudget.estimate(turn.content()) + TURN_OVERHEAD_TOKENS;
        }
        if (current != null) {
            tokens += TokenBudget.estimate(current.content()) + TURN_OVERHEAD_TOKENS;
        }
        return tokens;
    }

    // Error turns are rendered client side only and never reach the model.
    private List<ChatTurn> conversationTurns(List<ChatTurn> turns) {
        if (turns == null) {
            return List.of();
        }
        return turns.stream()
                .filter(turn -> turn.role() == ChatMessageRole.USER || turn.role() == ChatMessageRole.ASSISTANT)
                .filter(turn -> turn.content() != null)
                .toList();
    }

    private int currentUserTurn(List<ChatTurn> conversation) {
        for (int i = conversation.size() - 1; i >= 0; i--) {
            ChatTurn turn = conversation.get(i);
            if (turn.role() == ChatMessageRole.USER && !turn.content().isBlank()) {
                return i;
            }
        }
        return -1;
    }
}
