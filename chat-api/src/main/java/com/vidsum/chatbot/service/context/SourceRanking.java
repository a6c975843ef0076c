package com.vidsum.chatbot.service.context;

import com.vidsum.chatbot.model.RetrievalResult;
import com.vidsum.chatbot.model.Source;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class SourceRanking {

    private SourceRanking() {
    }

    /**
     * Collapses passages to one source per uri, keeping the best passage score, ordered by score
     * descending. Passages without a uri cannot be cited and are skipped.
     */
    public static List<Source> deduplicate(List<RetrievalResult> passages) {
        if (passages == null || passages.isEmpty()) {
            return List.of();
        }
        Map<String, Double> best = new LinkedHashMap<>();
        for (RetrievalResult passage : passages) {
            if (passage.uri() == null || passage.uri().isBlank()) {
                continue;
            }
            best.merge(passage.uri(), passage.score(), Math::max);
        }
        return best.entrySet().stream()
                .map(entry -> new Source(entry.getKey(), entry.getValue()))
                .sorted(Comparator.comparingDouble(Source::score).reversed())
                .toList();
    }
}
