package com.vidsum.chatbot.service.retrieval;

import com.vidsum.chatbot.model.RetrievalResult;

import java.util.Comparator;
import java.util.List;

final class RankedPassages {

    private RankedPassages() {
    }

    static List<RetrievalResult> rank(List<RetrievalResult> passages, int k, double threshold) {
        if (passages == null || passages.isEmpty() || k <= 0) {
            return List.of();
        }
        return passages.stream()
                .filter(passage -> passage.score() >= threshold)
                .sorted(Comparator.comparingDouble(RetrievalResult::score).reversed())
                .limit(k)
                .toList();
    }
}
