package com.vidsum.chatbot.service.generation;

import com.vidsum.chatbot.model.ChatTurn;
import com.vidsum.chatbot.service.context.AssembledPrompt;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Offline generator that answers from the citation list alone, streamed word by word.
 */
@Component
@Profile("template")
public class TemplateStreamingGenerator implements StreamingGenerator {

    private static final Pattern WORD = Pattern.compile("\\S+\\s*|\\s+");

    @Override
    public Flux<String> generate(AssembledPrompt prompt) {
        return Flux.defer(() -> Flux.fromIterable(split(synthesizeAnswer(prompt))));
    }

    String synthesizeAnswer(AssembledPrompt prompt) {
        List<ChatTurn> conversation = prompt.conversation();
        String question = conversation.isEmpty() ? "" : conversation.get(conversation.size() - 1).content().trim();
        StringBuilder builder = new StringBuilder();
        if (prompt.citations().isEmpty()) {
            builder.append("I don't have information about that in my video summaries.");
            return builder.toString();
        }
        builder.append("Here is what the video summaries say about \"").append(question).append("\":\n");
        for (Map.Entry<Integer, String> citation : prompt.citations().entrySet()) {
            builder.append("- [Source ")
                    .append(citation.getKey())
                    .append("] ")
                    .append(citation.getValue())
                    .append('\n');
        }
        return builder.toString();
    }

    static List<String> split(String text) {
        List<String> words = new ArrayList<>();
        Matcher matcher = WORD.matcher(text);
        while (matcher.find()) {
            words.add(matcher.group());
        }
        return words;
    }
}
