package com.vidsum.chatbot.service.context;

import com.vidsum.chatbot.model.ChatTurn;
import com.vidsum.chatbot.model.Source;

import java.util.List;
import java.util.Map;

/**
 * Everything the generator needs for one turn, plus the bookkeeping to attribute the answer.
 *
 * @param systemPrompt instruction with the retained passages rendered in
 * @param conversation user and assistant turns that fit the budget, oldest first, ending with the current user turn
 * @param citations    citation number as rendered in the prompt mapped to the passage's source uri
 * @param sources      retained sources, one per uri, best score first
 * @param truncated    whether history or passages were dropped to fit the budget
 */
public record AssembledPrompt(String systemPrompt,
                              List<ChatTurn> conversation,
                              Map<Integer, String> citations,
                              List<Source> sources,
                              boolean truncated) {
}
