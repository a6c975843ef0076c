package com.vidsum.chatbot.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient retrievalWebClient(WebClient.Builder builder,
                                        @Value("${chat.retrieval.base-url:http://localhost:6333}") String baseUrl,
                                        @Value("${chat.retrieval.api-key:}") String apiKey) {
        return authorized(baseClient(builder, baseUrl), "api-key", apiKey).build();
    }

    @Bean
    public WebClient guardrailWebClient(WebClient.Builder builder,
                                        @Value("${chat.guardrail.base-url:http://localhost:8090}") String baseUrl,
                                        @Value("${chat.guardrail.api-key:}") String apiKey) {
        return authorized(baseClient(builder, baseUrl), HttpHeaders.AUTHORIZATION, bearer(apiKey)).build();
    }

    @Bean
    public WebClient llmWebClient(WebClient.Builder builder,
                                  @Value("${chat.llm.base-url:https://api.openai.com}") String baseUrl,
                                  @Value("${chat.llm.api-key:}") String apiKey,
                                  @Value("${chat.llm.timeout-seconds:60}") long timeoutSeconds) {
        WebClient.Builder llm = baseClient(builder, baseUrl);
        if (timeoutSeconds > 0) {
            HttpClient httpClient = HttpClient.create()
                    .responseTimeout(Duration.ofSeconds(timeoutSeconds));
            llm.clientConnector(new ReactorClientHttpConnector(httpClient));
        }
        llm.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        return authorized(llm, HttpHeaders.AUTHORIZATION, bearer(apiKey)).build();
    }

    private WebClient.Builder baseClient(WebClient.Builder builder, String baseUrl) {
        return builder.clone()
                .baseUrl(baseUrl)
                .exchangeStrategies(exchangeStrategies());
    }

    private WebClient.Builder authorized(WebClient.Builder builder, String header, String value) {
        if (value != null && !value.isBlank()) {
            builder.defaultHeader(header, value);
        }
        return builder;
    }

    private String bearer(String apiKey) {
        return apiKey == null || apiKey.isBlank() ? null : "Bearer " + apiKey;
    }

    private ExchangeStrategies exchangeStrategies() {
        return ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .build();
    }
}
