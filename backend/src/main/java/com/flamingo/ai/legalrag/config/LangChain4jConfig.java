package com.flamingo.ai.legalrag.config;

import com.flamingo.ai.legalrag.exception.MissingCredentialException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the reasoning engine and embedding provider (LangChain4j, OpenAI). */
@Configuration
public class LangChain4jConfig {

  /** The reasoning engine stops generating once it starts inventing a tool observation. */
  static final List<String> REACT_STOP_SEQUENCES = List.of("\nObservation:");

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-4-turbo}")
  private String chatModelName;

  @Value("${langchain4j.openai.chat-model.temperature:0.0}")
  private double temperature;

  @Value("${langchain4j.openai.chat-model.max-tokens:1024}")
  private int maxTokens;

  @Value("${langchain4j.openai.chat-model.timeout-seconds:60}")
  private long chatTimeoutSeconds;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Value("${langchain4j.openai.embedding-model.dimensions:1536}")
  private int embeddingDimensions;

  /** Plain-text chat model driving the query refinement loop (no JSON response format). */
  @Bean
  public ChatModel chatModel() {
    validateApiKey();

    return OpenAiChatModel.builder()
        .apiKey(openAiApiKey)
        .modelName(chatModelName)
        .temperature(temperature)
        .maxTokens(maxTokens)
        .stop(REACT_STOP_SEQUENCES)
        .timeout(Duration.ofSeconds(chatTimeoutSeconds))
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  @Bean
  public EmbeddingModel embeddingModel() {
    validateApiKey();

    return OpenAiEmbeddingModel.builder()
        .apiKey(openAiApiKey)
        .modelName(embeddingModelName)
        .dimensions(embeddingDimensions)
        .timeout(Duration.ofSeconds(30))
        .build();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new MissingCredentialException("OPENAI_API_KEY");
    }
  }
}
