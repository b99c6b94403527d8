package com.flamingo.ai.deepresearch.config;

import com.flamingo.ai.deepresearch.agent.AnswerSynthesisAgent;
import com.flamingo.ai.deepresearch.agent.EvidenceCompressionAgent;
import com.flamingo.ai.deepresearch.agent.EvidenceValidationAgent;
import com.flamingo.ai.deepresearch.agent.QueryGenerationAgent;
import com.flamingo.ai.deepresearch.agent.ReflectionAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the research agents using LangChain4j AI Services.
 *
 * <p>Pattern: define agent interfaces with @SystemMessage/@UserMessage, build concrete
 * implementations using AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /** Query generation agent. Returns raw JSON so parse failures can fall back to the question. */
  @Bean
  public QueryGenerationAgent queryGenerationAgent(ChatModel chatModel) {
    return AiServices.builder(QueryGenerationAgent.class).chatModel(chatModel).build();
  }

  /** Reflection agent deciding whether another research round is needed. */
  @Bean
  public ReflectionAgent reflectionAgent(ChatModel chatModel) {
    return AiServices.builder(ReflectionAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public EvidenceValidationAgent evidenceValidationAgent(ChatModel chatModel) {
    return AiServices.builder(EvidenceValidationAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public EvidenceCompressionAgent evidenceCompressionAgent(ChatModel chatModel) {
    return AiServices.builder(EvidenceCompressionAgent.class).chatModel(chatModel).build();
  }

  /** Final answer agent. */
  @Bean
  public AnswerSynthesisAgent answerSynthesisAgent(ChatModel chatModel) {
    return AiServices.builder(AnswerSynthesisAgent.class).chatModel(chatModel).build();
  }
}
