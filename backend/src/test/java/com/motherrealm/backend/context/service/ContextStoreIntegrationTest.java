package com.motherrealm.backend.context.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.motherrealm.backend.context.domain.ContextEntry;
import com.motherrealm.backend.context.service.ContextPromptService.EnrichedPrompt;
import com.motherrealm.backend.support.DatabaseIntegrationTest;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class ContextStoreIntegrationTest extends DatabaseIntegrationTest {

  @Autowired private ContextStoreService contextStoreService;

  @Autowired private ContextPromptService contextPromptService;

  @Autowired private ObjectMapper objectMapper;

  @Test
  void recentIsBoundedChronologicalAndScopedToThePair() throws Exception {
    for (int i = 1; i <= 7; i++) {
      contextStoreService.append("user-1", "agentA", "q" + i, "r" + i, null);
    }
    contextStoreService.append("user-1", "agentB", "other agent", "x", null);
    contextStoreService.append("user-2", "agentA", "other user", "y", null);

    List<ContextEntry> recent = contextStoreService.recent("user-1", "agentA", 3);

    assertThat(recent).extracting(ContextEntry::getQuery).containsExactly("q5", "q6", "q7");
    assertThat(recent)
        .allSatisfy(
            entry -> {
              assertThat(entry.getUserId()).isEqualTo("user-1");
              assertThat(entry.getAgentName()).isEqualTo("agentA");
            });
    assertThat(contextStoreService.recent("user-1", "agentA", null)).hasSize(5);
    assertThat(contextStoreService.recent("user-1", "agentA", 0)).isEmpty();
    assertThat(contextStoreService.recent("user-3", "agentA", 5)).isEmpty();
  }

  @Test
  void payloadIsStoredAsStructuredJson() throws Exception {
    long id =
        contextStoreService.append(
            "user-1", "agentA", "q", "r", objectMapper.readTree("{\"topic\":\"weather\",\"turn\":2}"));

    ContextEntry stored = contextStoreService.recent("user-1", "agentA", 1).get(0);

    assertThat(stored.getId()).isEqualTo(id);
    assertThat(stored.getPayload().asJson().path("topic").asText()).isEqualTo("weather");
    assertThat(stored.getPayload().asJson().path("turn").asInt()).isEqualTo(2);
  }

  @Test
  void enrichWrapsPromptWithHistoryOnlyWhenHistoryExists() {
    EnrichedPrompt untouched = contextPromptService.enrich("user-1", "agentA", "What now?");
    assertThat(untouched.prompt()).isEqualTo("What now?");
    assertThat(untouched.historySize()).isZero();

    contextStoreService.append("user-1", "agentA", "Hello", "Hi there", null);
    EnrichedPrompt enriched = contextPromptService.enrich("user-1", "agentA", "What now?");

    assertThat(enriched.historySize()).isEqualTo(1);
    assertThat(enriched.prompt())
        .startsWith("The following conversation history provides context for the current query:")
        .contains("Previous query (")
        .contains("): Hello")
        .contains("Previous response: Hi there")
        .endsWith("Current query: What now?");
  }
}
