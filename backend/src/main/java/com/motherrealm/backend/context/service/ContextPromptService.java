package com.motherrealm.backend.context.service;

import com.motherrealm.backend.context.domain.ContextEntry;
import java.util.List;
import org.springframework.stereotype.Service;

/** Turns a pair's recent history into prompt text for the next query. */
@Service
public class ContextPromptService {

  private final ContextStoreService contextStoreService;

  public ContextPromptService(ContextStoreService contextStoreService) {
    this.contextStoreService = contextStoreService;
  }

  public String transcript(String userId, String agentName, Integer limit) {
    return render(contextStoreService.recentOrEmpty(userId, agentName, limit));
  }

  public EnrichedPrompt enrich(String userId, String agentName, String prompt) {
    List<ContextEntry> history = contextStoreService.recentOrEmpty(userId, agentName, null);
    if (history.isEmpty()) {
      return new EnrichedPrompt(prompt, 0);
    }
    String enriched =
        "The following conversation history provides context for the current query:\n\n"
            + render(history)
            + "\n\nCurrent query: "
            + prompt;
    return new EnrichedPrompt(enriched, history.size());
  }

  static String render(List<ContextEntry> entries) {
    StringBuilder builder = new StringBuilder();
    for (ContextEntry entry : entries) {
      builder
          .append("Previous query (")
          .append(entry.getCreatedAt())
          .append("): ")
          .append(entry.getQuery())
          .append('\n')
          .append("Previous response: ")
          .append(entry.getResponse())
          .append("\n\n");
    }
    return builder.toString().strip();
  }

  public record EnrichedPrompt(String prompt, int historySize) {}
}
