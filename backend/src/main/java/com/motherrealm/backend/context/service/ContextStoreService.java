package com.motherrealm.backend.context.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.motherrealm.backend.common.exception.InvalidCommandException;
import com.motherrealm.backend.common.exception.StoreUnavailableException;
import com.motherrealm.backend.context.config.ContextProperties;
import com.motherrealm.backend.context.domain.ContextEntry;
import com.motherrealm.backend.context.domain.ContextPayload;
import com.motherrealm.backend.context.persistence.ContextEntryRepository;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Append-only log of query/response pairs per (user, agent). Lookups only ever filter on both
 * identities, so entries of one pair never leak into another pair's history.
 */
@Service
public class ContextStoreService {

  private static final Logger log = LoggerFactory.getLogger(ContextStoreService.class);

  private final ContextEntryRepository contextEntryRepository;
  private final ContextProperties properties;

  public ContextStoreService(
      ContextEntryRepository contextEntryRepository, ContextProperties properties) {
    this.contextEntryRepository = contextEntryRepository;
    this.properties = properties;
  }

  @Transactional
  public long append(
      String userId, String agentName, String query, String response, JsonNode payload) {
    requireIdentity("userId", userId);
    requireIdentity("agent", agentName);
    try {
      ContextEntry saved =
          contextEntryRepository.save(
              new ContextEntry(userId, agentName, query, response, ContextPayload.from(payload)));
      if (log.isDebugEnabled()) {
        log.debug("Context entry {} stored for user {} and agent {}", saved.getId(), userId, agentName);
      }
      return saved.getId();
    } catch (DataAccessException failure) {
      throw new StoreUnavailableException("context append", failure);
    }
  }

  /**
   * Returns at most {@code limit} of the most recent entries of the pair in chronological order.
   * A missing limit falls back to the configured default; a non-positive one yields no entries.
   */
  @Transactional(readOnly = true)
  public List<ContextEntry> recent(String userId, String agentName, Integer limit) {
    if (!StringUtils.hasText(userId) || !StringUtils.hasText(agentName)) {
      return List.of();
    }
    int size = properties.resolveLimit(limit);
    if (size == 0) {
      return List.of();
    }
    List<ContextEntry> newestFirst;
    try {
      newestFirst =
          contextEntryRepository.findByUserIdAndAgentNameOrderByCreatedAtDescIdDesc(
              userId, agentName, PageRequest.of(0, size));
    } catch (DataAccessException | TransactionException failure) {
      throw new StoreUnavailableException("context lookup", failure);
    }
    List<ContextEntry> chronological = new ArrayList<>(newestFirst);
    Collections.reverse(chronological);
    return List.copyOf(chronological);
  }

  /**
   * Same as {@link #recent} but degrades to an empty history when the store is unavailable, so an
   * orchestration flow can continue without context instead of aborting.
   */
  public List<ContextEntry> recentOrEmpty(String userId, String agentName, Integer limit) {
    try {
      return recent(userId, agentName, limit);
    } catch (StoreUnavailableException unavailable) {
      log.warn(
          "Context for user {} and agent {} unavailable, continuing without history",
          userId,
          agentName,
          unavailable.getCause());
      return List.of();
    }
  }

  private static void requireIdentity(String field, String value) {
    if (!StringUtils.hasText(value)) {
      throw new InvalidCommandException(field + " must not be blank");
    }
  }
}
