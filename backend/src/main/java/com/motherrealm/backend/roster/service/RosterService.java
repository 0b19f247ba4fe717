package com.motherrealm.backend.roster.service;

import com.motherrealm.backend.common.exception.NotFoundException;
import com.motherrealm.backend.observer.api.ObserverEvent;
import com.motherrealm.backend.roster.api.AgentView;
import com.motherrealm.backend.roster.domain.AgentWorker;
import com.motherrealm.backend.roster.persistence.AgentWorkerRepository;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Slf4j
public class RosterService {

  private final AgentWorkerRepository agentWorkerRepository;
  private final ApplicationEventPublisher eventPublisher;

  public RosterService(
      AgentWorkerRepository agentWorkerRepository, ApplicationEventPublisher eventPublisher) {
    this.agentWorkerRepository = agentWorkerRepository;
    this.eventPublisher = eventPublisher;
  }

  @Transactional
  public AgentView register(String name, String address, String type) {
    AgentWorker worker =
        agentWorkerRepository
            .findByNameForUpdate(name)
            .map(
                existing -> {
                  existing.updateEndpoint(address, type);
                  return existing;
                })
            .orElseGet(() -> new AgentWorker(name, address, type));
    AgentWorker saved = agentWorkerRepository.save(worker);
    log.info("Agent {} registered (type={}, address={})", name, type, address);
    publishRosterUpdate();
    return AgentView.from(saved);
  }

  @Transactional
  public void remove(String name) {
    AgentWorker worker =
        agentWorkerRepository
            .findByNameForUpdate(name)
            .filter(existing -> !existing.isBlacklisted())
            .orElseThrow(() -> NotFoundException.agent(name));
    worker.blacklist();
    agentWorkerRepository.save(worker);
    log.info("Agent {} removed from roster", name);
    publishRosterUpdate();
  }

  @Transactional(readOnly = true)
  public List<AgentView> listActive() {
    return agentWorkerRepository.findByBlacklistedFalseOrderByNameAsc().stream()
        .map(AgentView::from)
        .toList();
  }

  @Transactional(readOnly = true)
  public Optional<AgentView> find(String name) {
    return agentWorkerRepository
        .findById(name)
        .filter(worker -> !worker.isBlacklisted())
        .map(AgentView::from);
  }

  @Transactional(readOnly = true)
  public ObserverEvent snapshot() {
    return ObserverEvent.rosterUpdate(listActive());
  }

  /** Publishes the current roster; call inside the transaction that changed it. */
  public void publishRosterUpdate() {
    eventPublisher.publishEvent(ObserverEvent.rosterUpdate(listActive()));
  }
}
