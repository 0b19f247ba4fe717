package com.motherrealm.backend.context.persistence;

import com.motherrealm.backend.context.domain.ContextEntry;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ContextEntryRepository extends JpaRepository<ContextEntry, Long> {

  List<ContextEntry> findByUserIdAndAgentNameOrderByCreatedAtDescIdDesc(
      String userId, String agentName, Pageable pageable);
}
