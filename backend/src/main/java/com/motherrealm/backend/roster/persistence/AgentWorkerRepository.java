package com.motherrealm.backend.roster.persistence;

import com.motherrealm.backend.roster.domain.AgentWorker;
import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface AgentWorkerRepository extends JpaRepository<AgentWorker, String> {

  List<AgentWorker> findByBlacklistedFalseOrderByNameAsc();

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select w from AgentWorker w where w.name = :name")
  Optional<AgentWorker> findByNameForUpdate(@Param("name") String name);
}
