package com.motherrealm.backend.voice.persistence;

import com.motherrealm.backend.voice.domain.VoiceProfile;
import jakarta.persistence.LockModeType;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface VoiceProfileRepository extends JpaRepository<VoiceProfile, String> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select v from VoiceProfile v where v.agentName = :agentName")
  Optional<VoiceProfile> findByAgentNameForUpdate(@Param("agentName") String agentName);
}
