package com.motherrealm.backend.preference.persistence;

import com.motherrealm.backend.preference.domain.UserPreference;
import jakarta.persistence.LockModeType;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface UserPreferenceRepository extends JpaRepository<UserPreference, String> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select p from UserPreference p where p.userId = :userId")
  Optional<UserPreference> findByUserIdForUpdate(@Param("userId") String userId);
}
