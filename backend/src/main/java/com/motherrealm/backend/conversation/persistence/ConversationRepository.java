package com.motherrealm.backend.conversation.persistence;

import com.motherrealm.backend.conversation.domain.Conversation;
import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ConversationRepository extends JpaRepository<Conversation, String> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select c from Conversation c where c.id = :id")
  Optional<Conversation> findByIdForUpdate(@Param("id") String id);

  List<Conversation> findByActiveTrueOrderByLastActivityAtDesc();
}
