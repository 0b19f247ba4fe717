package com.motherrealm.backend.conversation.persistence;

import com.motherrealm.backend.conversation.domain.ConversationMessage;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ConversationMessageRepository extends JpaRepository<ConversationMessage, Long> {

  List<ConversationMessage> findByConversationIdOrderByIdAsc(String conversationId);

  long countByConversationId(String conversationId);

  @Query(
      "select m.conversation.id as conversationId, count(m) as messageCount "
          + "from ConversationMessage m where m.conversation.id in :ids group by m.conversation.id")
  List<MessageCount> countByConversationIds(@Param("ids") Collection<String> conversationIds);

  interface MessageCount {
    String getConversationId();

    long getMessageCount();
  }
}
