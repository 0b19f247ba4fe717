package com.motherrealm.backend.support;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

/** Spring context backed by the in-memory H2 schema from the test profile; tables start empty. */
@SpringBootTest
@ActiveProfiles("test")
public abstract class DatabaseIntegrationTest {

  private static final String[] TABLES = {
    "conversation_message",
    "conversation",
    "context_entry",
    "voice_profile",
    "user_preference",
    "agent_worker"
  };

  @Autowired protected JdbcTemplate jdbcTemplate;

  @BeforeEach
  void clearTables() {
    for (String table : TABLES) {
      jdbcTemplate.execute("DELETE FROM " + table);
    }
  }
}
