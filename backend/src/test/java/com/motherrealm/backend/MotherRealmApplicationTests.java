package com.motherrealm.backend;

import static org.assertj.core.api.Assertions.assertThat;

import com.motherrealm.backend.observer.service.ObserverEventBroadcaster;
import com.motherrealm.backend.support.DatabaseIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class MotherRealmApplicationTests extends DatabaseIntegrationTest {

  @Autowired private ObserverEventBroadcaster broadcaster;

  @Test
  void contextLoads() {
    assertThat(broadcaster.subscriberCount()).isZero();
  }
}
