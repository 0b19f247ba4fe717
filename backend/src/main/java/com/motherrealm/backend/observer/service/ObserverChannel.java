package com.motherrealm.backend.observer.service;

import com.motherrealm.backend.observer.api.ObserverEvent;
import java.io.IOException;

/** Outbound side of one connected viewer, independent of the transport that carries it. */
public interface ObserverChannel {

  String id();

  boolean isOpen();

  void send(ObserverEvent event) throws IOException;

  default void close() {}
}
