package com.motherrealm.backend.observer.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ObserverProperties.class)
public class ObserverConfiguration {

  @Bean(name = "observerDispatchExecutor", destroyMethod = "shutdown")
  public ExecutorService observerDispatchExecutor(ObserverProperties properties) {
    ThreadFactory threadFactory =
        new ThreadFactory() {
          private final AtomicInteger index = new AtomicInteger();

          @Override
          public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName("observer-dispatch-" + index.incrementAndGet());
            thread.setDaemon(true);
            return thread;
          }
        };
    return Executors.newFixedThreadPool(properties.getDispatchThreads(), threadFactory);
  }
}
