package com.motherrealm.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MotherRealmApplication {

  public static void main(String[] args) {
    SpringApplication.run(MotherRealmApplication.class, args);
  }
}
