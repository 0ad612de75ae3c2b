package com.hatch.messagingapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MessagingApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(MessagingApiApplication.class, args);
  }
}
