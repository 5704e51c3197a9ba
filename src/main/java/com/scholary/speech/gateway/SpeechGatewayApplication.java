package com.scholary.speech.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SpeechGatewayApplication {

  public static void main(String[] args) {
    SpringApplication.run(SpeechGatewayApplication.class, args);
  }
}
