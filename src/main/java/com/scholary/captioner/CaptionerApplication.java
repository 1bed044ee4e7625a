package com.scholary.captioner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CaptionerApplication {

  public static void main(String[] args) {
    SpringApplication.run(CaptionerApplication.class, args);
  }
}
