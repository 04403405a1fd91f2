package com.pld.mft;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MftLogisticsApplication {

  public static void main(String[] args) {
    SpringApplication.run(MftLogisticsApplication.class, args);
  }
}
