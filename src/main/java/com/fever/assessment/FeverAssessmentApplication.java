package com.fever.assessment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FeverAssessmentApplication {

  public static void main(String[] args) {
    SpringApplication.run(FeverAssessmentApplication.class, args);
  }
}
