package com.scholary.carrier.extractor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CarrierExtractorApplication {

  public static void main(String[] args) {
    SpringApplication.run(CarrierExtractorApplication.class, args);
  }
}
