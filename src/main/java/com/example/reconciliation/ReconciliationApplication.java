package com.example.reconciliation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReconciliationApplication {

  public static void main(String[] args) {
    SpringApplication.run(ReconciliationApplication.class, args);
  }
}
