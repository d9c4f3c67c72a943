package com.ospicorp.stockfeed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StockFeedApplication {

  public static void main(String[] args) {
    SpringApplication.run(StockFeedApplication.class, args);
  }
}
