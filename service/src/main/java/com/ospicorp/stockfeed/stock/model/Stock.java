package com.ospicorp.stockfeed.stock.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.Immutable;

@Entity
@Immutable
@Table(name = "stocks")
public class Stock {

  @Id
  private Long id;

  @Column(nullable = false, unique = true)
  private String ticker;

  @Column(nullable = false)
  private String name;

  protected Stock() {
    // JPA default constructor
  }

  public Stock(Long id, String ticker, String name) {
    this.id = id;
    this.ticker = ticker;
    this.name = name;
  }

  public Long getId() {
    return id;
  }

  public String getTicker() {
    return ticker;
  }

  public String getName() {
    return name;
  }
}
