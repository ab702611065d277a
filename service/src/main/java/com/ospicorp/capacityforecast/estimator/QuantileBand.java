package com.ospicorp.capacityforecast.estimator;

public record QuantileBand(double lower, double upper) {

  public boolean brackets(double point) {
    return lower <= point && point <= upper;
  }
}
