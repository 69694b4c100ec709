package com.ukdataalerts.coronavirus.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class AreaResultTest {

  @Test
  void roundingIsForDisplayOnly() {
    AreaResult row = AreaResult.builder()
        .percentageChange(100.04)
        .per100000Rate(99.96)
        .rateColumn(true)
        .build();

    assertThat(row.getPercentageChange()).isEqualTo(100.04);
    assertThat(row.roundedPercentageChange()).isEqualTo(100.0);
    assertThat(row.roundedPer100000Rate()).isEqualTo(100.0);
    assertThat(AreaResult.builder().percentageChange(Double.POSITIVE_INFINITY).build().roundedPercentageChange())
        .isEqualTo(Double.POSITIVE_INFINITY);
  }
}
