package com.ukdataalerts.coronavirus.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.ukdataalerts.coronavirus.model.PopulationSourceType;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PopulationTableTest {

  @Test
  void ltlaIsKeyedByAreaCode() {
    var table = new PopulationTable(PopulationSourceType.LTLA, Map.of("E08000035", 793_139L));

    assertThat(table.lookupArea("Leeds", "E08000035")).hasValue(793_139L);
    assertThat(table.lookupArea("E08000035", "Leeds")).isEmpty();
  }

  @Test
  void nhsRegionIsKeyedByAliasedName() {
    var table = new PopulationTable(PopulationSourceType.NHS_REGION,
        Map.of("North East And Yorkshire", 8_566_000L, "London", 8_962_000L),
        Map.of("North East and Yorkshire", "North East And Yorkshire"));

    assertThat(table.lookupArea("North East and Yorkshire", "E40000009")).hasValue(8_566_000L);
    assertThat(table.lookupArea("London", "E40000003")).hasValue(8_962_000L);
    assertThat(table.lookupArea("Midlands", "E40000008")).isEmpty();
  }

  @Test
  void missingKeyIsEmptyNotAnError() {
    var table = new PopulationTable(PopulationSourceType.LTLA, Map.of());

    assertThat(table.lookup(null)).isEmpty();
    assertThat(table.lookup("E06000014")).isEmpty();
  }
}
