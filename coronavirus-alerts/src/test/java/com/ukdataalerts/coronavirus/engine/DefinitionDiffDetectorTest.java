package com.ukdataalerts.coronavirus.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.ukdataalerts.coronavirus.model.MetricDefinitions;
import org.junit.jupiter.api.Test;

class DefinitionDiffDetectorTest {

  private final DefinitionDiffDetector detector = new DefinitionDiffDetector();

  static MetricDefinitions definitions(String... identifiers) {
    MetricDefinitions definitions = new MetricDefinitions();
    for (String id : identifiers) {
      definitions.put(id, JsonNodeFactory.instance.objectNode().put("category", "cases"));
    }
    return definitions;
  }

  @Test
  void reportsIdentifiersMissingFromPrevious() {
    assertThat(detector.added(definitions("A", "B", "C"), definitions("A")))
        .containsExactly("B", "C");
  }

  @Test
  void emptyPreviousMeansEverythingIsNew() {
    assertThat(detector.added(definitions("A", "B"), MetricDefinitions.empty()))
        .containsExactly("A", "B");
  }

  @Test
  void removedIdentifiersAreNotReported() {
    assertThat(detector.added(definitions("A"), definitions("A", "B"))).isEmpty();
  }
}
