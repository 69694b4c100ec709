package com.ukdataalerts.coronavirus.service;

import static com.ukdataalerts.coronavirus.service.FakeCollaborators.daily;
import static com.ukdataalerts.coronavirus.service.FakeCollaborators.definitions;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ukdataalerts.coronavirus.config.AlertsProperties;
import com.ukdataalerts.coronavirus.engine.AreaAggregator;
import com.ukdataalerts.coronavirus.engine.ChangeEvaluator;
import com.ukdataalerts.coronavirus.engine.DefinitionDiffDetector;
import com.ukdataalerts.coronavirus.engine.PopulationTable;
import com.ukdataalerts.coronavirus.engine.ThresholdFilter;
import com.ukdataalerts.coronavirus.engine.WindowResolver;
import com.ukdataalerts.coronavirus.model.AggregationOperator;
import com.ukdataalerts.coronavirus.model.AlertRun;
import com.ukdataalerts.coronavirus.model.MetricCheck;
import com.ukdataalerts.coronavirus.model.MetricType;
import com.ukdataalerts.coronavirus.model.PopulationSourceType;
import com.ukdataalerts.coronavirus.output.AlertReportRenderer;
import com.ukdataalerts.coronavirus.output.CsvReportWriter;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AlertRunServiceTest {

  private static final LocalDate LATEST = LocalDate.of(2021, 3, 7);

  private FakeCollaborators.Series series;
  private FakeCollaborators.Populations populations;
  private FakeCollaborators.Definitions manifest;
  private FakeCollaborators.Baseline baseline;
  private FakeCollaborators.Mailbox mailbox;
  private AlertsProperties properties;
  private AlertRunService service;

  @BeforeEach
  void setUp() {
    series = new FakeCollaborators.Series();
    populations = new FakeCollaborators.Populations()
        .with(new PopulationTable(PopulationSourceType.LTLA, Map.of("E08000035", 100_000L)));
    manifest = new FakeCollaborators.Definitions();
    baseline = new FakeCollaborators.Baseline();
    mailbox = new FakeCollaborators.Mailbox();

    properties = new AlertsProperties();
    properties.setChecks(List.of(
        new MetricCheck("ltla", "newCasesBySpecimenDate",
            AggregationOperator.SUM, MetricType.CASE_COUNT, PopulationSourceType.LTLA),
        new MetricCheck("nhsRegion", "newAdmissions",
            AggregationOperator.MEAN, MetricType.HOSPITAL, null),
        new MetricCheck("ltla", "newDeaths28DaysByDeathDate",
            AggregationOperator.SUM, MetricType.CASE_COUNT, PopulationSourceType.LTLA)));

    MetricDefinitionService definitionService =
        new MetricDefinitionService(manifest, baseline, new DefinitionDiffDetector());
    MetricComparisonService comparisonService = new MetricComparisonService(
        series,
        new WindowResolver(),
        new AreaAggregator(new ChangeEvaluator()),
        new ThresholdFilter(),
        new CsvReportWriter(properties));
    service = new AlertRunService(definitionService, comparisonService, populations, mailbox,
        new AlertReportRenderer(properties), properties);
  }

  private void steadySeries() {
    series.with("newCasesBySpecimenDate",
            daily("Leeds", "E08000035", LATEST, 10, 10, 10, 10, 10, 10, 10, 10, 10, 10, 10, 10, 10, 10))
        .with("newAdmissions",
            daily("London", "E40000003", LATEST, 5, 5, 5, 5, 5, 5, 5, 5, 5, 5, 5, 5, 5, 5))
        .with("newDeaths28DaysByDeathDate",
            daily("Leeds", "E08000035", LATEST, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1));
  }

  @Test
  void quietRunSendsNothing() {
    steadySeries();
    manifest.current = definitions("A");
    baseline.stored = definitions("A");

    AlertRun run = service.run();

    assertThat(run.getStatus()).isEqualTo("SUCCESS");
    assertThat(run.getChecksEvaluated()).isEqualTo(3);
    assertThat(run.getAlertsSent()).isZero();
    assertThat(mailbox.subjects).isEmpty();
    assertThat(baseline.writes).isEqualTo(1);
    assertThat(service.isRunning()).isFalse();
    assertThat(service.getLastRun()).contains(run);
  }

  @Test
  void newMetricsAlertGoesOutBeforeThresholdAlert() {
    series.with("newCasesBySpecimenDate",
            daily("Leeds", "E08000035", LATEST, 100, 100, 100, 0, 0, 0, 0, 50, 0, 0, 0, 0, 0, 0))
        .with("newAdmissions",
            daily("London", "E40000003", LATEST, 5, 5, 5, 5, 5, 5, 5, 5, 5, 5, 5, 5, 5, 5))
        .with("newDeaths28DaysByDeathDate",
            daily("Leeds", "E08000035", LATEST, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1));
    manifest.current = definitions("A", "B", "C");
    baseline.stored = definitions("A");

    AlertRun run = service.run();

    assertThat(run.getNewDefinitions()).isEqualTo(2);
    assertThat(run.getAlertsSent()).isEqualTo(2);
    assertThat(mailbox.subjects).containsExactly(
        AlertReportRenderer.NEW_METRICS_SUBJECT, AlertReportRenderer.THRESHOLD_SUBJECT);
    assertThat(mailbox.bodies.get(0)).contains("<li>B</li>").contains("<li>C</li>").doesNotContain("<li>A</li>");
    assertThat(mailbox.bodies.get(1))
        .contains("Some metrics have exceeded 100% change week on week:")
        .contains("newCasesBySpecimenDate-01-03-2021-to-07-03-2021")
        .contains("<td>Leeds</td>");
  }

  @Test
  void failingCheckDoesNotStopTheOthers() {
    steadySeries();
    series.byMetric.remove("newAdmissions");
    series.failing("newCasesBySpecimenDate", new DataFetchException("HTTP 500"));

    AlertRun run = service.run();

    assertThat(run.getStatus()).isEqualTo("PARTIAL");
    assertThat(run.getFailedChecks()).containsExactly("ltla/newCasesBySpecimenDate", "nhsRegion/newAdmissions");
    assertThat(run.getChecksEvaluated()).isEqualTo(1);
    assertThat(series.requested).containsExactly(
        "ltla/newCasesBySpecimenDate", "nhsRegion/newAdmissions", "ltla/newDeaths28DaysByDeathDate");
  }

  @Test
  void populationTableIsLoadedOncePerRun() {
    steadySeries();

    service.run();

    assertThat(populations.fetched).containsExactly(PopulationSourceType.LTLA);
  }

  @Test
  void dispatchFailureFailsTheRun() {
    steadySeries();
    manifest.current = definitions("A", "B");
    mailbox.failure = new IllegalStateException("SES rejected the message");

    assertThatThrownBy(() -> service.run()).hasMessage("SES rejected the message");

    assertThat(service.getLastRun()).hasValueSatisfying(run -> {
      assertThat(run.getStatus()).isEqualTo("FAILED");
      assertThat(run.getCompletedAt()).isNotNull();
    });
    assertThat(service.isRunning()).isFalse();
    assertThat(baseline.stored.identifiers()).containsExactly("A", "B");
  }

  @Test
  void manifestFailureAbortsBeforeAnyCheck() {
    manifest.failure = new DataFetchException("manifest unavailable");

    assertThatThrownBy(() -> service.run()).isInstanceOf(DataFetchException.class);

    assertThat(series.requested).isEmpty();
    assertThat(mailbox.subjects).isEmpty();
  }
}
