package com.ukdataalerts.coronavirus.output;

import static org.assertj.core.api.Assertions.assertThat;

import com.ukdataalerts.coronavirus.config.AlertsProperties;
import com.ukdataalerts.coronavirus.model.AggregationOperator;
import com.ukdataalerts.coronavirus.model.AreaResult;
import com.ukdataalerts.coronavirus.model.CheckResult;
import com.ukdataalerts.coronavirus.model.ComparisonWindow;
import com.ukdataalerts.coronavirus.model.MetricCheck;
import com.ukdataalerts.coronavirus.model.MetricType;
import com.ukdataalerts.coronavirus.model.PopulationSourceType;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class AlertReportRendererTest {

  private final AlertReportRenderer renderer = new AlertReportRenderer(new AlertsProperties());

  private static final ComparisonWindow WINDOW =
      ComparisonWindow.endingOn("newAdmissions", LocalDate.of(2021, 1, 18));

  @Test
  void formatsNumbersForReaders() {
    assertThat(AlertReportRenderer.formatNumber(Double.POSITIVE_INFINITY)).isEqualTo("inf");
    assertThat(AlertReportRenderer.formatNumber(150)).isEqualTo("150.0");
    assertThat(AlertReportRenderer.formatNumber(33.3)).isEqualTo("33.3");
    assertThat(AlertReportRenderer.formatNumber(1234.5)).isEqualTo("1234.5");
    assertThat(AlertReportRenderer.formatNumber(0)).isEqualTo("0.0");
  }

  @Test
  void newMetricsAreListedAndEscaped() {
    String html = renderer.renderNewMetrics(List.of("newCasesByPublishDate", "cases<age>"));

    assertThat(html)
        .contains("New metrics available:")
        .contains("<li>newCasesByPublishDate</li>")
        .contains("<li>cases&lt;age&gt;</li>")
        .contains("Check https://coronavirus.data.gov.uk/");
  }

  @Test
  void tableWithoutPopulationHasNoRateColumn() {
    AreaResult london = AreaResult.builder().areaName("London").areaCode("E40000003")
        .priorAggregate(0).currentAggregate(7).percentageChange(Double.POSITIVE_INFINITY).build();
    CheckResult result = CheckResult.builder()
        .check(new MetricCheck("nhsRegion", "newAdmissions", AggregationOperator.MEAN, MetricType.HOSPITAL, null))
        .window(WINDOW)
        .row(london)
        .alert(london)
        .build();

    String html = renderer.renderThresholdAlert(List.of(result));

    assertThat(html)
        .startsWith("<p>Some metrics have exceeded 100% change week on week:</p>")
        .contains("<th>newAdmissions-05-01-2021-to-11-01-2021</th><th>newAdmissions-12-01-2021-to-18-01-2021</th>")
        .contains("<tr><td>London</td><td>0.0</td><td>7.0</td><td>inf</td></tr>")
        .doesNotContain("lastSevenDaysPer100000");
  }

  @Test
  void onlyChecksWithAlertsAreRendered() {
    AreaResult leeds = AreaResult.builder().areaName("Leeds").areaCode("E08000035")
        .priorAggregate(50).currentAggregate(300).percentageChange(500).per100000Rate(37.82456)
        .rateColumn(true).build();
    CheckResult cases = CheckResult.builder()
        .check(new MetricCheck("ltla", "newCasesBySpecimenDate",
            AggregationOperator.SUM, MetricType.CASE_COUNT, PopulationSourceType.LTLA))
        .window(ComparisonWindow.endingOn("newCasesBySpecimenDate", LocalDate.of(2021, 3, 7)))
        .row(leeds)
        .alert(leeds)
        .build();
    CheckResult quiet = CheckResult.builder()
        .check(new MetricCheck("nhsRegion", "hospitalCases", AggregationOperator.MEAN, MetricType.HOSPITAL, null))
        .window(WINDOW)
        .build();
    CheckResult failed = CheckResult.failed(
        new MetricCheck("nhsRegion", "newAdmissions", AggregationOperator.MEAN, MetricType.HOSPITAL, null),
        "HTTP 500");

    String html = renderer.renderThresholdAlert(List.of(cases, quiet, failed));

    assertThat(html)
        .contains("<h3>newCasesBySpecimenDate (ltla)</h3>")
        .contains("<th>lastSevenDaysPer100000</th>")
        .contains("<td>37.8</td>")
        .doesNotContain("hospitalCases")
        .doesNotContain("newAdmissions");
  }
}
