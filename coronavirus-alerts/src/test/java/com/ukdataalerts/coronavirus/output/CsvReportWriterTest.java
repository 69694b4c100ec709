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
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvReportWriterTest {

  @TempDir
  Path dir;

  @Test
  void writesEveryRowAndMarksAlerts() throws IOException {
    AlertsProperties properties = new AlertsProperties();
    properties.getOutput().getCsv().setEnabled(true);
    properties.getOutput().getCsv().setOutputDir(dir.toString());
    CsvReportWriter writer = new CsvReportWriter(properties);

    AreaResult leeds = AreaResult.builder().areaName("Leeds").areaCode("E08000035")
        .priorAggregate(50).currentAggregate(300).percentageChange(500).per100000Rate(300.0)
        .rateColumn(true).build();
    AreaResult york = AreaResult.builder().areaName("York").areaCode("E06000014")
        .priorAggregate(3).currentAggregate(4).percentageChange(100d / 3).per100000Rate(null)
        .rateColumn(true).build();
    CheckResult result = CheckResult.builder()
        .check(new MetricCheck("ltla", "newCasesBySpecimenDate",
            AggregationOperator.SUM, MetricType.CASE_COUNT, PopulationSourceType.LTLA))
        .window(ComparisonWindow.endingOn("newCasesBySpecimenDate", LocalDate.of(2021, 3, 7)))
        .rows(List.of(leeds, york))
        .alert(leeds)
        .build();

    Path written = writer.write(result);

    assertThat(written.getFileName().toString()).isEqualTo("newCasesBySpecimenDate_ltla_2021-03-07.csv");
    assertThat(Files.readAllLines(written, StandardCharsets.UTF_8)).containsExactly(
        "\"areaName\",\"areaCode\",\"newCasesBySpecimenDate-22-02-2021-to-28-02-2021\","
            + "\"newCasesBySpecimenDate-01-03-2021-to-07-03-2021\",\"percentageChange\","
            + "\"lastSevenDaysPer100000\",\"alert\"",
        "\"Leeds\",\"E08000035\",\"50.0\",\"300.0\",\"500.0\",\"300.0\",\"true\"",
        "\"York\",\"E06000014\",\"3.0\",\"4.0\",\"33.3\",\"\",\"false\"");
  }

  @Test
  void disabledByDefault() {
    assertThat(new CsvReportWriter(new AlertsProperties()).isEnabled()).isFalse();
  }
}
