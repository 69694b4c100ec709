package com.ukdataalerts.coronavirus.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ukdataalerts.coronavirus.config.AlertsProperties;
import com.ukdataalerts.coronavirus.model.MetricDefinitions;
import com.ukdataalerts.coronavirus.model.TimeSeriesPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.io.InputStreamReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Thin client over the coronavirus.data.gov.uk API.
 *
 * Series come back as CSV and are parsed while streaming. The metric manifest
 * (api_variables.json) is a JSON object keyed by metric identifier.
 * No retries: a failed call surfaces to the caller as a {@link DataFetchException}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CoronavirusApiClient implements TimeSeriesSource, MetricDefinitionSource {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final SeriesCsvParser parser;
    private final AlertsProperties properties;

    @Override
    public List<TimeSeriesPoint> fetchTimeSeries(String areaType, String metricName) {
        URI uri = UriComponentsBuilder
                .fromHttpUrl(properties.getApi().getSeriesUrl())
                .queryParam("areaType", areaType)
                .queryParam("metric", metricName)
                .queryParam("format", "csv")
                .build()
                .toUri();

        log.info("GET {}", uri);
        try {
            List<TimeSeriesPoint> points = restTemplate.execute(uri, HttpMethod.GET, null, response ->
                    parser.parse(new InputStreamReader(response.getBody(), StandardCharsets.UTF_8), metricName));
            return points == null ? List.of() : points;
        } catch (RestClientException e) {
            throw new DataFetchException("Series request failed for " + areaType + "/" + metricName
                    + ": " + e.getMessage(), e);
        }
    }

    @Override
    public MetricDefinitions fetchCurrentDefinitions() {
        String url = properties.getApi().getDefinitionsUrl();
        log.info("GET {}", url);
        try {
            String body = restTemplate.getForObject(url, String.class);
            if (body == null) {
                throw new DataFetchException("Empty metric manifest from " + url);
            }
            JsonNode root = objectMapper.readTree(body);
            if (!root.isObject()) {
                throw new DataFetchException("Metric manifest at " + url + " is not a JSON object");
            }

            MetricDefinitions definitions = new MetricDefinitions();
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                definitions.put(field.getKey(), field.getValue());
            }
            log.info("Metric manifest lists {} metrics", definitions.size());
            return definitions;

        } catch (RestClientException | IOException e) {
            throw new DataFetchException("Metric manifest request failed: " + e.getMessage(), e);
        }
    }
}
