package com.ukdataalerts.coronavirus.service;

import com.ukdataalerts.coronavirus.config.AlertsProperties;
import com.ukdataalerts.coronavirus.engine.PopulationTable;
import com.ukdataalerts.coronavirus.model.PopulationSourceType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Map;

/**
 * Downloads and parses a population workbook. Fetched fresh on every call;
 * {@link RunContext} makes sure that happens at most once per run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PopulationTableLoader implements PopulationSource {

    private final RestTemplate restTemplate;
    private final PopulationWorkbookParser parser;
    private final AlertsProperties properties;

    @Override
    public PopulationTable fetchPopulationTable(PopulationSourceType type) {
        AlertsProperties.Workbook layout = layoutFor(type);
        log.info("Downloading {} populations from: {}", type, layout.getUrl());

        try {
            byte[] workbook = restTemplate.getForObject(layout.getUrl(), byte[].class);
            if (workbook == null || workbook.length == 0) {
                throw new DataFetchException("Empty population workbook from " + layout.getUrl());
            }
            Map<String, Long> populations = parser.parse(new ByteArrayInputStream(workbook), layout);
            return new PopulationTable(type, populations, layout.getAliases());

        } catch (RestClientException | IOException e) {
            throw new DataFetchException("Could not load " + type + " populations: " + e.getMessage(), e);
        }
    }

    private AlertsProperties.Workbook layoutFor(PopulationSourceType type) {
        return switch (type) {
            case LTLA -> properties.getPopulations().getLtla();
            case NHS_REGION -> properties.getPopulations().getNhsRegion();
        };
    }
}
