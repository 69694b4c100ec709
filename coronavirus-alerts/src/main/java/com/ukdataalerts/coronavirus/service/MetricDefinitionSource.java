package com.ukdataalerts.coronavirus.service;

import com.ukdataalerts.coronavirus.model.MetricDefinitions;

public interface MetricDefinitionSource {

    /**
     * @throws DataFetchException if the manifest cannot be retrieved
     */
    MetricDefinitions fetchCurrentDefinitions();
}
