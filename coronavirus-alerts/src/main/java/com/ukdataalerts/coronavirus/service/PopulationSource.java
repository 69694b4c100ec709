package com.ukdataalerts.coronavirus.service;

import com.ukdataalerts.coronavirus.engine.PopulationTable;
import com.ukdataalerts.coronavirus.model.PopulationSourceType;

public interface PopulationSource {

    /**
     * @throws DataFetchException if the dataset cannot be downloaded or read
     */
    PopulationTable fetchPopulationTable(PopulationSourceType type);
}
