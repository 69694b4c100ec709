package com.ukdataalerts.coronavirus.service;

import com.ukdataalerts.coronavirus.engine.PopulationTable;
import com.ukdataalerts.coronavirus.model.PopulationSourceType;
import com.ukdataalerts.coronavirus.model.Thresholds;
import com.ukdataalerts.coronavirus.model.VerificationMode;
import lombok.Getter;

import java.util.EnumMap;
import java.util.Map;

/**
 * State scoped to a single alert run: the settings in force and the
 * population tables loaded so far. Discarded when the run ends.
 */
public class RunContext {

    @Getter
    private final VerificationMode verificationMode;
    @Getter
    private final Thresholds thresholds;

    private final PopulationSource populationSource;
    private final Map<PopulationSourceType, PopulationTable> populations = new EnumMap<>(PopulationSourceType.class);

    public RunContext(VerificationMode verificationMode, Thresholds thresholds, PopulationSource populationSource) {
        this.verificationMode = verificationMode;
        this.thresholds = thresholds;
        this.populationSource = populationSource;
    }

    /**
     * @return null when {@code type} is null, i.e. the check has no population source
     */
    public PopulationTable populations(PopulationSourceType type) {
        if (type == null) {
            return null;
        }
        PopulationTable table = populations.get(type);
        if (table == null) {
            table = populationSource.fetchPopulationTable(type);
            populations.put(type, table);
        }
        return table;
    }
}
