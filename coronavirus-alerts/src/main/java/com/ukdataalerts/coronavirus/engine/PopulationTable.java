package com.ukdataalerts.coronavirus.engine;

import com.ukdataalerts.coronavirus.model.PopulationSourceType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Area key to total population, for one population dataset.
 *
 * LTLA tables are keyed by area code, NHS region tables by region name.
 * Region names in the series do not always match the workbook's capitalisation,
 * so a table may carry aliases from series name to table key.
 */
public final class PopulationTable {

    private final PopulationSourceType type;
    private final Map<String, Long> populations;
    private final Map<String, String> aliases;

    public PopulationTable(PopulationSourceType type, Map<String, Long> populations, Map<String, String> aliases) {
        this.type = type;
        this.populations = Collections.unmodifiableMap(new LinkedHashMap<>(populations));
        this.aliases = aliases == null ? Map.of() : Map.copyOf(aliases);
    }

    public PopulationTable(PopulationSourceType type, Map<String, Long> populations) {
        this(type, populations, Map.of());
    }

    public PopulationSourceType getType() {
        return type;
    }

    public OptionalLong lookup(String key) {
        Long population = key == null ? null : populations.get(key);
        return population == null ? OptionalLong.empty() : OptionalLong.of(population);
    }

    /**
     * Looks an area up in whichever key space this table uses.
     */
    public OptionalLong lookupArea(String areaName, String areaCode) {
        return lookup(keyFor(areaName, areaCode));
    }

    public String keyFor(String areaName, String areaCode) {
        if (type == PopulationSourceType.LTLA) {
            return areaCode;
        }
        return aliases.getOrDefault(areaName, areaName);
    }

    public int size() {
        return populations.size();
    }
}
