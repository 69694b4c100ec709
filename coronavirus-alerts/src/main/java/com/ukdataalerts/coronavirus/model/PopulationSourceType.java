package com.ukdataalerts.coronavirus.model;

/**
 * The two population datasets, each with its own key space.
 */
public enum PopulationSourceType {

    /** ONS mid-year estimates, keyed by lower-tier local authority code (e.g. E09000001). */
    LTLA,

    /** NHS England vaccination-report estimates, keyed by NHS region name. */
    NHS_REGION
}
