package org.geoingest.models.enums;

public enum DataSourceCategory {
    SATELLITE_IMAGING,
    SATELLITE_RADAR,
    SATELLITE_LIDAR,
    SATELLITE_RADIOMETRY,

    WEATHER_STATIONS,
    RESEARCH_NETWORKS,
    CITIZEN_SCIENCE,
    AGRICULTURAL_SENSORS,

    GROUND_BASED_RADAR,
    GROUND_BASED_LIDAR,
    FLUX_TOWERS,
    SOIL_MONITORING,

    GLOBAL_MODELS,
    REGIONAL_MODELS,
    REANALYSIS_DATA,
    CLIMATE_DATA,

    CROP_MONITORING,
    PEST_DISEASE,
    SOIL_HEALTH,
    IRRIGATION_SYSTEMS,

    OCEAN_OBSERVATIONS,
    ATMOSPHERIC_PROFILING,
    AEROSOL_DATA,
    GREENHOUSE_GASES,

    SCIENTIFIC_PAPERS,
    TECHNICAL_REPORTS,
    DATASET_DOCUMENTATION,
    METHODOLOGY_PAPERS
}
