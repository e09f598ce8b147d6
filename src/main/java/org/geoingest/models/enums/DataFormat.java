package org.geoingest.models.enums;

public enum DataFormat {
    JSON,
    XML,
    NETCDF,
    HDF5,
    GEOTIFF,
    CSV,
    BINARY,
    GRIB,
    SHAPEFILE,
    KML,
    WMS,
    WFS
}
