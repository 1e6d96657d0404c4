package io.crswkt.model;

/**
 * The closed set of node kinds a CRS WKT tree may contain. The constant
 * names equal the WKT keywords introducing the respective nodes.
 */
public enum NodeKind {
  GEOGCS,
  PROJCS,
  GEOCCS,
  VERT_CS,
  LOCAL_CS,
  COMPD_CS,
  DATUM,
  VERT_DATUM,
  LOCAL_DATUM,
  SPHEROID,
  PRIMEM,
  UNIT,
  AXIS,
  PARAMETER,
  PROJECTION,
  TOWGS84,
  AUTHORITY
}
