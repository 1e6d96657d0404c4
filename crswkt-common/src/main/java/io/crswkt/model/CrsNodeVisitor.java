package io.crswkt.model;

/**
 * A visitor with one method per node kind. Implementations are
 * exhaustive over the closed set of {@link NodeKind}s.
 * @param <T> the result type of the visit methods
 */
public interface CrsNodeVisitor<T> {
  T visitGeographicCs(GeographicCs node);
  T visitProjectedCs(ProjectedCs node);
  T visitGeocentricCs(GeocentricCs node);
  T visitVerticalCs(VerticalCs node);
  T visitLocalCs(LocalCs node);
  T visitCompoundCs(CompoundCs node);
  T visitDatum(Datum node);
  T visitVerticalDatum(VerticalDatum node);
  T visitLocalDatum(LocalDatum node);
  T visitSpheroid(Spheroid node);
  T visitPrimeMeridian(PrimeMeridian node);
  T visitUnit(Unit node);
  T visitAxis(Axis node);
  T visitParameter(Parameter node);
  T visitProjection(Projection node);
  T visitToWgs84(ToWgs84 node);
  T visitAuthority(Authority node);
}
