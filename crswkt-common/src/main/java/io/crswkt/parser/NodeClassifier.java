package io.crswkt.parser;

import java.util.ArrayList;
import java.util.List;

import io.crswkt.model.Authority;
import io.crswkt.model.Axis;
import io.crswkt.model.CrsNode;
import io.crswkt.model.Datum;
import io.crswkt.model.GeocentricCs;
import io.crswkt.model.GeographicCs;
import io.crswkt.model.LocalCs;
import io.crswkt.model.LocalDatum;
import io.crswkt.model.NodeKind;
import io.crswkt.model.Parameter;
import io.crswkt.model.PrimeMeridian;
import io.crswkt.model.ProjectedCs;
import io.crswkt.model.Projection;
import io.crswkt.model.Spheroid;
import io.crswkt.model.ToWgs84;
import io.crswkt.model.Unit;
import io.crswkt.model.VerticalCs;
import io.crswkt.model.VerticalDatum;

/**
 * Assigns the generic child node lists of coordinate system and datum
 * definitions to the named slots of their parents. Children may appear
 * in any order. If a singular child is given more than once, the last one
 * wins. Child kinds that are not valid for the parent and wrong numbers
 * of axes raise a {@link WktContentException}.
 */
public class NodeClassifier {
  /**
   * Build a GEOGCS node
   * @param name the node's name
   * @param children the child nodes in document order
   * @return the node
   * @throws WktContentException if the children are invalid
   */
  public GeographicCs classifyGeographicCs(String name, List<CrsNode> children) {
    Datum datum = null;
    PrimeMeridian primeMeridian = null;
    Unit angularUnit = null;
    List<Axis> axisList = new ArrayList<>();
    Authority authority = null;

    for (CrsNode child : children) {
      switch (child.getKind()) {
        case DATUM:
          datum = (Datum)child;
          break;
        case PRIMEM:
          primeMeridian = (PrimeMeridian)child;
          break;
        case UNIT:
          angularUnit = (Unit)child;
          break;
        case AXIS:
          axisList.add((Axis)child);
          break;
        case AUTHORITY:
          authority = (Authority)child;
          break;
        default:
          throw notValid(child, NodeKind.GEOGCS);
      }
    }

    checkAxisCount(NodeKind.GEOGCS, axisList.size(), 0, 2);
    return new GeographicCs(name, datum, primeMeridian, angularUnit,
        axisList, authority);
  }

  /**
   * Build a PROJCS node
   * @param name the node's name
   * @param geographicCs the underlying geographic coordinate system
   * @param children the child nodes following the geographic coordinate
   * system in document order
   * @return the node
   * @throws WktContentException if the children are invalid
   */
  public ProjectedCs classifyProjectedCs(String name,
      GeographicCs geographicCs, List<CrsNode> children) {
    Projection projection = null;
    List<Parameter> paramList = new ArrayList<>();
    Unit linearUnit = null;
    List<Axis> axisList = new ArrayList<>();
    Authority authority = null;

    for (CrsNode child : children) {
      switch (child.getKind()) {
        case PROJECTION:
          projection = (Projection)child;
          break;
        case PARAMETER:
          paramList.add((Parameter)child);
          break;
        case UNIT:
          linearUnit = (Unit)child;
          break;
        case AXIS:
          axisList.add((Axis)child);
          break;
        case AUTHORITY:
          authority = (Authority)child;
          break;
        default:
          throw notValid(child, NodeKind.PROJCS);
      }
    }

    checkAxisCount(NodeKind.PROJCS, axisList.size(), 0, 2);
    return new ProjectedCs(name, geographicCs, projection, paramList,
        linearUnit, axisList, authority);
  }

  /**
   * Build a GEOCCS node
   * @param name the node's name
   * @param children the child nodes in document order
   * @return the node
   * @throws WktContentException if the children are invalid
   */
  public GeocentricCs classifyGeocentricCs(String name, List<CrsNode> children) {
    Datum datum = null;
    PrimeMeridian primeMeridian = null;
    Unit linearUnit = null;
    List<Axis> axisList = new ArrayList<>();
    Authority authority = null;

    for (CrsNode child : children) {
      switch (child.getKind()) {
        case DATUM:
          datum = (Datum)child;
          break;
        case PRIMEM:
          primeMeridian = (PrimeMeridian)child;
          break;
        case UNIT:
          linearUnit = (Unit)child;
          break;
        case AXIS:
          axisList.add((Axis)child);
          break;
        case AUTHORITY:
          authority = (Authority)child;
          break;
        default:
          throw notValid(child, NodeKind.GEOCCS);
      }
    }

    checkAxisCount(NodeKind.GEOCCS, axisList.size(), 0, 3);
    return new GeocentricCs(name, datum, primeMeridian, linearUnit,
        axisList, authority);
  }

  /**
   * Build a VERT_CS node
   * @param name the node's name
   * @param children the child nodes in document order
   * @return the node
   * @throws WktContentException if the children are invalid
   */
  public VerticalCs classifyVerticalCs(String name, List<CrsNode> children) {
    VerticalDatum vertDatum = null;
    Unit linearUnit = null;
    List<Axis> axisList = new ArrayList<>();
    Authority authority = null;

    for (CrsNode child : children) {
      switch (child.getKind()) {
        case VERT_DATUM:
          vertDatum = (VerticalDatum)child;
          break;
        case UNIT:
          linearUnit = (Unit)child;
          break;
        case AXIS:
          axisList.add((Axis)child);
          break;
        case AUTHORITY:
          authority = (Authority)child;
          break;
        default:
          throw notValid(child, NodeKind.VERT_CS);
      }
    }

    checkAxisCount(NodeKind.VERT_CS, axisList.size(), 0, 1);
    return new VerticalCs(name, vertDatum, linearUnit, axisList, authority);
  }

  /**
   * Build a LOCAL_CS node
   * @param name the node's name
   * @param children the child nodes in document order
   * @return the node
   * @throws WktContentException if the children are invalid
   */
  public LocalCs classifyLocalCs(String name, List<CrsNode> children) {
    LocalDatum localDatum = null;
    Unit unit = null;
    List<Axis> axisList = new ArrayList<>();
    Authority authority = null;

    for (CrsNode child : children) {
      switch (child.getKind()) {
        case LOCAL_DATUM:
          localDatum = (LocalDatum)child;
          break;
        case UNIT:
          unit = (Unit)child;
          break;
        case AXIS:
          axisList.add((Axis)child);
          break;
        case AUTHORITY:
          authority = (Authority)child;
          break;
        default:
          throw notValid(child, NodeKind.LOCAL_CS);
      }
    }

    checkAxisCount(NodeKind.LOCAL_CS, axisList.size(), 1, 2);
    return new LocalCs(name, localDatum, unit, axisList, authority);
  }

  /**
   * Build a DATUM node. TOWGS84 is optional and stays null if absent.
   * @param name the node's name
   * @param children the child nodes in document order
   * @return the node
   * @throws WktContentException if the children are invalid
   */
  public Datum classifyDatum(String name, List<CrsNode> children) {
    Spheroid spheroid = null;
    ToWgs84 towgs84 = null;
    Authority authority = null;

    for (CrsNode child : children) {
      switch (child.getKind()) {
        case SPHEROID:
          spheroid = (Spheroid)child;
          break;
        case TOWGS84:
          towgs84 = (ToWgs84)child;
          break;
        case AUTHORITY:
          authority = (Authority)child;
          break;
        default:
          throw notValid(child, NodeKind.DATUM);
      }
    }

    return new Datum(name, spheroid, towgs84, authority);
  }

  private static WktContentException notValid(CrsNode child,
      NodeKind parentKind) {
    return new WktContentException(child.getKind() + " node is not valid " +
        "in a " + parentKind + " definition", parentKind, child.getKind());
  }

  private static void checkAxisCount(NodeKind parentKind, int count,
      int allowed1, int allowed2) {
    if (count != allowed1 && count != allowed2) {
      throw new WktContentException(parentKind + " definition invalid: " +
          allowed1 + " or " + allowed2 + " axes expected, " + count +
          " defined", parentKind, NodeKind.AXIS);
    }
  }
}
