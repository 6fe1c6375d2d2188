package app.terrain.geometry;

import java.util.ArrayList;
import java.util.List;
import org.locationtech.jts.algorithm.locate.IndexedPointInAreaLocator;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Location;
import org.locationtech.jts.geom.Polygon;

public final class Polygon2D {
  private static final GeometryFactory FACTORY = new GeometryFactory();

  private final List<Point3> ring;
  private final Envelope envelope;
  private final IndexedPointInAreaLocator locator;

  public Polygon2D(List<Point3> boundary) {
    if (boundary.size() < 3) {
      throw new IllegalArgumentException("polygon needs at least 3 points, got " + boundary.size());
    }
    this.ring = List.copyOf(boundary);
    List<Coordinate> coords = new ArrayList<>(boundary.size() + 1);
    for (Point3 point : boundary) {
      coords.add(new Coordinate(point.x(), point.y()));
    }
    if (!coords.get(0).equals2D(coords.get(coords.size() - 1))) {
      coords.add(new Coordinate(coords.get(0)));
    }
    if (coords.size() < 4) {
      coords.add(new Coordinate(coords.get(0)));
    }
    Polygon polygon = FACTORY.createPolygon(coords.toArray(new Coordinate[0]));
    this.envelope = polygon.getEnvelopeInternal();
    this.locator = new IndexedPointInAreaLocator(polygon);
  }

  public boolean contains(double x, double y) {
    return locator.locate(new Coordinate(x, y)) == Location.INTERIOR;
  }

  public double minX() {
    return envelope.getMinX();
  }

  public double minY() {
    return envelope.getMinY();
  }

  public double maxX() {
    return envelope.getMaxX();
  }

  public double maxY() {
    return envelope.getMaxY();
  }

  public double boundsArea() {
    return envelope.getWidth() * envelope.getHeight();
  }

  public double meanZ() {
    double sum = 0d;
    for (Point3 point : ring) {
      sum += point.z();
    }
    return sum / ring.size();
  }
}
