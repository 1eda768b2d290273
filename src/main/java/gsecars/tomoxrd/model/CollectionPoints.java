package gsecars.tomoxrd.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered list of collection points. Insertion order is scan order and names are unique.
 *
 * <p>All methods are synchronized; the orchestrator iterates over a {@link #snapshot()}.</p>
 */
public class CollectionPoints {
    private static final Logger logger = LoggerFactory.getLogger(CollectionPoints.class);

    private final List<CollectionPoint> points = new ArrayList<>();

    /**
     * Appends a point.
     *
     * @throws IllegalArgumentException if a point with the same name already exists
     */
    public synchronized void addPoint(CollectionPoint point) {
        if (indexOf(point.name()) >= 0) {
            throw new IllegalArgumentException("Collection point '" + point.name() + "' already exists");
        }
        points.add(point);
        logger.info("Added collection point {} ({}, {}, {})", point.name(), point.x(), point.y(), point.z());
    }

    public synchronized boolean deletePoint(String name) {
        int index = indexOf(name);
        if (index < 0) {
            logger.warn("Cannot delete unknown collection point {}", name);
            return false;
        }
        points.remove(index);
        return true;
    }

    public synchronized CollectionPoint deletePoint(int index) {
        return points.remove(index);
    }

    public synchronized void clear() {
        points.clear();
    }

    public synchronized void setEnabled(String name, boolean enabled) {
        int index = indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown collection point: " + name);
        }
        points.set(index, points.get(index).withEnabled(enabled));
    }

    /** Enables every point. */
    public synchronized void enableAll() {
        points.replaceAll(p -> p.withEnabled(true));
    }

    public synchronized int size() {
        return points.size();
    }

    public synchronized boolean isEmpty() {
        return points.isEmpty();
    }

    public synchronized int enabledCount() {
        return (int) points.stream().filter(CollectionPoint::enabled).count();
    }

    public synchronized boolean contains(String name) {
        return indexOf(name) >= 0;
    }

    public synchronized List<CollectionPoint> snapshot() {
        return List.copyOf(points);
    }

    private int indexOf(String name) {
        for (int i = 0; i < points.size(); i++) {
            if (points.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }
}
