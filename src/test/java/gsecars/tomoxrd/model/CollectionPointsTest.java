package gsecars.tomoxrd.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CollectionPointsTest {

    private CollectionPoints points;

    @BeforeEach
    void setUp() {
        points = new CollectionPoints();
        points.addPoint(new CollectionPoint("a", 1.0, 2.0, 3.0, true));
        points.addPoint(new CollectionPoint("b", null, null, null, true));
        points.addPoint(new CollectionPoint("c", 0.0, 0.0, 0.0, false));
    }

    @Test
    void testInsertionOrderIsScanOrder() {
        assertEquals(List.of("a", "b", "c"), points.snapshot().stream().map(CollectionPoint::name).toList());
    }

    @Test
    void testDuplicateNameIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> points.addPoint(new CollectionPoint("a", 0.0, 0.0, 0.0, true)));
        assertEquals("Collection point 'a' already exists", e.getMessage());
        assertEquals(3, points.size());
    }

    @Test
    void testBlankNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new CollectionPoint(" ", 0.0, 0.0, 0.0, true));
    }

    @Test
    void testEnableAndCount() {
        assertEquals(2, points.enabledCount());
        points.setEnabled("a", false);
        assertEquals(1, points.enabledCount());
        points.enableAll();
        assertEquals(3, points.enabledCount());
        assertThrows(IllegalArgumentException.class, () -> points.setEnabled("missing", true));
    }

    @Test
    void testDelete() {
        assertTrue(points.deletePoint("b"));
        assertFalse(points.deletePoint("b"));
        assertEquals("a", points.deletePoint(0).name());
        assertEquals(List.of("c"), points.snapshot().stream().map(CollectionPoint::name).toList());
        points.clear();
        assertTrue(points.isEmpty());
    }

    @Test
    void testSnapshotIsDetached() {
        List<CollectionPoint> snapshot = points.snapshot();
        points.clear();
        assertEquals(3, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(snapshot.get(0)));
    }
}
