package acuity;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.Test;
import org.opencv.core.Point;
import static org.junit.Assert.*;

public class LandmarkSetTest {

    @Test
    public void eyePairIsSortedLeftToRight() {
        LandmarkSet landmarks = new LandmarkSet(List.of(new Point(300, 200), new Point(200, 210), new Point(250, 260)));
        Pair<Point, Point> eyes = landmarks.eyePair().get();
        assertEquals(200., eyes.getLeft().x, 0.);
        assertEquals(300., eyes.getRight().x, 0.);
    }

    @Test
    public void pixelIpdIsEuclidean() {
        LandmarkSet landmarks = new LandmarkSet(List.of(new Point(100, 100), new Point(130, 140)));
        assertEquals(50., landmarks.pixelIpd().get(), 1e-9);
    }

    @Test
    public void onlyTheFirstTwoPointsAreEyes() {
        LandmarkSet landmarks = new LandmarkSet(List.of(new Point(0, 0), new Point(10, 0), new Point(1000, 0)));
        assertEquals(10., landmarks.pixelIpd().get(), 1e-9);
    }

    @Test
    public void onePointHasNoEyePair() {
        LandmarkSet landmarks = new LandmarkSet(List.of(new Point(5, 5)));
        assertFalse(landmarks.eyePair().isPresent());
        assertFalse(landmarks.pixelIpd().isPresent());
    }

    @Test
    public void pointsAreCopied() {
        List<Point> points = new ArrayList<>(List.of(new Point(1, 1), new Point(2, 2)));
        LandmarkSet landmarks = new LandmarkSet(points);
        points.get(0).x = 99;
        points.clear();
        assertEquals(2, landmarks.size());
        assertEquals(1., landmarks.points().get(0).x, 0.);
    }

    @Test(expected = UnsupportedOperationException.class)
    public void pointsAreReadOnly() {
        new LandmarkSet(List.of(new Point(1, 1))).points().clear();
    }
}
