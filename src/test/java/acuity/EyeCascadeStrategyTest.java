package acuity;

import java.util.List;
import java.util.Optional;

import org.junit.Assume;
import org.junit.Test;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import static org.junit.Assert.*;

public class EyeCascadeStrategyTest {

    @Test
    public void centresOfTheTwoLargestEyesInFrameCoordinates() {
        Rect region = new Rect(100, 50, 200, 200);
        List<Rect> eyes = List.of(
            new Rect(120, 40, 40, 30),  // right side of the face
            new Rect(90, 150, 10, 10),  // small, a nostril
            new Rect(20, 42, 40, 30));  // left side of the face

        List<Point> centres = EyeCascadeStrategy.eyeCentres(region, eyes).get().points();

        assertEquals(2, centres.size());
        assertEquals(new Point(100 + 20 + 20., 50 + 42 + 15.), centres.get(0));
        assertEquals(new Point(100 + 120 + 20., 50 + 40 + 15.), centres.get(1));
    }

    @Test
    public void centresSortedLeftToRight() {
        Optional<LandmarkSet> centres = EyeCascadeStrategy.eyeCentres(new Rect(0, 0, 100, 100),
            List.of(new Rect(60, 10, 20, 20), new Rect(10, 10, 20, 20)));
        assertTrue(centres.get().points().get(0).x < centres.get().points().get(1).x);
    }

    @Test
    public void halfPixelCentres() {
        Optional<LandmarkSet> centres = EyeCascadeStrategy.eyeCentres(new Rect(0, 0, 100, 100),
            List.of(new Rect(0, 0, 21, 21), new Rect(50, 0, 21, 21)));
        assertEquals(10.5, centres.get().points().get(0).x, 0.);
        assertEquals(50., centres.get().pixelIpd().get(), 1e-9);
    }

    @Test
    public void fewerThanTwoEyesIsNothing() {
        assertFalse(EyeCascadeStrategy.eyeCentres(new Rect(0, 0, 100, 100), List.of(new Rect(10, 10, 20, 20))).isPresent());
        assertFalse(EyeCascadeStrategy.eyeCentres(new Rect(0, 0, 100, 100), List.of()).isPresent());
    }

    @Test
    public void noFaceBoxReturnsThePrior() {
        Detection prior = Detection.none();
        assertSame(prior, new EyeCascadeStrategy(Cfg.eyeCascadePath).detect(null, prior, 0.3));
    }

    @Test
    public void plainPathIsUsedAsIs() {
        assertEquals("some/dir/eyes.xml", EyeCascadeStrategy.resolve("some/dir/eyes.xml"));
    }

    @Test
    public void missingClasspathCascadeIsNotAvailable() {
        EyeCascadeStrategy cascade = new EyeCascadeStrategy("classpath:/haarcascades/no_such_cascade.xml");
        assertEquals("classpath:/haarcascades/no_such_cascade.xml", cascade.cascadePath());
        assertFalse(cascade.isAvailable());
    }

    @Test
    public void bundledCascadeIsCopiedToAFile() {
        Assume.assumeNotNull(EyeCascadeStrategy.class.getResource("/haarcascades/haarcascade_eye_tree_eyeglasses.xml"));

        EyeCascadeStrategy cascade = new EyeCascadeStrategy(Cfg.eyeCascadePath);

        assertTrue(cascade.isAvailable());
        assertTrue(cascade.cascadePath().endsWith(".xml"));
        assertFalse(cascade.cascadePath().startsWith(EyeCascadeStrategy.CLASSPATH));
    }

    @Test
    public void bundledCascadeFindsNoEyesInABlankFace() {
        Assume.assumeNotNull(EyeCascadeStrategy.class.getResource("/haarcascades/haarcascade_eye_tree_eyeglasses.xml"));
        OpenCvTestSupport.load();
        Frame frame = OpenCvTestSupport.blankFrame(320, 240);
        // partly outside the frame, as detectors report faces at the edge
        Detection prior = new Detection(new BoundingBox(-30, 20, 200, 200), null);

        Detection detection = new EyeCascadeStrategy(Cfg.eyeCascadePath).detect(frame, prior, 0.3);

        assertSame(prior, detection);
        assertFalse(detection.hasEyePair());
    }
}
