package acuity;

import java.util.List;

import org.junit.Test;
import org.opencv.core.Point;
import static org.junit.Assert.*;

public class YuNetFaceStrategyTest {

    private static float[] face(float x, float score) {
        return new float[] {
            x, 50f, 120f, 140f,     // box
            x + 30f, 100f,          // right eye
            x + 90f, 102f,          // left eye
            x + 60f, 130f,          // nose
            x + 35f, 160f,          // right mouth corner
            x + 85f, 161f,          // left mouth corner
            score};
    }

    @Test
    public void bestPicksTheHighestScore() {
        Detection detection = YuNetFaceStrategy.best(new float[][] {face(10f, 0.6f), face(300f, 0.9f), face(500f, 0.4f)});
        assertEquals(300., detection.box().get().x(), 0.);
    }

    @Test
    public void bestSplitsTheRowIntoBoxAndFiveKeypoints() {
        Detection detection = YuNetFaceStrategy.best(new float[][] {face(10f, 0.8f)});

        BoundingBox box = detection.box().get();
        assertEquals(10., box.x(), 0.);
        assertEquals(50., box.y(), 0.);
        assertEquals(120., box.width(), 0.);
        assertEquals(140., box.height(), 0.);

        List<Point> points = detection.landmarks().get().points();
        assertEquals(YuNetFaceStrategy.KEYPOINTS, points.size());
        assertEquals(new Point(40, 100), points.get(0));
        assertEquals(new Point(95, 161), points.get(4));
    }

    @Test
    public void bestGivesTheEyeSpacing() {
        Detection detection = YuNetFaceStrategy.best(new float[][] {face(0f, 0.8f)});
        assertTrue(detection.hasEyePair());
        assertEquals(Math.hypot(60., 2.), detection.pixelIpd().get(), 1e-6);
    }

    @Test
    public void missingModelIsNotAvailable() {
        assertFalse(new YuNetFaceStrategy("no/such/model.onnx").isAvailable());
    }
}
