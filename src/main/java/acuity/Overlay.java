package acuity;

import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

/**
 * Debug picture of a detection drawn on a copy of the frame
 */
public final class Overlay
{
    private static final Scalar BOX_COLOR = new Scalar(0, 200, 255); // BGR orange
    private static final Scalar POINT_COLOR = new Scalar(0, 255, 0); // BGR green

    private Overlay() {}

    /**
     * @param frame
     * @param detection
     * @return new BGR image; the frame is unchanged
     */
    public static Mat draw(Frame frame, Detection detection)
    {
        Mat img = frame.mat().clone();

        detection.box().ifPresent(box -> {
            int x = (int) box.x();
            int y = (int) box.y();
            Imgproc.rectangle(img, new Point(x, y), new Point(x + (int) box.width(), y + (int) box.height()), BOX_COLOR, 2);
        });

        detection.landmarks().ifPresent(landmarks -> {
            for (Point point : landmarks.points())
            {
                Imgproc.circle(img, new Point((int) point.x, (int) point.y), 2, POINT_COLOR, Imgproc.FILLED);
            }
        });

        return img;
    }
}
