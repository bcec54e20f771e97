package acuity;

import java.io.FileNotFoundException;
import java.util.logging.Logger;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Size;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;

/**
 * One captured camera image, 3 channel BGR.
 *
 * The pixels are copied in and never changed afterwards; the Mat handed out by {@link #mat()}
 * must be treated as read only.
 */
public final class Frame
{
    private static Logger LOGGER;
    static {
      LOGGER = Logger.getLogger("");
      LOGGER.finest("Loading");
    }

    private final Mat bgr;

    private Frame(Mat bgr)
    {
        this.bgr = bgr;
    }

    /**
     * @param image 8 bit BGR image; copied
     * @return frame
     */
    public static Frame of(Mat image)
    {
        if (image.empty() || image.type() != CvType.CV_8UC3)
        {
            throw new IllegalArgumentException("frame must be a non-empty 8 bit 3 channel image, not " + image);
        }
        return new Frame(image.clone());
    }

    /**
     * Decode an image file
     * @param filename
     * @return frame
     * @throws FileNotFoundException if the file is missing or not a readable image
     */
    public static Frame read(String filename) throws FileNotFoundException
    {
        Mat image = Imgcodecs.imread(filename, Imgcodecs.IMREAD_COLOR);
        if (image.empty())
        {
            throw new FileNotFoundException("image not read " + filename);
        }
        LOGGER.fine("read " + filename + " " + image.cols() + "x" + image.rows());
        return new Frame(image);
    }

    public int width()
    {
        return bgr.cols();
    }

    public int height()
    {
        return bgr.rows();
    }

    public Size size()
    {
        return bgr.size();
    }

    Mat mat()
    {
        return bgr;
    }

    /**
     * Grayscale copy of the part of the frame inside a box
     * @param box clipped to the frame
     * @param gray receives the pixels; empty if the box misses the frame
     * @return the clipped region in frame coordinates
     */
    Rect grayRegion(BoundingBox box, Mat gray)
    {
        Rect region = box.toRect(width(), height());
        if (region.area() <= 0)
        {
            gray.release();
            return region;
        }
        Mat roi = bgr.submat(region);
        Imgproc.cvtColor(roi, gray, Imgproc.COLOR_BGR2GRAY);
        roi.release();
        return region;
    }
}
