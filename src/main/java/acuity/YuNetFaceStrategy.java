package acuity;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import org.opencv.core.CvException;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Size;
import org.opencv.objdetect.FaceDetectorYN;

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     YuNetFaceStrategy class                                     */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/**
 * Primary detector: OpenCV FaceDetectorYN running the YuNet ONNX model.
 *
 * Finds faces with a box and 5 keypoints each and keeps the highest scoring face.
 */
public class YuNetFaceStrategy implements LandmarkStrategy
{
    private static Logger LOGGER;
    static {
      LOGGER = Logger.getLogger("");
      LOGGER.finest("Loading");
    }

    // one face per row: x, y, w, h, 5 (x, y) keypoints, score
    static final int ROW_LENGTH = 15;
    static final int KEYPOINTS = 5;
    static final int SCORE_COLUMN = 14;

    private final String modelPath;
    private FaceDetectorYN detector; // created on first use, then resized for each frame

    public YuNetFaceStrategy(String modelPath)
    {
        this.modelPath = modelPath;
    }

    @Override
    public String name()
    {
        return "YuNet face";
    }

    @Override
    public boolean isAvailable()
    {
        return Files.isRegularFile(Path.of(modelPath));
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     detect                                                      */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    @Override
    public Detection detect(Frame frame, Detection prior, double scoreThreshold)
    {
        if ( ! isAvailable())
        {
            LOGGER.fine("YuNet model not found " + modelPath);
            return prior;
        }

        Mat faces = new Mat();
        try
        {
            Size size = frame.size();
            if (detector == null)
            {
                detector = FaceDetectorYN.create(modelPath, "", size, (float) scoreThreshold, Cfg.nmsThreshold, Cfg.topK);
            }
            detector.setInputSize(size);
            detector.setScoreThreshold((float) scoreThreshold);
            detector.detect(frame.mat(), faces);

            float[][] rows = rows(faces);
            if (rows.length == 0)
            {
                LOGGER.fine("no face found");
                return prior;
            }
            LOGGER.finer(rows.length + " face candidates");
            return best(rows);
        }
        catch (CvException error)
        {
            // a corrupt or incompatible model is the same as no model
            LOGGER.warning("YuNet face detection failed " + error);
            detector = null;
            return prior;
        }
        finally
        {
            faces.release();
        }
    }

    private static float[][] rows(Mat faces)
    {
        if (faces.empty())
        {
            return new float[0][];
        }
        float[][] rows = new float[faces.rows()][ROW_LENGTH];
        for (int row = 0; row < faces.rows(); row++)
        {
            faces.get(row, 0, rows[row]);
        }
        return rows;
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     best                                                        */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Highest scoring face split into its box and keypoints
     * @param rows face candidates, 15 values each; at least one
     * @return detection of the best face
     */
    static Detection best(float[][] rows)
    {
        float[] row = rows[ArrayUtils.argmax(ArrayUtils.column(rows, SCORE_COLUMN))];

        BoundingBox box = new BoundingBox(row[0], row[1], row[2], row[3]);
        List<Point> keypoints = new ArrayList<>(KEYPOINTS);
        for (int k = 0; k < KEYPOINTS; k++)
        {
            keypoints.add(new Point(row[4 + 2*k], row[5 + 2*k]));
        }
        LOGGER.fine("best face score " + row[SCORE_COLUMN] + " " + box);
        return new Detection(box, new LandmarkSet(keypoints));
    }
}
