package acuity;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

import org.opencv.core.CvException;
import org.opencv.core.Mat;
import org.opencv.core.MatOfRect;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.core.Size;
import org.opencv.objdetect.CascadeClassifier;

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     EyeCascadeStrategy class                                    */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/**
 * Fallback detector: Haar eye cascade run inside an already found face box.
 *
 * Only useful after a strategy that finds a box; without a box there is nothing to do.
 */
public class EyeCascadeStrategy implements LandmarkStrategy
{
    private static Logger LOGGER;
    static {
      LOGGER = Logger.getLogger("");
      LOGGER.finest("Loading");
    }

    static final String CLASSPATH = "classpath:";

    private final String cascadePath;
    private CascadeClassifier classifier; // loaded on first use

    /**
     * @param cascadePath Haar cascade XML file, or classpath:/resource for a bundled cascade
     */
    public EyeCascadeStrategy(String cascadePath)
    {
        this.cascadePath = resolve(cascadePath);
    }

    /**
     * File system path of the cascade. A classpath resource is copied to a temporary file
     * because CascadeClassifier can only read files.
     * @param cascadePath file path or classpath:/resource
     * @return readable file path; the unresolved name if the resource can't be copied
     */
    static String resolve(String cascadePath)
    {
        if ( ! cascadePath.startsWith(CLASSPATH))
        {
            return cascadePath;
        }

        String resource = cascadePath.substring(CLASSPATH.length());
        try (InputStream is = EyeCascadeStrategy.class.getResourceAsStream(resource))
        {
            if (is == null)
            {
                LOGGER.warning("eye cascade resource not found " + resource + "; eye fallback not available");
                return cascadePath;
            }
            File tempFile = File.createTempFile("haarcascade_eye", ".xml");
            tempFile.deleteOnExit();
            Files.copy(is, tempFile.toPath(), StandardCopyOption.REPLACE_EXISTING);
            LOGGER.fine("eye cascade " + resource + " copied to " + tempFile);
            return tempFile.getAbsolutePath();
        }
        catch (IOException e)
        {
            LOGGER.warning("eye cascade resource " + resource + " not copied; eye fallback not available " + e);
            return cascadePath;
        }
    }

    String cascadePath()
    {
        return cascadePath;
    }

    @Override
    public String name()
    {
        return "Haar eye cascade";
    }

    @Override
    public boolean isAvailable()
    {
        return ! cascadePath.startsWith(CLASSPATH) && Files.isRegularFile(Path.of(cascadePath));
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
        Optional<BoundingBox> box = prior.box();
        if (box.isEmpty())
        {
            LOGGER.fine("no face box to search for eyes");
            return prior;
        }

        Mat gray = new Mat();
        MatOfRect eyes = new MatOfRect();
        try
        {
            if (classifier == null)
            {
                classifier = new CascadeClassifier(cascadePath);
            }
            if (classifier.empty())
            {
                LOGGER.warning("eye cascade not loaded " + cascadePath);
                classifier = null;
                return prior;
            }

            Rect region = frame.grayRegion(box.get(), gray);
            if (gray.empty())
            {
                LOGGER.fine("face box outside the frame " + box.get());
                return prior;
            }

            Size minSize = new Size(Cfg.cascadeMinEyeSize, Cfg.cascadeMinEyeSize);
            classifier.detectMultiScale(gray, eyes, Cfg.cascadeScaleFactor, Cfg.cascadeMinNeighbors, 0, minSize, new Size());

            Optional<LandmarkSet> eyeCentres = eyeCentres(region, eyes.toList());
            if (eyeCentres.isEmpty())
            {
                LOGGER.fine("fewer than 2 eyes in the face box");
                return prior;
            }
            return prior.withLandmarks(eyeCentres.get());
        }
        catch (CvException error)
        {
            LOGGER.warning("eye cascade detection failed " + error);
            return prior;
        }
        finally
        {
            gray.release();
            eyes.release();
        }
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     eyeCentres                                                  */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Centres of the two largest eye detections, left to right
     * @param region searched part of the frame; eye rectangles are relative to its corner
     * @param eyes detected eye rectangles
     * @return 2 eye centres in frame coordinates or empty if fewer than 2 eyes
     */
    static Optional<LandmarkSet> eyeCentres(Rect region, List<Rect> eyes)
    {
        if (eyes.size() < 2)
        {
            return Optional.empty();
        }

        List<Rect> largest = new ArrayList<>(eyes);
        largest.sort(Comparator.comparingDouble(Rect::area).reversed());

        List<Point> centres = new ArrayList<>(2);
        for (Rect eye : largest.subList(0, 2))
        {
            centres.add(new Point(region.x + eye.x + eye.width / 2., region.y + eye.y + eye.height / 2.));
        }
        centres.sort(Comparator.comparingDouble(p -> p.x));
        return Optional.of(new LandmarkSet(centres));
    }
}
