package acuity;

import java.util.List;
import java.util.logging.Logger;

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     FallbackLandmarkDetector class                              */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/**
 * Landmark detector made of strategies in priority order.
 *
 * The first strategy is the primary face model. The next strategy runs only if the ones before it
 * did not find an eye pair; it sees their partial result (usually a face box without usable keypoints).
 */
public class FallbackLandmarkDetector implements LandmarkDetector
{
    private static Logger LOGGER;
    static {
      LOGGER = Logger.getLogger("");
      LOGGER.finest("Loading");
    }

    private final List<LandmarkStrategy> strategies;

    /**
     * @param strategies primary first; at least one
     */
    public FallbackLandmarkDetector(List<LandmarkStrategy> strategies)
    {
        if (strategies.isEmpty())
        {
            throw new IllegalArgumentException("no landmark strategies");
        }
        this.strategies = List.copyOf(strategies);
    }

    /**
     * YuNet face model then the Haar eye cascade
     * @param modelPath YuNet ONNX file
     * @param eyeCascadePath Haar cascade XML file
     * @return detector
     */
    public static FallbackLandmarkDetector create(String modelPath, String eyeCascadePath)
    {
        return new FallbackLandmarkDetector(List.of(
            new YuNetFaceStrategy(modelPath),
            new EyeCascadeStrategy(eyeCascadePath)));
    }

    @Override
    public boolean modelAvailable()
    {
        return strategies.get(0).isAvailable();
    }

    @Override
    public Detection detect(Frame frame, boolean modelAvailable, double scoreThreshold)
    {
        if ( ! modelAvailable)
        {
            LOGGER.fine("face model not available, no detection");
            return Detection.none();
        }

        Detection result = Detection.none();
        for (LandmarkStrategy strategy : strategies)
        {
            if ( ! strategy.isAvailable())
            {
                LOGGER.fine(strategy.name() + " not available, skipped");
                continue;
            }
            result = strategy.detect(frame, result, scoreThreshold);
            LOGGER.finer(strategy.name() + ": " + result);
            if (result.hasEyePair())
            {
                return result;
            }
        }

        // a single stray keypoint can't be measured
        return result.withoutLandmarks();
    }
}
