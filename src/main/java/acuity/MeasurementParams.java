package acuity;

import java.util.logging.Logger;

import org.apache.commons.lang3.Range;

/**
 * Numeric controls for detection and distance, each held inside its allowed range.
 */
public final class MeasurementParams
{
    private static Logger LOGGER;
    static {
      LOGGER = Logger.getLogger("");
      LOGGER.finest("Loading");
    }

    static final Range<Double> SCORE_THRESHOLD = Range.between(Cfg.scoreThresholdMin, Cfg.scoreThresholdMax);
    static final Range<Double> IPD_MM = Range.between(Cfg.ipdMmMin, Cfg.ipdMmMax);
    static final Range<Double> OFFSET_MM = Range.between(Cfg.offsetMmMin, Cfg.offsetMmMax);
    static final Range<Double> KNOWN_DISTANCE_MM = Range.between(Cfg.knownDistanceMmMin, Cfg.knownDistanceMmMax);

    private final double scoreThreshold;
    private final double assumedIpdMm;
    private final double offsetMm;
    private final double knownDistanceMm;

    /**
     * Out of range values are pulled to the nearest limit.
     * @param scoreThreshold detector confidence cutoff
     * @param assumedIpdMm real interpupillary distance [mm]
     * @param offsetMm camera to screen offset [mm]
     * @param knownDistanceMm measured camera to eye distance for focal calibration [mm]
     */
    public MeasurementParams(double scoreThreshold, double assumedIpdMm, double offsetMm, double knownDistanceMm)
    {
        this.scoreThreshold = fit("score threshold", SCORE_THRESHOLD, scoreThreshold);
        this.assumedIpdMm = fit("interpupillary distance mm", IPD_MM, assumedIpdMm);
        this.offsetMm = fit("camera to screen offset mm", OFFSET_MM, offsetMm);
        this.knownDistanceMm = fit("known camera to eye distance mm", KNOWN_DISTANCE_MM, knownDistanceMm);
    }

    public static MeasurementParams defaults()
    {
        return new MeasurementParams(Cfg.defaultScoreThreshold, Cfg.defaultIpdMm, Cfg.defaultOffsetMm, Cfg.defaultKnownDistanceMm);
    }

    private static double fit(String name, Range<Double> range, double value)
    {
        if (Double.isNaN(value))
        {
            LOGGER.warning(name + " is not a number, using " + range.getMinimum());
            return range.getMinimum();
        }
        double fitted = range.fit(value);
        if (fitted != value)
        {
            LOGGER.warning(name + " " + value + " outside " + range + ", using " + fitted);
        }
        return fitted;
    }

    public double scoreThreshold()
    {
        return scoreThreshold;
    }

    public double assumedIpdMm()
    {
        return assumedIpdMm;
    }

    public double offsetMm()
    {
        return offsetMm;
    }

    public double knownDistanceMm()
    {
        return knownDistanceMm;
    }

    @Override
    public String toString()
    {
        return "score " + scoreThreshold + ", IPD " + assumedIpdMm + " mm, offset " + offsetMm
            + " mm, known distance " + knownDistanceMm + " mm";
    }
}
