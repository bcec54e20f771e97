package acuity;

import java.util.EnumSet;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.logging.Logger;

import org.apache.commons.lang3.Range;
import org.apache.commons.lang3.Validate;

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     CalibrationSession class                                    */
/*                                     CalibrationSession class                                    */
/*                                     CalibrationSession class                                    */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*
 * The steps a user goes through, one trigger at a time:
 *
 * 1. Calibrate the screen scale by matching an on-screen card outline to a real card.
 * 2. Take a snapshot; the eye spacing in pixels (pixel IPD) is measured.
 * 3. Once, sitting at a measured distance, calibrate the camera focal length from that pixel IPD.
 * 4. From then on every snapshot gives the eye to screen distance, which sizes the chart.
 *
 * The pixel IPD of the latest snapshot lives here and not in the CalibrationState; the next
 * snapshot replaces it, successful or not. Calibrated values are only replaced by a new
 * calibration or cleared by reset.
 *
 * One session per user. Methods are synchronized so a host that delivers triggers on
 * different threads still sees them one at a time.
 */
public class CalibrationSession
{
    private static Logger LOGGER;
    static {
      LOGGER = Logger.getLogger("");
      LOGGER.finest("Loading");
    }

    private static final Range<Integer> CARD_WIDTH_PX = Range.between(Cfg.cardWidthPxMin, Cfg.cardWidthPxMax);

    private final LandmarkDetector detector;
    private final CalibrationState state = new CalibrationState();
    private MeasurementParams params;

    // latest snapshot
    private Double latestIpd; // null if the latest snapshot had no eye pair or there was none
    private int latestWidth;
    private int latestHeight;
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     CalibrationSession constructor                              */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    public CalibrationSession(LandmarkDetector detector, MeasurementParams params)
    {
        this.detector = detector;
        this.params = params;
        LOGGER.config("calibration session " + params);
    }

    public synchronized MeasurementParams params()
    {
        return params;
    }

    /**
     * New control values; they apply from the next snapshot or calibration
     * @param params
     */
    public synchronized void params(MeasurementParams params)
    {
        this.params = params;
        LOGGER.fine("measurement params " + params);
    }

    // getters
    public synchronized CalibrationPhase phase()
    {
        return state.phase();
    }
    public synchronized double screenPixelsPerMm()
    {
        return state.screenPixelsPerMm();
    }
    public synchronized OptionalDouble focalLengthPx()
    {
        return state.focalLengthPx();
    }
    public synchronized OptionalDouble eyeToScreenMm()
    {
        return state.eyeToScreenMm();
    }
    public synchronized OptionalDouble latestPixelIpd()
    {
        return latestIpd == null ? OptionalDouble.empty() : OptionalDouble.of(latestIpd);
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     setScreenScale                                              */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Screen scale; doesn't touch the focal length or distance
     * @param pixelsPerMm not negative
     */
    public synchronized void setScreenScale(double pixelsPerMm)
    {
        Validate.isTrue(pixelsPerMm >= 0. && Double.isFinite(pixelsPerMm), "screen scale must be a finite value >= 0: %s", pixelsPerMm);
        state.screenPixelsPerMm(pixelsPerMm);
        LOGGER.info(String.format("Pixels per millimetre: %.3f px/mm", pixelsPerMm));
    }

    /**
     * Screen scale from an on-screen card outline the user stretched to match a real ID-1 card
     * @param cardWidthPx outline width [px]; held to the slider range
     * @return pixels per millimetre
     */
    public synchronized double setScreenScaleFromCard(int cardWidthPx)
    {
        int widthPx = CARD_WIDTH_PX.fit(cardWidthPx);
        if (widthPx != cardWidthPx)
        {
            LOGGER.warning("card width " + cardWidthPx + " px outside " + CARD_WIDTH_PX + ", using " + widthPx);
        }
        double pixelsPerMm = widthPx / Cfg.cardWidthMm;
        setScreenScale(pixelsPerMm);
        LOGGER.fine(String.format("card outline %d x %.0f px", widthPx, widthPx * (Cfg.cardHeightMm / Cfg.cardWidthMm)));
        return pixelsPerMm;
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     onSnapshot                                                  */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Measure the eye spacing in a new snapshot and, if the focal length is known, the distance.
     * @param frame
     * @return what was found and any user notices
     */
    public synchronized SnapshotResult onSnapshot(Frame frame)
    {
        Set<Notice> notices = EnumSet.noneOf(Notice.class);

        boolean modelAvailable = detector.modelAvailable();
        if ( ! modelAvailable)
        {
            notices.add(Notice.MODEL_MISSING);
        }
        Detection detection = detector.detect(frame, modelAvailable, params.scoreThreshold());

        latestWidth = frame.width();
        latestHeight = frame.height();
        latestIpd = detection.pixelIpd().orElse(null);

        if (latestIpd == null)
        {
            notices.add(Notice.NO_LANDMARKS);
        }
        else
        {
            LOGGER.info(String.format("Pixel IPD: %.1f px", latestIpd));
        }

        Reestimate reestimate = reestimate(notices);
        warn(notices);
        return new SnapshotResult(detection, latestIpd, reestimate.distance, reestimate.fieldOfView, notices);
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     calibrateFocalLength                                        */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Focal length calibration with the known distance and IPD of the current params
     * @return notices; empty if calibrated
     */
    public synchronized Set<Notice> calibrateFocalLength()
    {
        return calibrateFocalLength(params.knownDistanceMm(), params.assumedIpdMm());
    }

    /**
     * Focal length from the latest snapshot taken at a measured camera to eye distance.
     *
     * The distance and IPD become the session's params, so later snapshots measure with the
     * same IPD the focal length was calibrated with. Without a usable snapshot nothing changes.
     *
     * @param knownDistanceMm measured camera to eye distance [mm]; held to its range
     * @param assumedIpdMm real eye spacing [mm]; held to its range
     * @return notices; empty if calibrated
     */
    public synchronized Set<Notice> calibrateFocalLength(double knownDistanceMm, double assumedIpdMm)
    {
        Set<Notice> notices = EnumSet.noneOf(Notice.class);
        if (latestIpd == null)
        {
            notices.add(Notice.NO_SNAPSHOT);
            warn(notices);
            return notices;
        }
        if ( ! (latestIpd > 0.))
        {
            // both eyes on one pixel
            notices.add(Notice.NO_LANDMARKS);
            warn(notices);
            return notices;
        }
        Validate.isTrue(assumedIpdMm > 0., "assumed IPD must be positive: %s", assumedIpdMm);

        params = new MeasurementParams(params.scoreThreshold(), assumedIpdMm, params.offsetMm(), knownDistanceMm);

        double focalLengthPx = Geometry.focalLengthPx(latestIpd, params.knownDistanceMm(), params.assumedIpdMm());
        state.focalLengthPx(focalLengthPx);
        LOGGER.info(String.format("Calibrated focal length: %.1f px", focalLengthPx));

        reestimate(notices);
        warn(notices);
        return notices;
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     reestimate                                                  */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    private Reestimate reestimate(Set<Notice> notices)
    {
        OptionalDouble focalLengthPx = state.focalLengthPx();
        if (focalLengthPx.isEmpty())
        {
            notices.add(Notice.NOT_CALIBRATED);
            return Reestimate.NONE;
        }
        if (latestIpd == null)
        {
            return Reestimate.NONE; // keep the last distance
        }

        Geometry.DistanceEstimate distance = Geometry.distance(latestIpd, params.assumedIpdMm(), focalLengthPx.getAsDouble(), params.offsetMm());
        state.eyeToScreenMm(distance.eyeToScreenMm());
        FieldOfView fieldOfView = Geometry.fieldOfView(focalLengthPx.getAsDouble(), latestWidth, latestHeight);
        LOGGER.info(fieldOfView + ", " + distance);
        return new Reestimate(distance, fieldOfView);
    }

    private static final class Reestimate
    {
        static final Reestimate NONE = new Reestimate(null, null);

        final Geometry.DistanceEstimate distance;
        final FieldOfView fieldOfView;

        Reestimate(Geometry.DistanceEstimate distance, FieldOfView fieldOfView)
        {
            this.distance = distance;
            this.fieldOfView = fieldOfView;
        }
    }

    private static void warn(Set<Notice> notices)
    {
        for (Notice notice : notices)
        {
            LOGGER.warning(notice.message());
        }
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     readingDistanceMm                                           */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * @return measured eye to screen distance, or the standard 3 m chart distance if none (or 0) yet [mm]
     */
    public synchronized double readingDistanceMm()
    {
        OptionalDouble eyeToScreenMm = state.eyeToScreenMm();
        if (eyeToScreenMm.isPresent() && eyeToScreenMm.getAsDouble() > 0.)
        {
            return eyeToScreenMm.getAsDouble();
        }
        return Cfg.defaultReadingDistanceMm;
    }

    /**
     * Chart rows sized for the reading distance and screen scale
     * @param chart
     * @return rows, largest letters first
     */
    public synchronized List<ChartRow> chartRows(ChartParams chart)
    {
        return SnellenChart.rows(readingDistanceMm(), state.screenPixelsPerMm(), chart);
    }

    /**
     * Forget everything calibrated and the latest snapshot
     */
    public synchronized void reset()
    {
        state.clear();
        latestIpd = null;
        latestWidth = 0;
        latestHeight = 0;
        LOGGER.info("calibration reset");
    }

    @Override
    public synchronized String toString()
    {
        return state.toString();
    }
}
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     End CalibrationSession class                                */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
