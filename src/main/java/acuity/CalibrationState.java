package acuity;

import java.util.OptionalDouble;

/**
 * Calibration results kept for a user session.
 *
 * Only {@link CalibrationSession} changes these; a failed detection never clears them.
 */
public final class CalibrationState
{
    private double screenPixelsPerMm; // 0 until the screen is calibrated
    private Double focalLengthPx;
    private Double eyeToScreenMm;

    CalibrationState() {}

    public double screenPixelsPerMm()
    {
        return screenPixelsPerMm;
    }

    public OptionalDouble focalLengthPx()
    {
        return focalLengthPx == null ? OptionalDouble.empty() : OptionalDouble.of(focalLengthPx);
    }

    public OptionalDouble eyeToScreenMm()
    {
        return eyeToScreenMm == null ? OptionalDouble.empty() : OptionalDouble.of(eyeToScreenMm);
    }

    /**
     * @return how far calibration has progressed
     */
    public CalibrationPhase phase()
    {
        if (eyeToScreenMm != null)
        {
            return CalibrationPhase.DISTANCE_KNOWN;
        }
        if (focalLengthPx != null)
        {
            return CalibrationPhase.FOCAL_LENGTH_KNOWN;
        }
        if (screenPixelsPerMm > 0.)
        {
            return CalibrationPhase.SCREEN_SCALE_KNOWN;
        }
        return CalibrationPhase.UNCALIBRATED;
    }

    void screenPixelsPerMm(double screenPixelsPerMm)
    {
        this.screenPixelsPerMm = screenPixelsPerMm;
    }

    void focalLengthPx(double focalLengthPx)
    {
        this.focalLengthPx = focalLengthPx;
    }

    void eyeToScreenMm(double eyeToScreenMm)
    {
        this.eyeToScreenMm = eyeToScreenMm;
    }

    void clear()
    {
        screenPixelsPerMm = 0.;
        focalLengthPx = null;
        eyeToScreenMm = null;
    }

    @Override
    public String toString()
    {
        return phase() + " screen " + screenPixelsPerMm + " px/mm, f " + focalLengthPx + " px, eye to screen " + eyeToScreenMm + " mm";
    }
}
