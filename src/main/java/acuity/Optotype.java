package acuity;

/**
 * Optotype size for a Snellen line.
 *
 * A 6/6 letter subtends 5 arc minutes at the viewing distance; tan(5') = 0.001454.
 * A 6/x letter is x/6 times that size.
 */
public final class Optotype
{
    static final double FIVE_ARCMIN = 0.001454;

    private Optotype() {}

    /**
     * @param distanceMm eye to chart distance [mm]
     * @param denominator Snellen denominator, the x in 6/x
     * @return letter height [mm]
     */
    public static double letterHeightMm(double distanceMm, double denominator)
    {
        return distanceMm * FIVE_ARCMIN * (denominator / 6.);
    }

    /**
     * @param distanceMm eye to chart distance [mm]
     * @param denominator Snellen denominator
     * @param pixelsPerMm screen scale
     * @return letter height [px]
     */
    public static double letterSizePx(double distanceMm, double denominator, double pixelsPerMm)
    {
        return letterHeightMm(distanceMm, denominator) * pixelsPerMm;
    }
}
