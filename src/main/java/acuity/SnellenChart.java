package acuity;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Snellen chart rows sized for a viewing distance and screen scale.
 */
public final class SnellenChart
{
    private static Logger LOGGER;
    static {
      LOGGER = Logger.getLogger("");
      LOGGER.finest("Loading");
    }

    /** fixed 6/x lines, largest letters first */
    public static final List<Integer> CANONICAL_DENOMINATORS = Cfg.chartDenominators;

    private SnellenChart() {}

    public static List<ChartRow> rows(double distanceMm, double pixelsPerMm, ChartParams chart)
    {
        return rows(distanceMm, pixelsPerMm, CANONICAL_DENOMINATORS, chart.style(), chart.singleLetter());
    }

    /**
     * @param distanceMm eye to screen distance [mm]
     * @param pixelsPerMm screen scale; 0 if the screen was never calibrated
     * @param denominators lines to produce
     * @param style letters to use
     * @param singleLetter letter for the single letter style
     * @return one row per denominator, same order
     */
    public static List<ChartRow> rows(double distanceMm, double pixelsPerMm, List<Integer> denominators,
        ChartStyle style, char singleLetter)
    {
        if (pixelsPerMm <= 0.)
        {
            LOGGER.warning("screen scale not calibrated; letters have no size");
        }

        List<String> lines = ChartLines.build(style, denominators, singleLetter);
        List<ChartRow> rows = new ArrayList<>(denominators.size());
        for (int i = 0; i < denominators.size(); i++)
        {
            int denominator = denominators.get(i);
            double px = Optotype.letterSizePx(distanceMm, denominator, pixelsPerMm);
            rows.add(new ChartRow(label(denominator), px, lines.get(i)));
        }
        LOGGER.fine(rows.size() + " chart rows at " + Math.round(distanceMm) + " mm, " + pixelsPerMm + " px/mm");
        return rows;
    }

    static String label(int denominator)
    {
        return "6/" + denominator;
    }
}
