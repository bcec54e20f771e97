package acuity;

import java.util.List;
import java.util.logging.Logger;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     ChartRenderer class                                         */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/**
 * Draws the chart rows into an image at their true pixel size.
 *
 * Each letter is scaled so its cap height is the row pixel height. A green bar follows the 6/12
 * line and a red bar the 6/9 line. Rows under 1 px or over {@link #MAX_LETTER_HEIGHT} keep their
 * label but no letters.
 */
public final class ChartRenderer
{
    private static Logger LOGGER;
    static {
      LOGGER = Logger.getLogger("");
      LOGGER.finest("Loading");
    }

    private static final int FONT = Imgproc.FONT_HERSHEY_SIMPLEX;
    private static final int PADDING = 20;
    private static final int LABEL_GUTTER = 64;
    private static final int GUTTER_GAP = 12;
    private static final int ROW_GAP = 26;
    private static final int LABEL_HEIGHT = 15;
    private static final int BAR_HEIGHT = 6;
    private static final int BAR_GAP = 18;
    private static final int MIN_WIDTH = 720;
    static final double MAX_LETTER_HEIGHT = 1000.; // px; taller rows are only labelled

    private static final Scalar GREEN_BAR = bgr("#2ecc71");
    private static final Scalar RED_BAR = bgr("#e74c3c");

    private ChartRenderer() {}
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     render                                                      */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * @param rows chart rows, top first
     * @param chart polarity, labels and letter spacing
     * @return BGR chart image
     */
    public static Mat render(List<ChartRow> rows, ChartParams chart)
    {
        boolean dark = chart.polarity() == ChartParams.Polarity.DARK_ON_LIGHT;
        Scalar foreground = bgr(dark ? "#1f2430" : "#f4f6fa");
        Scalar labelColor = bgr(dark ? "#9aa3ad" : "#b8c4d1");
        Scalar background = bgr(dark ? "#ffffff" : "#0b2733");

        // measure
        int lettersWidth = 0;
        int height = 2 * PADDING;
        for (ChartRow row : rows)
        {
            lettersWidth = Math.max(lettersWidth, lineWidth(row, chart.letterSpacingEm()));
            height += rowHeight(row) + ROW_GAP;
            if (hasBar(row))
            {
                height += BAR_GAP + BAR_HEIGHT;
            }
        }
        int width = Math.max(MIN_WIDTH, 2 * PADDING + LABEL_GUTTER + GUTTER_GAP + lettersWidth);

        Mat img = new Mat(height, width, CvType.CV_8UC3, background);
        int lettersLeft = PADDING + LABEL_GUTTER + GUTTER_GAP;
        int lettersArea = width - lettersLeft - PADDING;

        // draw
        int top = PADDING;
        for (ChartRow row : rows)
        {
            int baseline = top + rowHeight(row);

            if (chart.showLabels())
            {
                double labelScale = scaleFor(LABEL_HEIGHT, 1);
                Size labelSize = Imgproc.getTextSize(row.label(), FONT, labelScale, 1, new int[1]);
                int labelX = PADDING + LABEL_GUTTER - (int) labelSize.width; // right aligned in the gutter
                int labelY = baseline - (rowHeight(row) - LABEL_HEIGHT) / 2;
                Imgproc.putText(img, row.label(), new Point(labelX, labelY), FONT, labelScale, labelColor, 1, Imgproc.LINE_AA);
            }

            if (drawable(row))
            {
                int thickness = thickness(row.pixelHeight());
                double scale = scaleFor(row.pixelHeight(), thickness);
                int gap = (int) Math.round(chart.letterSpacingEm() * row.pixelHeight());
                int x = lettersLeft + (lettersArea - lineWidth(row, chart.letterSpacingEm())) / 2; // centred
                for (char letter : row.text().toCharArray())
                {
                    String text = String.valueOf(letter);
                    Imgproc.putText(img, text, new Point(x, baseline), FONT, scale, foreground, thickness, Imgproc.LINE_AA);
                    x += (int) Imgproc.getTextSize(text, FONT, scale, thickness, new int[1]).width + gap;
                }
            }
            else
            {
                LOGGER.warning(String.format("%s letters %.1f px, outside 1 to %.0f px, not drawn",
                    row.label(), row.pixelHeight(), MAX_LETTER_HEIGHT));
            }

            top = baseline + ROW_GAP;

            if (hasBar(row))
            {
                top += BAR_GAP;
                Imgproc.rectangle(img, new Point(lettersLeft, top), new Point(lettersLeft + lettersArea, top + BAR_HEIGHT),
                    "6/12".equals(row.label()) ? GREEN_BAR : RED_BAR, Imgproc.FILLED);
                top += BAR_HEIGHT;
            }
        }

        LOGGER.fine("chart image " + width + "x" + height);
        return img;
    }

    private static boolean hasBar(ChartRow row)
    {
        return "6/12".equals(row.label()) || "6/9".equals(row.label());
    }

    private static boolean drawable(ChartRow row)
    {
        return row.pixelHeight() >= 1. && row.pixelHeight() <= MAX_LETTER_HEIGHT;
    }

    private static int rowHeight(ChartRow row)
    {
        return drawable(row) ? Math.max(LABEL_HEIGHT, (int) Math.ceil(row.pixelHeight())) : LABEL_HEIGHT;
    }

    private static int thickness(double pixelHeight)
    {
        return Math.max(1, (int) Math.round(pixelHeight / 10.)); // bold
    }

    /**
     * Font scale that makes a capital letter the wanted height
     */
    private static double scaleFor(double pixelHeight, int thickness)
    {
        Size unit = Imgproc.getTextSize("E", FONT, 1., thickness, new int[1]);
        return pixelHeight / unit.height;
    }

    private static int lineWidth(ChartRow row, double letterSpacingEm)
    {
        if ( ! drawable(row) || row.text().isEmpty())
        {
            return 0;
        }
        int thickness = thickness(row.pixelHeight());
        double scale = scaleFor(row.pixelHeight(), thickness);
        int gap = (int) Math.round(letterSpacingEm * row.pixelHeight());
        int width = 0;
        for (char letter : row.text().toCharArray())
        {
            width += (int) Imgproc.getTextSize(String.valueOf(letter), FONT, scale, thickness, new int[1]).width;
        }
        return width + gap * (row.text().length() - 1);
    }

    /**
     * @param hex web colour #rrggbb
     * @return OpenCV BGR colour
     */
    static Scalar bgr(String hex)
    {
        int rgb = Integer.parseInt(hex.substring(1), 16);
        return new Scalar(rgb & 0xff, (rgb >> 8) & 0xff, (rgb >> 16) & 0xff);
    }
}
