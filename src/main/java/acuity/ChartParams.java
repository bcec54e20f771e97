package acuity;

import java.util.Locale;
import java.util.logging.Logger;

import org.apache.commons.lang3.Range;
import org.apache.commons.lang3.StringUtils;

/**
 * Chart appearance chosen by the user
 */
public final class ChartParams
{
    private static final Logger LOGGER = Logger.getLogger("");

    private static final Range<Double> LETTER_SPACING_EM = Range.between(Cfg.letterSpacingEmMin, Cfg.letterSpacingEmMax);

    public enum Polarity {DARK_ON_LIGHT, LIGHT_ON_DARK}

    private final ChartStyle style;
    private final char singleLetter;
    private final boolean showLabels;
    private final Polarity polarity;
    private final double letterSpacingEm;

    /**
     * @param style
     * @param singleLetter first non-blank character is used, upper case; blank is the default letter
     * @param showLabels draw the 6/x labels
     * @param polarity
     * @param letterSpacingEm extra gap between letters as a fraction of the letter size
     */
    public ChartParams(ChartStyle style, String singleLetter, boolean showLabels, Polarity polarity, double letterSpacingEm)
    {
        this.style = style;
        String letter = StringUtils.upperCase(StringUtils.deleteWhitespace(singleLetter), Locale.ROOT);
        this.singleLetter = StringUtils.isEmpty(letter) ? Cfg.defaultSingleLetter : letter.charAt(0);
        this.showLabels = showLabels;
        this.polarity = polarity;
        this.letterSpacingEm = LETTER_SPACING_EM.fit(letterSpacingEm);
        if (this.letterSpacingEm != letterSpacingEm)
        {
            LOGGER.warning("letter spacing " + letterSpacingEm + " em outside " + LETTER_SPACING_EM + ", using " + this.letterSpacingEm);
        }
    }

    public static ChartParams defaults()
    {
        return new ChartParams(ChartStyle.MIXED, String.valueOf(Cfg.defaultSingleLetter), true,
            Polarity.DARK_ON_LIGHT, Cfg.defaultLetterSpacingEm);
    }

    public ChartStyle style()
    {
        return style;
    }

    public char singleLetter()
    {
        return singleLetter;
    }

    public boolean showLabels()
    {
        return showLabels;
    }

    public Polarity polarity()
    {
        return polarity;
    }

    public double letterSpacingEm()
    {
        return letterSpacingEm;
    }
}
