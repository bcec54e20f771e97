package acuity;

import java.util.logging.Logger;

import org.apache.commons.lang3.StringUtils;

/**
 * Letters used on the chart lines
 */
public enum ChartStyle
{
    CLASSIC("Classic Snellen", "classic"),
    SINGLE_LETTER("Single letter", "single"),
    MIXED("Sloan mix", "mixed");

    private static final Logger LOGGER = Logger.getLogger("");

    private final String displayName;
    private final String shortName;

    ChartStyle(String displayName, String shortName)
    {
        this.displayName = displayName;
        this.shortName = shortName;
    }

    public String displayName()
    {
        return displayName;
    }

    /**
     * Style from its display name, enum name or short name, ignoring case.
     * Anything unrecognized is the Sloan mix.
     * @param name
     * @return chart style
     */
    public static ChartStyle fromName(String name)
    {
        String wanted = StringUtils.trimToEmpty(name);
        for (ChartStyle style : values())
        {
            if (wanted.equalsIgnoreCase(style.displayName)
                || wanted.equalsIgnoreCase(style.name())
                || wanted.equalsIgnoreCase(style.shortName))
            {
                return style;
            }
        }
        if ( ! wanted.isEmpty())
        {
            LOGGER.fine("chart style " + wanted + " unknown, using " + MIXED.displayName);
        }
        return MIXED;
    }
}
