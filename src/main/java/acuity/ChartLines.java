package acuity;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.Range;

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     ChartLines class                                            */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/**
 * Text of each chart line, top (largest letters) to bottom.
 */
public final class ChartLines
{
    // letter O, never the digit 0
    static final List<String> CLASSIC_SNELLEN = List.of(
        "E",
        "FP",
        "TOZ",
        "LPED",
        "PECFD",
        "EDFCZP",
        "FELOPZD",
        "DEFPOTEC");

    static final String SLOAN_LETTERS = "CDHKNORSVZ";

    // letters per line grow by one each line between these limits
    static final int MIN_LETTERS = 2;
    static final int MAX_LETTERS = 10;
    private static final Range<Integer> LETTERS_PER_LINE = Range.between(MIN_LETTERS, MAX_LETTERS);

    private ChartLines() {}

    public static List<String> build(ChartStyle style, List<Integer> denominators)
    {
        return build(style, denominators, Cfg.defaultSingleLetter);
    }

    /**
     * One line of text for each denominator
     * @param style
     * @param denominators only the count is used
     * @param singleLetter letter for the single letter style
     * @return lines, same length as denominators
     */
    public static List<String> build(ChartStyle style, List<Integer> denominators, char singleLetter)
    {
        int lineCount = denominators.size();
        List<String> lines = new ArrayList<>(lineCount);

        switch (style)
        {
            case CLASSIC:
                // short chart truncates from the top; long chart repeats the bottom line
                for (int i = 0; i < lineCount; i++)
                {
                    lines.add(CLASSIC_SNELLEN.get(Math.min(i, CLASSIC_SNELLEN.size() - 1)));
                }
                break;

            case SINGLE_LETTER:
                for (int i = 0; i < lineCount; i++)
                {
                    lines.add(String.valueOf(singleLetter).repeat(lettersInLine(i)));
                }
                break;

            case MIXED:
            default:
                for (int i = 0; i < lineCount; i++)
                {
                    StringBuilder line = new StringBuilder(MAX_LETTERS);
                    for (int j = 0; j < lettersInLine(i); j++)
                    {
                        line.append(SLOAN_LETTERS.charAt((j + i) % SLOAN_LETTERS.length())); // rotate start letter each line
                    }
                    lines.add(line.toString());
                }
                break;
        }
        return lines;
    }

    private static int lettersInLine(int lineIndex)
    {
        return LETTERS_PER_LINE.fit(MIN_LETTERS + lineIndex);
    }
}
