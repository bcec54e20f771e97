package acuity;

import java.util.Collections;
import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class ChartLinesTest {

    private static List<Integer> denominators(int count) {
        return Collections.nCopies(count, 6);
    }

    @Test
    public void classic_eightLinesAreTheTraditionalChart() {
        List<String> lines = ChartLines.build(ChartStyle.CLASSIC, SnellenChart.CANONICAL_DENOMINATORS);
        assertEquals(List.of("E", "FP", "TOZ", "LPED", "PECFD", "EDFCZP", "FELOPZD", "DEFPOTEC"), lines);
    }

    @Test
    public void classic_shortChartKeepsTheTopLines() {
        assertEquals(List.of("E", "FP", "TOZ"), ChartLines.build(ChartStyle.CLASSIC, denominators(3)));
    }

    @Test
    public void classic_longChartRepeatsTheLastLine() {
        List<String> lines = ChartLines.build(ChartStyle.CLASSIC, denominators(10));
        assertEquals(10, lines.size());
        assertEquals("DEFPOTEC", lines.get(8));
        assertEquals("DEFPOTEC", lines.get(9));
    }

    @Test
    public void single_repeatsTheLetterTwoThenThree() {
        List<String> lines = ChartLines.build(ChartStyle.SINGLE_LETTER, denominators(3), 'B');
        assertEquals(List.of("BB", "BBB", "BBBB"), lines);
    }

    @Test
    public void mixed_usesSloanLettersGrowingByOne() {
        List<String> lines = ChartLines.build(ChartStyle.MIXED, SnellenChart.CANONICAL_DENOMINATORS);
        assertEquals("CD", lines.get(0));
        assertEquals("DHK", lines.get(1));
        for (int i = 0; i < lines.size(); i++) {
            assertEquals(2 + i, lines.get(i).length());
            for (char letter : lines.get(i).toCharArray()) {
                assertTrue(ChartLines.SLOAN_LETTERS.indexOf(letter) >= 0);
            }
        }
    }

    @Test
    public void lettersPerLineStopAtTen() {
        List<String> mixed = ChartLines.build(ChartStyle.MIXED, denominators(12));
        List<String> single = ChartLines.build(ChartStyle.SINGLE_LETTER, denominators(12), 'E');
        assertEquals(10, mixed.get(8).length());
        assertEquals(10, mixed.get(11).length());
        assertEquals("EEEEEEEEEE", single.get(11));
    }

    @Test
    public void noDigitZeroInAnyStyle() {
        for (ChartStyle style : ChartStyle.values()) {
            for (String line : ChartLines.build(style, denominators(12), 'O')) {
                assertFalse(line.contains("0"));
            }
        }
    }

    @Test
    public void noLinesForNoDenominators() {
        assertTrue(ChartLines.build(ChartStyle.MIXED, List.of()).isEmpty());
    }
}
