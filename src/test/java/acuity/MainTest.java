package acuity;

import org.apache.commons.cli.ParseException;
import org.junit.Test;
import static org.junit.Assert.*;

public class MainTest {

    @Test
    public void defaultsWithoutOptions() throws ParseException {
        assertTrue(Main.handleArgs(new String[] {}));
        assertEquals(Cfg.modelPath, Main.modelPath);
        assertEquals(Cfg.defaultCardWidthPx, Main.cardWidthPx);
        assertEquals(63., Main.measurementParams.assumedIpdMm(), 0.);
        assertEquals(ChartStyle.MIXED, Main.chartParams.style());
        assertTrue(Main.chartParams.showLabels());
        assertNull(Main.calibrationImage);
        assertNull(Main.chartFile);
    }

    @Test
    public void optionsReachTheParams() throws ParseException {
        assertTrue(Main.handleArgs(new String[] {
            "--score", "2", "-p", "58", "-o", "0", "-k", "700", "-w", "300",
            "-C", "calib.png", "-i", "face.png",
            "-t", "Classic Snellen", "-l", "k", "-n", "-g", "0.1", "-P", "light_on_dark", "-c", "chart.png"}));

        assertEquals(0.95, Main.measurementParams.scoreThreshold(), 0.);
        assertEquals(58., Main.measurementParams.assumedIpdMm(), 0.);
        assertEquals(0., Main.measurementParams.offsetMm(), 0.);
        assertEquals(700., Main.measurementParams.knownDistanceMm(), 0.);
        assertEquals(300, Main.cardWidthPx);
        assertEquals("calib.png", Main.calibrationImage);
        assertEquals("face.png", Main.measurementImage);
        assertEquals(ChartStyle.CLASSIC, Main.chartParams.style());
        assertEquals('K', Main.chartParams.singleLetter());
        assertFalse(Main.chartParams.showLabels());
        assertEquals(0.1, Main.chartParams.letterSpacingEm(), 0.);
        assertEquals(ChartParams.Polarity.LIGHT_ON_DARK, Main.chartParams.polarity());
        assertEquals("chart.png", Main.chartFile);
    }

    @Test
    public void helpStopsTheRun() throws ParseException {
        assertFalse(Main.handleArgs(new String[] {"-h"}));
    }

    @Test(expected = ParseException.class)
    public void unknownOption() throws ParseException {
        Main.handleArgs(new String[] {"--nope"});
    }
}
