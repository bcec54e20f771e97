package acuity;

import java.util.Locale;

import org.junit.Test;
import static org.junit.Assert.*;

public class ParamsTest {

    @Test
    public void measurementDefaults() {
        MeasurementParams params = MeasurementParams.defaults();
        assertEquals(0.30, params.scoreThreshold(), 0.);
        assertEquals(63., params.assumedIpdMm(), 0.);
        assertEquals(40., params.offsetMm(), 0.);
        assertEquals(500., params.knownDistanceMm(), 0.);
    }

    @Test
    public void measurementValuesAreHeldInRange() {
        MeasurementParams params = new MeasurementParams(0.01, 90., -10., 5000.);
        assertEquals(0.05, params.scoreThreshold(), 0.);
        assertEquals(80., params.assumedIpdMm(), 0.);
        assertEquals(0., params.offsetMm(), 0.);
        assertEquals(2000., params.knownDistanceMm(), 0.);
    }

    @Test
    public void measurementNotANumberIsTheMinimum() {
        MeasurementParams params = new MeasurementParams(Double.NaN, 63., 40., 500.);
        assertEquals(0.05, params.scoreThreshold(), 0.);
    }

    @Test
    public void chartDefaults() {
        ChartParams chart = ChartParams.defaults();
        assertEquals(ChartStyle.MIXED, chart.style());
        assertEquals('A', chart.singleLetter());
        assertTrue(chart.showLabels());
        assertEquals(ChartParams.Polarity.DARK_ON_LIGHT, chart.polarity());
        assertEquals(0.05, chart.letterSpacingEm(), 0.);
    }

    @Test
    public void singleLetterIsFirstNonBlankUpperCase() {
        ChartParams chart = new ChartParams(ChartStyle.SINGLE_LETTER, "  kz", true, ChartParams.Polarity.DARK_ON_LIGHT, 0.);
        assertEquals('K', chart.singleLetter());
    }

    @Test
    public void singleLetterIgnoresTheDefaultLocale() {
        Locale locale = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals('I', new ChartParams(ChartStyle.SINGLE_LETTER, "i", true, ChartParams.Polarity.DARK_ON_LIGHT, 0.).singleLetter());
        } finally {
            Locale.setDefault(locale);
        }
    }

    @Test
    public void blankSingleLetterIsTheDefault() {
        assertEquals('A', new ChartParams(ChartStyle.SINGLE_LETTER, " ", true, ChartParams.Polarity.DARK_ON_LIGHT, 0.).singleLetter());
        assertEquals('A', new ChartParams(ChartStyle.SINGLE_LETTER, null, true, ChartParams.Polarity.DARK_ON_LIGHT, 0.).singleLetter());
    }

    @Test
    public void letterSpacingIsHeldInRange() {
        assertEquals(0.20, new ChartParams(ChartStyle.MIXED, "A", true, ChartParams.Polarity.LIGHT_ON_DARK, 0.5).letterSpacingEm(), 0.);
        assertEquals(0., new ChartParams(ChartStyle.MIXED, "A", true, ChartParams.Polarity.LIGHT_ON_DARK, -0.1).letterSpacingEm(), 0.);
    }
}
