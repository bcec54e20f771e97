package acuity;

import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class SnellenChartTest {

    @Test
    public void oneRowPerCanonicalLineLargestFirst() {
        List<ChartRow> rows = SnellenChart.rows(3000., 4., ChartParams.defaults());
        assertEquals(8, rows.size());
        assertEquals("6/60", rows.get(0).label());
        assertEquals("6/6", rows.get(7).label());
        for (int i = 1; i < rows.size(); i++) {
            assertTrue(rows.get(i).pixelHeight() < rows.get(i - 1).pixelHeight());
        }
    }

    @Test
    public void rowHeightIsTheOptotypeSize() {
        List<ChartRow> rows = SnellenChart.rows(3000., 4., ChartParams.defaults());
        assertEquals(4.362 * 4., rows.get(7).pixelHeight(), 1e-9);
        assertEquals(43.62 * 4., rows.get(0).pixelHeight(), 1e-9);
    }

    @Test
    public void rowsCarryTheStyleText() {
        ChartParams classic = new ChartParams(ChartStyle.CLASSIC, "A", true, ChartParams.Polarity.DARK_ON_LIGHT, 0.05);
        List<ChartRow> rows = SnellenChart.rows(1000., 3., classic);
        assertEquals("E", rows.get(0).text());
        assertEquals("DEFPOTEC", rows.get(7).text());
    }

    @Test
    public void customDenominatorsKeepTheirOrder() {
        List<ChartRow> rows = SnellenChart.rows(2000., 2., List.of(12, 6, 24), ChartStyle.SINGLE_LETTER, 'K');
        assertEquals("6/12", rows.get(0).label());
        assertEquals("6/6", rows.get(1).label());
        assertEquals("6/24", rows.get(2).label());
        assertEquals("KK", rows.get(0).text());
    }

    @Test
    public void uncalibratedScreenGivesZeroSizedRows() {
        for (ChartRow row : SnellenChart.rows(3000., 0., ChartParams.defaults())) {
            assertEquals(0., row.pixelHeight(), 0.);
        }
    }
}
