package acuity;

import org.junit.Test;
import static org.junit.Assert.*;

public class ArrayUtilsTest {

    @Test
    public void argmaxTakesTheFirstOfEqualMaxima() {
        assertEquals(1, ArrayUtils.argmax(new double[] {0.2, 0.9, 0.5, 0.9}));
        assertEquals(0, ArrayUtils.argmax(new double[] {-1.}));
    }

    @Test
    public void column() {
        float[][] rows = {{1f, 2f}, {3f, 4f}};
        assertArrayEquals(new double[] {2., 4.}, ArrayUtils.column(rows, 1), 0.);
    }
}
