package acuity;

/**
 * Camera field of view [degrees]
 */
public final class FieldOfView
{
    private final double horizontalDeg;
    private final double verticalDeg;
    private final double diagonalDeg;

    FieldOfView(double horizontalDeg, double verticalDeg, double diagonalDeg)
    {
        this.horizontalDeg = horizontalDeg;
        this.verticalDeg = verticalDeg;
        this.diagonalDeg = diagonalDeg;
    }

    public double horizontalDeg()
    {
        return horizontalDeg;
    }

    public double verticalDeg()
    {
        return verticalDeg;
    }

    public double diagonalDeg()
    {
        return diagonalDeg;
    }

    @Override
    public String toString()
    {
        return String.format("FOV %.1f° x %.1f° (diag %.1f°)", horizontalDeg, verticalDeg, diagonalDeg);
    }
}
