package acuity;

/**
 * One renderable chart line: 6/x label, letter height [px] and the letters
 */
public final class ChartRow
{
    private final String label;
    private final double pixelHeight;
    private final String text;

    ChartRow(String label, double pixelHeight, String text)
    {
        this.label = label;
        this.pixelHeight = pixelHeight;
        this.text = text;
    }

    public String label()
    {
        return label;
    }

    public double pixelHeight()
    {
        return pixelHeight;
    }

    public String text()
    {
        return text;
    }

    @Override
    public String toString()
    {
        return String.format("%-5s %7.2f px  %s", label, pixelHeight, text);
    }
}
