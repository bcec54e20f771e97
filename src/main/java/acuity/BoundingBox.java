package acuity;

import org.opencv.core.Rect;

/**
 * Face box in pixels, top left origin
 */
public final class BoundingBox
{
    private final double x;
    private final double y;
    private final double width;
    private final double height;

    public BoundingBox(double x, double y, double width, double height)
    {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public double x()
    {
        return x;
    }

    public double y()
    {
        return y;
    }

    public double width()
    {
        return width;
    }

    public double height()
    {
        return height;
    }

    /**
     * Whole pixel rectangle, truncated like an int cast, then clipped to the image.
     * @param imageWidth
     * @param imageHeight
     * @return rectangle inside the image; zero area if the box is outside
     */
    Rect toRect(int imageWidth, int imageHeight)
    {
        int left = Math.max(0, (int) x);
        int top = Math.max(0, (int) y);
        int right = Math.min(imageWidth, (int) x + (int) width);
        int bottom = Math.min(imageHeight, (int) y + (int) height);
        return new Rect(left, top, Math.max(0, right - left), Math.max(0, bottom - top));
    }

    @Override
    public String toString()
    {
        return String.format("box (%.1f, %.1f) %.1fx%.1f", x, y, width, height);
    }
}
