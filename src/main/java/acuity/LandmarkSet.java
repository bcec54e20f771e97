package acuity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.apache.commons.lang3.tuple.Pair;
import org.opencv.core.Point;

/**
 * Face landmarks in pixels.
 *
 * Either the 5 detector keypoints (right eye, left eye, nose tip, right mouth corner, left mouth corner)
 * or the 2 eye centres found by the eye fallback. The first two points are the eyes.
 */
public final class LandmarkSet
{
    private final List<Point> points;

    public LandmarkSet(List<Point> points)
    {
        List<Point> copy = new ArrayList<>(points.size());
        for (Point point : points)
        {
            copy.add(point.clone());
        }
        this.points = List.copyOf(copy);
    }

    /**
     * @return read only points, detector order
     */
    public List<Point> points()
    {
        return points;
    }

    public int size()
    {
        return points.size();
    }

    /**
     * The eyes sorted left to right; left is the smaller x
     * @return (left, right) or empty if fewer than 2 points
     */
    public Optional<Pair<Point, Point>> eyePair()
    {
        if (points.size() < 2)
        {
            return Optional.empty();
        }
        List<Point> eyes = new ArrayList<>(points.subList(0, 2));
        eyes.sort(Comparator.comparingDouble(p -> p.x));
        return Optional.of(Pair.of(eyes.get(0), eyes.get(1)));
    }

    /**
     * @return Euclidean distance between the eye centres [px], or empty if no eye pair
     */
    public Optional<Double> pixelIpd()
    {
        return eyePair().map(eyes -> Math.hypot(eyes.getLeft().x - eyes.getRight().x, eyes.getLeft().y - eyes.getRight().y));
    }

    @Override
    public String toString()
    {
        return points.size() + " landmarks " + points;
    }
}
