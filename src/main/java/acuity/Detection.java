package acuity;

import java.util.Optional;

/**
 * What the landmark detector found in one frame; either part may be missing.
 */
public final class Detection
{
    private static final Detection NONE = new Detection(null, null);

    private final BoundingBox box;
    private final LandmarkSet landmarks;

    Detection(BoundingBox box, LandmarkSet landmarks)
    {
        this.box = box;
        this.landmarks = landmarks;
    }

    public static Detection none()
    {
        return NONE;
    }

    public Optional<BoundingBox> box()
    {
        return Optional.ofNullable(box);
    }

    public Optional<LandmarkSet> landmarks()
    {
        return Optional.ofNullable(landmarks);
    }

    /**
     * @return true if there are at least 2 landmarks to measure the eye spacing
     */
    public boolean hasEyePair()
    {
        return landmarks != null && landmarks.size() >= 2;
    }

    public Optional<Double> pixelIpd()
    {
        return hasEyePair() ? landmarks.pixelIpd() : Optional.empty();
    }

    /**
     * Same box with new landmarks
     */
    Detection withLandmarks(LandmarkSet landmarks)
    {
        return new Detection(box, landmarks);
    }

    Detection withoutLandmarks()
    {
        return landmarks == null ? this : new Detection(box, null);
    }

    @Override
    public String toString()
    {
        if (box == null && landmarks == null)
        {
            return "no detection";
        }
        return (box == null ? "no box" : box.toString()) + ", " + (landmarks == null ? "no landmarks" : landmarks.toString());
    }
}
