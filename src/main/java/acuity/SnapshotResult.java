package acuity;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Everything learned from one snapshot
 */
public final class SnapshotResult
{
    private final Detection detection;
    private final Double pixelIpd;
    private final Geometry.DistanceEstimate distance;
    private final FieldOfView fieldOfView;
    private final EnumSet<Notice> notices;

    SnapshotResult(Detection detection, Double pixelIpd, Geometry.DistanceEstimate distance, FieldOfView fieldOfView, Set<Notice> notices)
    {
        this.detection = detection;
        this.pixelIpd = pixelIpd;
        this.distance = distance;
        this.fieldOfView = fieldOfView;
        this.notices = notices.isEmpty() ? EnumSet.noneOf(Notice.class) : EnumSet.copyOf(notices);
    }

    public Detection detection()
    {
        return detection;
    }

    public Optional<Double> pixelIpd()
    {
        return Optional.ofNullable(pixelIpd);
    }

    /**
     * @return distances if the focal length was known when the snapshot was processed
     */
    public Optional<Geometry.DistanceEstimate> distance()
    {
        return Optional.ofNullable(distance);
    }

    public Optional<FieldOfView> fieldOfView()
    {
        return Optional.ofNullable(fieldOfView);
    }

    public Set<Notice> notices()
    {
        return EnumSet.copyOf(notices);
    }

    public boolean has(Notice notice)
    {
        return notices.contains(notice);
    }
}
