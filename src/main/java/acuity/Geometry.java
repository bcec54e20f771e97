package acuity;

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     Geometry class                                              */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/**
 * Pinhole camera relations between the real interpupillary distance and its size in the image.
 *
 * All distances are millimetres and all image measures are pixels. Nothing is validated here;
 * a non-positive focal length gives NaN or nonsense angles and the caller guards before display.
 */
public final class Geometry
{
    /** floor for the pixel IPD so a collapsed eye pair gives a huge but finite distance */
    static final double EPSILON = 1e-6;

    private Geometry() {}
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     focalLengthPx                                               */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * One-shot focal length calibration from a snapshot taken at a measured distance.
     *
     * Caller validates pixelIpd and assumedIpdMm are positive.
     *
     * @param pixelIpd eye spacing in the image [px]
     * @param knownDistanceMm measured camera to eye distance [mm]
     * @param assumedIpdMm real eye spacing [mm]
     * @return focal length [px]
     */
    public static double focalLengthPx(double pixelIpd, double knownDistanceMm, double assumedIpdMm)
    {
        return (pixelIpd * knownDistanceMm) / assumedIpdMm;
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     distance                                                    */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Camera to eye and eye to screen distances.
     *
     * D_cam_eye = (IPD_mm * f_px) / pixel_ipd
     * D_eye_screen = max(0, D_cam_eye - offset_mm)
     *
     * @param pixelIpd eye spacing in the image [px]
     * @param assumedIpdMm real eye spacing [mm]
     * @param focalLengthPx calibrated focal length [px]
     * @param offsetMm camera to screen offset [mm]; negative is treated as 0
     * @return both distances
     */
    public static DistanceEstimate distance(double pixelIpd, double assumedIpdMm, double focalLengthPx, double offsetMm)
    {
        double cameraToEyeMm = (assumedIpdMm * focalLengthPx) / Math.max(EPSILON, pixelIpd);
        double eyeToScreenMm = Math.max(0., cameraToEyeMm - Math.max(0., offsetMm));
        return new DistanceEstimate(cameraToEyeMm, eyeToScreenMm);
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     fieldOfView                                                 */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Horizontal, vertical and diagonal field of view
     * @param focalLengthPx
     * @param widthPx image width
     * @param heightPx image height
     * @return angles [degrees]
     */
    public static FieldOfView fieldOfView(double focalLengthPx, int widthPx, int heightPx)
    {
        return new FieldOfView(
            angle(widthPx, focalLengthPx),
            angle(heightPx, focalLengthPx),
            angle(Math.hypot(widthPx, heightPx), focalLengthPx));
    }

    private static double angle(double extentPx, double focalLengthPx)
    {
        return 2. * Math.toDegrees(Math.atan((extentPx / 2.) / focalLengthPx));
    }

    /**
     * Result of {@link Geometry#distance}
     */
    public static final class DistanceEstimate
    {
        private final double cameraToEyeMm;
        private final double eyeToScreenMm;

        DistanceEstimate(double cameraToEyeMm, double eyeToScreenMm)
        {
            this.cameraToEyeMm = cameraToEyeMm;
            this.eyeToScreenMm = eyeToScreenMm;
        }

        public double cameraToEyeMm()
        {
            return cameraToEyeMm;
        }

        public double eyeToScreenMm()
        {
            return eyeToScreenMm;
        }

        @Override
        public String toString()
        {
            return String.format("camera to eye %.0f mm, eye to screen %.0f mm", cameraToEyeMm, eyeToScreenMm);
        }
    }
}
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     End Geometry class                                          */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
