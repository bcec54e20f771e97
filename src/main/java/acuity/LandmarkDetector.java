package acuity;

/**
 * Finds a face box and the eye landmarks in a frame.
 */
public interface LandmarkDetector
{
    /**
     * @return true if the primary face model can be loaded
     */
    boolean modelAvailable();

    /**
     * @param frame image to search
     * @param modelAvailable false skips detection entirely
     * @param scoreThreshold face confidence cutoff
     * @return the best face found; landmarks are present only if there are at least 2 of them
     */
    Detection detect(Frame frame, boolean modelAvailable, double scoreThreshold);

    default Detection detect(Frame frame, double scoreThreshold)
    {
        return detect(frame, modelAvailable(), scoreThreshold);
    }
}
