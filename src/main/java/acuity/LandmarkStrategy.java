package acuity;

/**
 * One way of finding the face box and eye landmarks.
 *
 * Strategies are tried in priority order; each receives what the earlier ones found and returns
 * that result unchanged when it has nothing to add. Not finding anything is a normal result,
 * never an exception.
 */
public interface LandmarkStrategy
{
    String name();

    /**
     * @return false if the model or classifier file this strategy needs can't be resolved
     */
    boolean isAvailable();

    /**
     * @param frame image to search
     * @param prior result of the higher priority strategies; {@link Detection#none()} for the first
     * @param scoreThreshold detector confidence cutoff, for strategies that score candidates
     * @return prior, or prior improved by this strategy
     */
    Detection detect(Frame frame, Detection prior, double scoreThreshold);
}
