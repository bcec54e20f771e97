package acuity;

/**
 * User facing warnings; none of them are errors, the measurement is just not available yet.
 */
public enum Notice
{
    MODEL_MISSING("YuNet face model not found. Download face_detection_yunet_2023mar.onnx into models/onnx."),
    NO_LANDMARKS("Could not estimate eyes. Try brighter lighting and face the camera."),
    NO_SNAPSHOT("Take a snapshot first."),
    NOT_CALIBRATED("Not calibrated yet - enter a known distance and calibrate the focal length.");

    private final String message;

    Notice(String message)
    {
        this.message = message;
    }

    public String message()
    {
        return message;
    }
}
