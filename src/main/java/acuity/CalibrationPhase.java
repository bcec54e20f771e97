package acuity;

/**
 * Calibration progress
 */
public enum CalibrationPhase {UNCALIBRATED, SCREEN_SCALE_KNOWN, FOCAL_LENGTH_KNOWN, DISTANCE_KNOWN}
