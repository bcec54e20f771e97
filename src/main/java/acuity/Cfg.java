package acuity;

import java.util.List;
import java.util.logging.Level;

public class Cfg
{
    static Level loggerMinimumLevel = Level.CONFIG; // --verbose drops this to FINEST
    static final String logFile = System.getProperty("acuity.logFile", "acuity.log"); // tests log under target/

    // primary detector - YuNet face + 5 landmarks
    static final String modelPath = "models/onnx/face_detection_yunet_2023mar.onnx";
    static final double defaultScoreThreshold = 0.30;
    static final float nmsThreshold = 0.3f;
    static final int topK = 5000;

    // secondary detector - Haar eye cascade inside the face box
    // classpath: resources are copied out to a temporary file since OpenCV only loads from the file system
    static final String eyeCascadePath = "classpath:/haarcascades/haarcascade_eye_tree_eyeglasses.xml";
    static final double cascadeScaleFactor = 1.1;
    static final int cascadeMinNeighbors = 4;
    static final int cascadeMinEyeSize = 20; // pixels, square

    // user inputs [min, max] and default
    static final double scoreThresholdMin = 0.05;
    static final double scoreThresholdMax = 0.95;
    static final double ipdMmMin = 40.;
    static final double ipdMmMax = 80.;
    static final double defaultIpdMm = 63.;
    static final double offsetMmMin = 0.;
    static final double offsetMmMax = 150.;
    static final double defaultOffsetMm = 40.; // camera sits above the screen
    static final double knownDistanceMmMin = 200.;
    static final double knownDistanceMmMax = 2000.;
    static final double defaultKnownDistanceMm = 500.;

    // ID-1 (credit/debit) card used to calibrate the screen scale
    static final double cardWidthMm = 85.60;
    static final double cardHeightMm = 53.98;
    static final int cardWidthPxMin = 80;
    static final int cardWidthPxMax = 600;
    static final int defaultCardWidthPx = 220;

    // chart
    static final double defaultReadingDistanceMm = 3000.; // used until a distance is measured
    static final List<Integer> chartDenominators = List.of(60, 48, 36, 24, 18, 12, 9, 6);
    static final double letterSpacingEmMin = 0.;
    static final double letterSpacingEmMax = 0.20;
    static final double defaultLetterSpacingEm = 0.05;
    static final char defaultSingleLetter = 'A';

    private Cfg(){}
}
