// Viewing distance from a camera snapshot and a Snellen chart sized for it

package acuity;

import java.io.FileNotFoundException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import nu.pattern.OpenCV;

/*
 * Headless driver for the measurement pipeline. Still images stand in for camera snapshots:
 *
 *   1. screen scale from the card outline width the user matched on screen
 *   2. optional calibration snapshot taken at the known distance, then focal length calibration
 *   3. optional measurement snapshot giving the eye to screen distance
 *   4. chart rows for that distance, logged and optionally drawn to an image file
 */

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     Main class                                                  */
/*                                     Main class                                                  */
/*                                     Main class                                                  */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
public class Main {
    private static final String VERSION = "1.0.0"; // change this

    private static Logger LOGGER;
    static {
        LOGGER = LoggerSetup.setupLogger();

        LOGGER.finest("Loading");
        LOGGER.config("AcuityCheck version " + VERSION);
    }

    ///////////////////////////// USER INPUT ARGUMENTS ///////////////////////////////
    static String modelPath;
    static String eyeCascadePath;
    static MeasurementParams measurementParams;
    static int cardWidthPx;
    static String calibrationImage; // null if no focal calibration this run
    static String measurementImage; // null if no distance measurement this run
    static ChartParams chartParams;
    static String overlayPrefix; // null if no debug overlay images
    static String chartFile; // null if no chart image
    ///////////////////////////// END USER INPUT ARGUMENTS ///////////////////////////////
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     main                                                        */
/*                                     main                                                        */
/*                                     main                                                        */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    public static void main(String[] args)
    {
        // get the parameters for the user provided options
        LOGGER.config("Command Line Args " + Arrays.toString(args));
        try {
            if ( ! handleArgs(args)) {
                System.exit(0);
            }
        } catch (ParseException | IllegalArgumentException e) {
            LOGGER.severe("Failed to parse command-line options! " + e);
            System.exit(1);
        }

        OpenCV.loadLocally();

        LandmarkDetector detector = FallbackLandmarkDetector.create(modelPath, eyeCascadePath);
        CalibrationSession session = new CalibrationSession(detector, measurementParams);

        // Step 1 screen scale
        session.setScreenScaleFromCard(cardWidthPx);

        try {
            // Step 2 focal length calibration
            if (calibrationImage != null) {
                SnapshotResult calibrationSnapshot = snapshot(session, calibrationImage, "calibration");
                if (calibrationSnapshot.pixelIpd().isPresent()) {
                    Set<Notice> notices = session.calibrateFocalLength();
                    if ( ! notices.isEmpty()) {
                        LOGGER.warning("focal length not calibrated " + notices);
                    }
                }
            }

            // Step 3 distance
            if (measurementImage != null) {
                snapshot(session, measurementImage, "measurement");
            }
        } catch (FileNotFoundException e) {
            LOGGER.severe(e.getMessage());
            System.exit(1);
        }

        // Step 4 chart
        LOGGER.info(session.toString());
        double distanceMm = session.readingDistanceMm();
        LOGGER.info(String.format("Snellen chart for %.0f mm%s", distanceMm,
            session.eyeToScreenMm().isPresent() ? "" : " (default distance, not measured)"));
        List<ChartRow> rows = session.chartRows(chartParams);
        for (ChartRow row : rows) {
            LOGGER.info(chartParams.showLabels() ? row.toString() : row.text());
        }

        if (chartFile != null) {
            Mat chart = ChartRenderer.render(rows, chartParams);
            write(chartFile, chart, "chart");
            chart.release();
        }

        LOGGER.finest("End of running main");
    } // end main method
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     snapshot                                                    */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    private static SnapshotResult snapshot(CalibrationSession session, String imageFile, String purpose) throws FileNotFoundException
    {
        LOGGER.info("Taking " + purpose + " snapshot from " + imageFile);
        Frame frame = Frame.read(imageFile);
        SnapshotResult result = session.onSnapshot(frame);
        LOGGER.fine(result.detection().toString());

        if (overlayPrefix != null) {
            Mat overlay = Overlay.draw(frame, result.detection());
            write(overlayPrefix + "_" + purpose + ".png", overlay, "detection overlay");
            overlay.release();
        }
        return result;
    }

    private static void write(String filename, Mat img, String what)
    {
        if (Imgcodecs.imwrite(filename, img)) {
            LOGGER.info(what + " written to " + filename);
        }
        else {
            LOGGER.severe(what + " not written to " + filename);
        }
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     handleArgs                                                  */
/*                                     handleArgs                                                  */
/*                                     handleArgs                                                  */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    static boolean handleArgs(String[] args) throws ParseException {

        Options options = new Options();

        options.addOption("h", "help", false, "Show this help text and exit");
        options.addOption("m", "model", true, "YuNet face model (" + Cfg.modelPath + ")");
        options.addOption("e", "eyeCascade", true, "Haar eye cascade for the fallback (" + Cfg.eyeCascadePath + ")");
        options.addOption("s", "score", true, "detector score threshold 0.05 to 0.95 (" + Cfg.defaultScoreThreshold + ")");
        options.addOption("p", "ipd", true, "interpupillary distance mm 40 to 80 (" + Cfg.defaultIpdMm + ")");
        options.addOption("o", "offset", true, "camera to screen offset mm 0 to 150 (" + Cfg.defaultOffsetMm + ")");
        options.addOption("k", "known", true, "camera to eye distance mm of the calibration snapshot 200 to 2000 (" + Cfg.defaultKnownDistanceMm + ")");
        options.addOption("w", "cardWidth", true, "on-screen card outline width px matching a real card 80 to 600 (" + Cfg.defaultCardWidthPx + ")");
        options.addOption("C", "calibrate", true, "calibration snapshot image taken at the known distance");
        options.addOption("i", "image", true, "measurement snapshot image");
        options.addOption("t", "style", true, "chart style " + Arrays.toString(ChartStyle.values()) + " (MIXED)");
        options.addOption("l", "letter", true, "letter for the single letter style (" + Cfg.defaultSingleLetter + ")");
        options.addOption("n", "noLabels", false, "hide the 6/x labels");
        options.addOption("g", "spacing", true, "letter spacing em 0.00 to 0.20 (" + Cfg.defaultLetterSpacingEm + ")");
        options.addOption("P", "polarity", true, "chart polarity " + Arrays.toString(ChartParams.Polarity.values()) + " (DARK_ON_LIGHT)");
        options.addOption("O", "overlay", true, "file name prefix for detection overlay images");
        options.addOption("c", "chart", true, "chart image file (png)");
        options.addOption("v", "verbose", false, "log everything");

        CommandLineParser parser = new DefaultParser();
        CommandLine cmd = parser.parse(options, args);

        if(cmd.getArgs().length > 0) {
            LOGGER.warning("Arguments Not Recognized: " + Arrays.toString(cmd.getArgs()));
        }

        if (cmd.hasOption("v")) {
            Cfg.loggerMinimumLevel = Level.FINEST;
            LOGGER = LoggerSetup.setupLogger(Level.FINEST);
        }

        if (cmd.hasOption("h")) {
            // make a string to hold the help and log it
            StringWriter sw = new StringWriter(1000);
            PrintWriter pw = new PrintWriter(sw);
            HelpFormatter helpFormatter = new HelpFormatter();
            helpFormatter.printHelp(pw, HelpFormatter.DEFAULT_WIDTH, "\n\njava -jar acuity-check-" + VERSION + ".jar [options]",
                null, options, HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
            pw.flush();
            LOGGER.config("\n\n" + sw.toString());
            return false; // exit program
        }

        modelPath = cmd.getOptionValue("model", Cfg.modelPath);
        eyeCascadePath = cmd.getOptionValue("eyeCascade", Cfg.eyeCascadePath);
        measurementParams = new MeasurementParams(
            Double.parseDouble(cmd.getOptionValue("score", Double.toString(Cfg.defaultScoreThreshold))),
            Double.parseDouble(cmd.getOptionValue("ipd", Double.toString(Cfg.defaultIpdMm))),
            Double.parseDouble(cmd.getOptionValue("offset", Double.toString(Cfg.defaultOffsetMm))),
            Double.parseDouble(cmd.getOptionValue("known", Double.toString(Cfg.defaultKnownDistanceMm))));
        cardWidthPx = Integer.parseInt(cmd.getOptionValue("cardWidth", Integer.toString(Cfg.defaultCardWidthPx)));
        calibrationImage = cmd.getOptionValue("calibrate");
        measurementImage = cmd.getOptionValue("image");
        chartParams = new ChartParams(
            ChartStyle.fromName(cmd.getOptionValue("style", ChartStyle.MIXED.name())),
            cmd.getOptionValue("letter", String.valueOf(Cfg.defaultSingleLetter)),
            ! cmd.hasOption("noLabels"),
            ChartParams.Polarity.valueOf(cmd.getOptionValue("polarity", ChartParams.Polarity.DARK_ON_LIGHT.name()).toUpperCase(Locale.ROOT)),
            Double.parseDouble(cmd.getOptionValue("spacing", Double.toString(Cfg.defaultLetterSpacingEm))));
        overlayPrefix = cmd.getOptionValue("overlay");
        chartFile = cmd.getOptionValue("chart");

        if (calibrationImage == null && measurementImage == null) {
            LOGGER.warning("no snapshot images given; chart uses the default distance");
        }

        return true;

    } // end handleArgs method
}
