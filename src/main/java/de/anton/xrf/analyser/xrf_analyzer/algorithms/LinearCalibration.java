package de.anton.xrf.analyser.xrf_analyzer.algorithms;

import de.anton.xrf.analyser.xrf_analyzer.exception.CalibrationException;
import de.anton.xrf.analyser.xrf_analyzer.model.CalibrationModel;
import de.anton.xrf.analyser.xrf_analyzer.model.CalibrationPoint;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

/**
 * Ordinary least-squares fit of energy on channel.
 */
public final class LinearCalibration {

    private static final Logger logger = LoggerFactory.getLogger(LinearCalibration.class);
    private static final int MIN_POINTS = 2;

    private LinearCalibration() { throw new IllegalStateException("Utility class"); }

    /**
     * Fits a calibration model. Point order is irrelevant.
     *
     * @param points At least two calibration points with distinct channels.
     * @return The fitted model with its coefficient of determination.
     * @throws CalibrationException If there are too few points, all channels are equal,
     *                              or the fit is not finite.
     */
    public static CalibrationModel fit(Collection<CalibrationPoint> points) {
        if (points == null || points.size() < MIN_POINTS) {
            throw CalibrationException.insufficientPoints(MIN_POINTS, points == null ? 0 : points.size());
        }
        SimpleRegression regression = new SimpleRegression(true);
        int firstChannel = -1;
        boolean channelsVary = false;
        for (CalibrationPoint point : points) {
            if (point == null) {
                throw new CalibrationException("Calibration point list contains null.");
            }
            if (firstChannel < 0) {
                firstChannel = point.channel();
            } else if (point.channel() != firstChannel) {
                channelsVary = true;
            }
            regression.addData(point.channel(), point.energyKeV());
        }
        if (!channelsVary) {
            throw new CalibrationException("Degenerate calibration: all " + points.size() + " points share channel " + firstChannel);
        }

        double slope = regression.getSlope();
        double intercept = regression.getIntercept();
        double rSquared = regression.getRSquare();
        if (!Double.isFinite(slope) || !Double.isFinite(intercept) || Double.isNaN(rSquared)) {
            throw new CalibrationException(String.format(
                    "Calibration fit is undefined: slope=%s, intercept=%s, R²=%s", slope, intercept, rSquared));
        }
        CalibrationModel model = new CalibrationModel(slope, intercept, rSquared, points.size());
        logger.debug("Calibration fitted: {}", model);
        return model;
    }

    /**
     * Fits a model and rejects it if the fit quality is below the threshold.
     */
    public static CalibrationModel fitChecked(Collection<CalibrationPoint> points, double minRSquared) {
        return fit(points).requireQuality(minRSquared);
    }
}
