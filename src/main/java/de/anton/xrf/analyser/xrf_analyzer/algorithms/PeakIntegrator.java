package de.anton.xrf.analyser.xrf_analyzer.algorithms;

import de.anton.xrf.analyser.xrf_analyzer.model.CalibrationModel;
import de.anton.xrf.analyser.xrf_analyzer.model.ElementDefinition;
import de.anton.xrf.analyser.xrf_analyzer.model.IntegrationMode;
import de.anton.xrf.analyser.xrf_analyzer.model.Spectrum;

/**
 * Strategy computing the signal of one characteristic line from a spectrum.
 * Implementations are stateless and may be shared between threads.
 */
public interface PeakIntegrator {

    /**
     * @param spectrum    The parsed spectrum.
     * @param element     The line to integrate.
     * @param calibration Calibration valid for this spectrum.
     * @return Non-negative integrated signal; 0 if the spectrum is empty.
     */
    double integrate(Spectrum spectrum, ElementDefinition element, CalibrationModel calibration);

    IntegrationMode getMode();
}
