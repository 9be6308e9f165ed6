package de.anton.xrf.analyser.xrf_analyzer.model;

/**
 * Agreement statistics between two maps of the same element on the same grid.
 *
 * @param elementId          Element both maps belong to.
 * @param pearsonNormalized  Pearson r of the percentile-normalised maps.
 * @param pearsonRaw         Pearson r of the raw maps.
 * @param rmsDifference      Root mean square of (normalised A − normalised B).
 * @param slope              Least-squares slope of raw B on raw A.
 * @param intercept          Least-squares intercept of raw B on raw A.
 */
public record MapComparison(
    String elementId,
    double pearsonNormalized,
    double pearsonRaw,
    double rmsDifference,
    double slope,
    double intercept
) {
}
