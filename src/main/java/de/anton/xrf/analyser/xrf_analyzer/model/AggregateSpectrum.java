package de.anton.xrf.analyser.xrf_analyzer.model;

import java.util.Arrays;

/**
 * Channel-wise sum of all successfully parsed spectra of a scan.
 *
 * <p>Spectra of different lengths are aligned by truncation: after adding or merging, the
 * sum is as long as the shortest contribution. Channel sums are order independent, so partial
 * aggregates built by different workers can be merged in any order.
 * Not thread-safe; each worker keeps its own instance.
 */
public final class AggregateSpectrum {

    private double[] sums = null; // null until the first spectrum arrives
    private int spectrumCount = 0;

    public void add(int[] counts) {
        if (counts == null) {
            return;
        }
        double[] contribution = new double[counts.length];
        for (int i = 0; i < counts.length; i++) {
            contribution[i] = counts[i];
        }
        accumulate(contribution, 1);
    }

    /** Adds another partial aggregate into this one. */
    public void merge(AggregateSpectrum other) {
        if (other == null || other.sums == null) {
            return;
        }
        accumulate(other.sums, other.spectrumCount);
    }

    private void accumulate(double[] contribution, int count) {
        if (sums == null) {
            sums = contribution.clone();
        } else {
            int length = Math.min(sums.length, contribution.length);
            if (length < sums.length) {
                sums = Arrays.copyOf(sums, length);
            }
            for (int i = 0; i < length; i++) {
                sums[i] += contribution[i];
            }
        }
        spectrumCount += count;
    }

    public boolean isEmpty() { return sums == null; }
    public int getSpectrumCount() { return spectrumCount; }
    public int getChannelCount() { return sums == null ? 0 : sums.length; }

    /** @return Copy of the channel sums; empty if nothing was added. */
    public double[] getSums() {
        return sums == null ? new double[0] : sums.clone();
    }

    public double getTotal() {
        return sums == null ? 0.0 : Arrays.stream(sums).sum();
    }
}
