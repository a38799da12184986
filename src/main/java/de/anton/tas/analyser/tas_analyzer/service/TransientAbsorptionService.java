package de.anton.tas.analyser.tas_analyzer.service;

import de.anton.tas.analyser.tas_analyzer.algorithms.MovingAverageFilter;
import de.anton.tas.analyser.tas_analyzer.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Computes transient absorption (ΔAbs) traces from pump/probe spectra:
 * dark correction, log ratio, moving-average smoothing and calibrated x axis.
 * Stateless; the calibration and smoothing width are passed in with every call.
 */
public class TransientAbsorptionService {

    private static final Logger logger = LoggerFactory.getLogger(TransientAbsorptionService.class);

    /**
     * Computes one trace.
     * <p>
     * ΔAbs_i = ln((ref_p0·sig0) / (sig_p0·ref0)) after dark subtraction, NaN where ref0 or sig_p0 is zero,
     * then smoothed with a zero-padded centered moving average of the given odd width.
     *
     * @param calibration Supplies the x axis; channels are used when it is uncalibrated.
     * @throws SpectrumLengthMismatchException If the six spectra do not share one length.
     */
    public TransientAbsorptionTrace compute(Spectrum ref, Spectrum sig, Spectrum refP, Spectrum sigP,
                                            Spectrum darkRef, Spectrum darkSig,
                                            int smoothingWidth, CalibrationModel calibration) throws SpectrumLengthMismatchException {
        return compute(null, ref, sig, refP, sigP, darkRef, darkSig, smoothingWidth, calibration);
    }

    /** Computes the trace of a stored data set; the trace carries the data set name. */
    public TransientAbsorptionTrace compute(DataSet dataSet, int smoothingWidth, CalibrationModel calibration) throws SpectrumLengthMismatchException {
        Objects.requireNonNull(dataSet, "Data set cannot be null.");
        return compute(dataSet.getName(),
                dataSet.get(SpectrumLabel.REF), dataSet.get(SpectrumLabel.SIG),
                dataSet.get(SpectrumLabel.REF_P), dataSet.get(SpectrumLabel.SIG_P),
                dataSet.get(SpectrumLabel.DARK_REF), dataSet.get(SpectrumLabel.DARK_SIG),
                smoothingWidth, calibration);
    }

    /**
     * Computes traces for several stored data sets, e.g. to overlay different delay times.
     * Fails on the first unknown name or inconsistent data set; no partial list is returned.
     */
    public List<TransientAbsorptionTrace> computeAll(DatasetRegistry registry, List<String> names,
                                                     int smoothingWidth, CalibrationModel calibration)
            throws DataSetNotFoundException, SpectrumLengthMismatchException {
        Objects.requireNonNull(registry, "Registry cannot be null.");
        Objects.requireNonNull(names, "Name list cannot be null.");
        List<TransientAbsorptionTrace> traces = new ArrayList<>(names.size());
        for (String name : names) {
            DataSet dataSet = registry.load(name);
            try {
                traces.add(compute(dataSet, smoothingWidth, calibration));
            } catch (SpectrumLengthMismatchException e) {
                logger.warn("Overlay aborted, data set '{}' is inconsistent: {}", name, e.getMessage());
                throw e;
            }
        }
        logger.info("Computed {} ΔAbs trace(s) for overlay (width={}).", traces.size(), smoothingWidth);
        return traces;
    }

    private TransientAbsorptionTrace compute(String name, Spectrum ref, Spectrum sig, Spectrum refP, Spectrum sigP,
                                             Spectrum darkRef, Spectrum darkSig,
                                             int smoothingWidth, CalibrationModel calibration) throws SpectrumLengthMismatchException {
        Objects.requireNonNull(calibration, "Calibration model cannot be null.");
        if (smoothingWidth < 1 || smoothingWidth % 2 == 0) {
            throw new IllegalArgumentException("Smoothing width must be a positive odd number, got " + smoothingWidth);
        }
        int n = requireCommonLength(ref, sig, refP, sigP, darkRef, darkSig);

        double[] raw = new double[n];
        int gaps = 0;
        for (int i = 0; i < n; i++) {
            double ref0 = ref.getIntensityAt(i) - darkRef.getIntensityAt(i);
            double sig0 = sig.getIntensityAt(i) - darkSig.getIntensityAt(i);
            double refP0 = refP.getIntensityAt(i) - darkRef.getIntensityAt(i);
            double sigP0 = sigP.getIntensityAt(i) - darkSig.getIntensityAt(i);
            if (ref0 != 0 && sigP0 != 0) {
                raw[i] = Math.log((refP0 * sig0) / (sigP0 * ref0));
            } else {
                raw[i] = Double.NaN;
                gaps++;
            }
        }
        if (gaps > 0) {
            logger.debug("ΔAbs '{}': {} of {} channels undefined (zero denominator).", name, gaps, n);
        }

        // TODO: edge handling is zero-padded (values biased to 0 near both ends); revisit if a renormalized edge policy is agreed
        double[] smoothed = MovingAverageFilter.smooth(raw, smoothingWidth);
        double[] x = calibration.axis(n);

        logger.info("ΔAbs trace computed{}: {} channels, width={}, axis={}",
                    name != null ? " for '" + name + "'" : "", n, smoothingWidth, calibration.isCalibrated() ? "wavelength" : "channel");
        return new TransientAbsorptionTrace(name, x, smoothed, smoothingWidth, calibration.isCalibrated());
    }

    /**
     * Normalized magnitude of the pump-induced change in reference and signal, and of their difference.
     *
     * @throws SpectrumLengthMismatchException If the six spectra do not share one length.
     */
    public DifferenceSpectra computeDifferenceSpectra(DataSet dataSet, CalibrationModel calibration) throws SpectrumLengthMismatchException {
        Objects.requireNonNull(dataSet, "Data set cannot be null.");
        Objects.requireNonNull(calibration, "Calibration model cannot be null.");
        Spectrum ref = dataSet.get(SpectrumLabel.REF), sig = dataSet.get(SpectrumLabel.SIG);
        Spectrum refP = dataSet.get(SpectrumLabel.REF_P), sigP = dataSet.get(SpectrumLabel.SIG_P);
        Spectrum darkRef = dataSet.get(SpectrumLabel.DARK_REF), darkSig = dataSet.get(SpectrumLabel.DARK_SIG);
        int n = requireCommonLength(ref, sig, refP, sigP, darkRef, darkSig);

        double[] diffRef = new double[n];
        double[] diffSig = new double[n];
        for (int i = 0; i < n; i++) {
            // the dark terms cancel, kept for symmetry with the ΔAbs formula
            double ref0 = ref.getIntensityAt(i) - darkRef.getIntensityAt(i);
            double refP0 = refP.getIntensityAt(i) - darkRef.getIntensityAt(i);
            double sig0 = sig.getIntensityAt(i) - darkSig.getIntensityAt(i);
            double sigP0 = sigP.getIntensityAt(i) - darkSig.getIntensityAt(i);
            diffRef[i] = refP0 - ref0;
            diffSig[i] = sigP0 - sig0;
        }
        double[] normRef = normalizeAbs(diffRef);
        double[] normSig = normalizeAbs(diffSig);
        double[] difference = new double[n];
        for (int i = 0; i < n; i++) {
            difference[i] = normRef[i] - normSig[i];
        }
        return new DifferenceSpectra(calibration.axis(n), normRef, normSig, normalizeAbs(difference));
    }

    /** |v| / max|v|; an all-zero input is returned as zeros. */
    static double[] normalizeAbs(double[] values) {
        double[] out = new double[values.length];
        double max = 0.0;
        for (int i = 0; i < values.length; i++) {
            out[i] = Math.abs(values[i]);
            if (out[i] > max) max = out[i];
        }
        if (max == 0.0) max = 1.0;
        for (int i = 0; i < out.length; i++) {
            out[i] /= max;
        }
        return out;
    }

    private static int requireCommonLength(Spectrum ref, Spectrum sig, Spectrum refP, Spectrum sigP,
                                           Spectrum darkRef, Spectrum darkSig) throws SpectrumLengthMismatchException {
        Map<String, Integer> lengths = new LinkedHashMap<>();
        lengths.put(SpectrumLabel.REF.getDisplayName(), sizeOf(ref, SpectrumLabel.REF));
        lengths.put(SpectrumLabel.SIG.getDisplayName(), sizeOf(sig, SpectrumLabel.SIG));
        lengths.put(SpectrumLabel.REF_P.getDisplayName(), sizeOf(refP, SpectrumLabel.REF_P));
        lengths.put(SpectrumLabel.SIG_P.getDisplayName(), sizeOf(sigP, SpectrumLabel.SIG_P));
        lengths.put(SpectrumLabel.DARK_REF.getDisplayName(), sizeOf(darkRef, SpectrumLabel.DARK_REF));
        lengths.put(SpectrumLabel.DARK_SIG.getDisplayName(), sizeOf(darkSig, SpectrumLabel.DARK_SIG));
        if (new HashSet<>(lengths.values()).size() != 1) {
            logger.warn("ΔAbs computation rejected, spectrum lengths differ: {}", lengths);
            throw new SpectrumLengthMismatchException(lengths);
        }
        return ref.size();
    }

    private static int sizeOf(Spectrum s, SpectrumLabel label) {
        return Objects.requireNonNull(s, "Spectrum '" + label + "' cannot be null.").size();
    }
}
