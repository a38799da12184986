package de.anton.tas.analyser.tas_analyzer.view;

import de.anton.tas.analyser.tas_analyzer.model.DifferenceSpectra;
import de.anton.tas.analyser.tas_analyzer.model.TransientAbsorptionTrace;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.IntervalMarker;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.chart.ui.RectangleInsets;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

import java.awt.*;
import java.util.List;

/**
 * Builds the JFreeChart line charts for ΔAbs traces and raw spectra.
 * NaN values are added to the series as gaps, so the line breaks where ΔAbs is undefined.
 */
public final class TraceChartFactory {

    static final String AXIS_WAVELENGTH = "Wavelength / nm";
    static final String AXIS_CHANNEL = "Channel";
    static final String AXIS_DELTA_ABS = "ΔAbs";
    static final String AXIS_INTENSITY = "Intensity";
    /** Half-height of the shaded band marking |ΔAbs| below the noise level. */
    static final double NOISE_BAND = 0.01;

    private TraceChartFactory() { throw new IllegalStateException("Utility class"); }

    /** One chart with every trace as its own series, labeled with the data set name. */
    public static JFreeChart createTraceChart(String title, List<TransientAbsorptionTrace> traces) {
        XYSeriesCollection dataset = new XYSeriesCollection();
        boolean wavelength = !traces.isEmpty() && traces.get(0).isWavelengthAxis();
        int n = 1;
        for (TransientAbsorptionTrace trace : traces) {
            String key = trace.getName() != null ? trace.getName() : "Trace " + n;
            XYSeries series = new XYSeries(uniqueKey(dataset, key), false, true);
            for (int i = 0; i < trace.size(); i++) {
                series.add(trace.getXAt(i), toPlotValue(trace.getDeltaAbsAt(i)));
            }
            dataset.addSeries(series);
            n++;
        }

        JFreeChart chart = ChartFactory.createXYLineChart(title, wavelength ? AXIS_WAVELENGTH : AXIS_CHANNEL, AXIS_DELTA_ABS,
                dataset, PlotOrientation.VERTICAL, traces.size() > 1, true, false);
        XYPlot plot = stylePlot(chart);
        IntervalMarker band = new IntervalMarker(-NOISE_BAND, NOISE_BAND);
        band.setPaint(new Color(0, 160, 0, 50));
        plot.addRangeMarker(band);
        return chart;
    }

    /** Raw or dark-corrected spectrum, x already transformed by the calibration. */
    public static JFreeChart createSpectrumChart(String title, double[] x, double[] y, boolean wavelengthAxis) {
        XYSeries series = new XYSeries(title, false, true);
        for (int i = 0; i < x.length; i++) {
            series.add(x[i], y[i]);
        }
        JFreeChart chart = ChartFactory.createXYLineChart(title, wavelengthAxis ? AXIS_WAVELENGTH : AXIS_CHANNEL, AXIS_INTENSITY,
                new XYSeriesCollection(series), PlotOrientation.VERTICAL, false, true, false);
        stylePlot(chart);
        return chart;
    }

    /** Raw spectrum with the detected peak channels marked. */
    public static JFreeChart createPeakChart(String title, double[] intensity, List<Integer> peaks) {
        XYSeries raw = new XYSeries("Raw", false, true);
        for (int i = 0; i < intensity.length; i++) {
            raw.add(i, intensity[i]);
        }
        XYSeries marked = new XYSeries("Peaks", false, true);
        for (int p : peaks) {
            marked.add(p, intensity[p]);
        }
        XYSeriesCollection dataset = new XYSeriesCollection();
        dataset.addSeries(raw);
        dataset.addSeries(marked);

        JFreeChart chart = ChartFactory.createXYLineChart(title, AXIS_CHANNEL, AXIS_INTENSITY, dataset,
                PlotOrientation.VERTICAL, true, true, false);
        XYPlot plot = stylePlot(chart);
        XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer();
        renderer.setSeriesLinesVisible(0, true);
        renderer.setSeriesShapesVisible(0, false);
        renderer.setSeriesLinesVisible(1, false);
        renderer.setSeriesShapesVisible(1, true);
        renderer.setSeriesPaint(1, Color.RED);
        plot.setRenderer(renderer);
        return chart;
    }

    /** Normalized difference curves of one data set. */
    public static JFreeChart createDifferenceChart(String title, DifferenceSpectra spectra, boolean wavelengthAxis) {
        XYSeriesCollection dataset = new XYSeriesCollection();
        dataset.addSeries(toSeries("Difference_ref", spectra.x(), spectra.reference()));
        dataset.addSeries(toSeries("Difference_sig", spectra.x(), spectra.signal()));
        dataset.addSeries(toSeries("Difference", spectra.x(), spectra.difference()));
        JFreeChart chart = ChartFactory.createXYLineChart(title, wavelengthAxis ? AXIS_WAVELENGTH : AXIS_CHANNEL, "Normalized |Δ|",
                dataset, PlotOrientation.VERTICAL, true, true, false);
        stylePlot(chart);
        return chart;
    }

    private static XYSeries toSeries(String key, double[] x, double[] y) {
        XYSeries series = new XYSeries(key, false, true);
        for (int i = 0; i < x.length; i++) {
            series.add(x[i], toPlotValue(y[i]));
        }
        return series;
    }

    private static XYPlot stylePlot(JFreeChart chart) {
        XYPlot plot = (XYPlot) chart.getPlot();
        plot.setBackgroundPaint(Color.WHITE);
        plot.setDomainGridlinePaint(Color.LIGHT_GRAY);
        plot.setRangeGridlinePaint(Color.LIGHT_GRAY);
        plot.setAxisOffset(new RectangleInsets(5.0, 5.0, 5.0, 5.0));
        return plot;
    }

    /** Null makes JFreeChart draw a gap; NaN would break auto-ranging. */
    private static Double toPlotValue(double v) {
        return Double.isFinite(v) ? v : null;
    }

    private static String uniqueKey(XYSeriesCollection dataset, String key) {
        String candidate = key;
        int suffix = 2;
        while (dataset.getSeriesIndex(candidate) >= 0) {
            candidate = key + " (" + suffix++ + ")";
        }
        return candidate;
    }
}
