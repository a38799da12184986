package de.anton.tas.analyser.tas_analyzer.view;

import de.anton.tas.analyser.tas_analyzer.model.DifferenceSpectra;
import de.anton.tas.analyser.tas_analyzer.model.TransientAbsorptionTrace;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.IntervalMarker;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.ui.Layer;
import org.jfree.data.xy.XYSeriesCollection;
import org.junit.Test;

import java.util.Collection;
import java.util.List;

import static org.junit.Assert.*;

public class TraceChartFactoryTest {

    private static TransientAbsorptionTrace trace(String name, boolean wavelength) {
        return new TransientAbsorptionTrace(name, new double[]{400, 401, 402}, new double[]{0.02, Double.NaN, -0.03}, 1, wavelength);
    }

    @Test
    public void overlayHasOneSeriesPerTraceAndNoiseBand() {
        JFreeChart chart = TraceChartFactory.createTraceChart("TAS", List.of(trace("1ps", true), trace("1ps", true)));
        XYPlot plot = chart.getXYPlot();
        XYSeriesCollection dataset = (XYSeriesCollection) plot.getDataset();

        assertEquals(2, dataset.getSeriesCount());
        assertEquals("1ps", dataset.getSeriesKey(0));
        assertEquals("1ps (2)", dataset.getSeriesKey(1));
        assertNull(dataset.getSeries(0).getY(1));
        assertEquals(TraceChartFactory.AXIS_WAVELENGTH, plot.getDomainAxis().getLabel());
        assertEquals(TraceChartFactory.AXIS_DELTA_ABS, plot.getRangeAxis().getLabel());

        Collection<?> markers = plot.getRangeMarkers(Layer.FOREGROUND);
        assertEquals(1, markers.size());
        IntervalMarker band = (IntervalMarker) markers.iterator().next();
        assertEquals(-TraceChartFactory.NOISE_BAND, band.getStartValue(), 0.0);
        assertEquals(TraceChartFactory.NOISE_BAND, band.getEndValue(), 0.0);
    }

    @Test
    public void uncalibratedTraceIsPlottedOverChannels() {
        JFreeChart chart = TraceChartFactory.createTraceChart("ΔAbs", List.of(trace(null, false)));
        assertEquals(TraceChartFactory.AXIS_CHANNEL, chart.getXYPlot().getDomainAxis().getLabel());
        assertEquals("Trace 1", ((XYSeriesCollection) chart.getXYPlot().getDataset()).getSeriesKey(0));
    }

    @Test
    public void peakChartMarksDetectedChannels() {
        JFreeChart chart = TraceChartFactory.createPeakChart("Peaks", new double[]{0, 5, 0, 9, 0}, List.of(3, 1));
        XYSeriesCollection dataset = (XYSeriesCollection) chart.getXYPlot().getDataset();

        assertEquals(5, dataset.getSeries(0).getItemCount());
        assertEquals(2, dataset.getSeries(1).getItemCount());
        assertEquals(9.0, dataset.getSeries(1).getY(0).doubleValue(), 0.0);
    }

    @Test
    public void spectrumAndDifferenceChartsUseGivenAxes() {
        JFreeChart spectrum = TraceChartFactory.createSpectrumChart("Lamp", new double[]{0, 1}, new double[]{3, 4}, false);
        assertEquals(TraceChartFactory.AXIS_INTENSITY, spectrum.getXYPlot().getRangeAxis().getLabel());

        DifferenceSpectra diff = new DifferenceSpectra(new double[]{500, 501}, new double[]{1, 0}, new double[]{0, 1}, new double[]{1, 1});
        JFreeChart chart = TraceChartFactory.createDifferenceChart("Diff", diff, true);
        assertEquals(3, chart.getXYPlot().getDataset().getSeriesCount());
        assertEquals(TraceChartFactory.AXIS_WAVELENGTH, chart.getXYPlot().getDomainAxis().getLabel());
    }
}
