package de.anton.tas.analyser.tas_analyzer.model;

import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class CalibrationModelTest {

    private static final double EPS = 1e-9;
    private CalibrationModel model;

    @Before
    public void setUp() {
        model = new CalibrationModel();
    }

    @Test
    public void uncalibratedModelIsIdentity() {
        assertFalse(model.isCalibrated());
        assertEquals(42.0, model.apply(42.0), 0.0);
        assertArrayEquals(new double[]{0, 1, 2}, model.axis(3), 0.0);
        assertArrayEquals(new double[]{0, CalibrationModel.MAX_CHANNEL - 1}, model.range(), 0.0);
        assertEquals("λ = a·ch + b (uncalibrated)", model.equationText());
    }

    @Test
    public void twoPointFitReproducesBothWavelengths() throws Exception {
        CalibrationCoefficients c = model.fit(Arrays.asList(
                new CalibrationPoint(100, 400), new CalibrationPoint(1000, 850)));

        assertEquals(0.5, c.a(), EPS);
        assertEquals(350.0, c.b(), EPS);
        assertEquals(400.0, model.apply(100), EPS);
        assertEquals(850.0, model.apply(1000), EPS);
        assertArrayEquals(new double[]{350.0, 0.5 * 1343 + 350.0}, model.range(), EPS);
        assertEquals("λ = 0.500000·ch + 350.000000", model.equationText());
    }

    @Test
    public void threeOrMorePointsUseLeastSquares() throws Exception {
        CalibrationCoefficients c = model.fit(Arrays.asList(
                new CalibrationPoint(0, 1), new CalibrationPoint(1, 3), new CalibrationPoint(2, 2)));

        assertEquals(0.5, c.a(), EPS);
        assertEquals(1.5, c.b(), EPS);
    }

    @Test
    public void invalidPointsAreSkipped() throws Exception {
        List<CalibrationPoint> points = new ArrayList<>();
        points.add(new CalibrationPoint(10, 500));
        points.add(new CalibrationPoint(Double.NaN, 600));
        points.add(null);
        points.add(new CalibrationPoint(20, 510));

        CalibrationCoefficients c = model.fit(points);

        assertEquals(1.0, c.a(), EPS);
        assertEquals(490.0, c.b(), EPS);
    }

    @Test
    public void signedZeroChannelsCountAsOneChannel() throws Exception {
        CalibrationCoefficients before = model.fit(Arrays.asList(
                new CalibrationPoint(100, 400), new CalibrationPoint(1000, 850)));

        InsufficientCalibrationPointsException e = assertThrows(InsufficientCalibrationPointsException.class,
                () -> model.fit(List.of(new CalibrationPoint(0.0, 500), new CalibrationPoint(-0.0, 600))));
        assertEquals(2, e.getValidPoints());
        assertEquals(1, e.getDistinctChannels());

        assertEquals(before, model.getCoefficients().orElseThrow());
        assertEquals(850.0, model.apply(1000), EPS);
    }

    @Test
    public void failedFitKeepsPreviousCalibration() throws Exception {
        CalibrationCoefficients before = model.fit(Arrays.asList(
                new CalibrationPoint(100, 400), new CalibrationPoint(1000, 850)));

        InsufficientCalibrationPointsException single = assertThrows(InsufficientCalibrationPointsException.class,
                () -> model.fit(List.of(new CalibrationPoint(5, 300))));
        assertEquals(1, single.getValidPoints());
        assertThrows(InsufficientCalibrationPointsException.class,
                () -> model.fit(List.of(new CalibrationPoint(5, 300), new CalibrationPoint(5, 310))));

        assertEquals(before, model.getCoefficients().orElseThrow());
        assertEquals(400.0, model.apply(100), EPS);
    }

    @Test
    public void failedFitOnUncalibratedModelStaysUncalibrated() {
        assertThrows(InsufficientCalibrationPointsException.class, () -> model.fit(List.of()));
        assertFalse(model.isCalibrated());
    }

    @Test
    public void importAndClearNotifyListeners() {
        List<Object> events = new ArrayList<>();
        model.addPropertyChangeListener(evt -> events.add(evt.getNewValue()));

        CalibrationCoefficients imported = new CalibrationCoefficients(0.25, 300);
        model.importCoefficients(imported);
        assertEquals(300.25, model.apply(1), EPS);

        model.clear();
        assertFalse(model.isCalibrated());
        assertEquals(Arrays.asList(imported, null), events);
    }
}
