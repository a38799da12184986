package de.anton.tas.analyser.tas_analyzer.view;

import de.anton.tas.analyser.tas_analyzer.model.CalibrationPoint;
import de.anton.tas.analyser.tas_analyzer.service.AnalysisSettings;
import org.jfree.chart.ChartPanel;
import org.jfree.chart.JFreeChart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.*;
import javax.swing.border.EtchedBorder;
import javax.swing.table.DefaultTableModel;
import java.awt.*;
import java.util.ArrayList;
import java.util.List;

/**
 * Calibration window: lamp spectrum input, peak search parameters, the channel/wavelength
 * pairs and the resulting equation. Holds no calibration state itself.
 */
public class CalibrationDialog extends JDialog {

    private static final Logger logger = LoggerFactory.getLogger(CalibrationDialog.class);

    static final int COL_CHANNEL = 0;
    static final int COL_WAVELENGTH = 1;
    private static final int INITIAL_ROWS = 5;

    private JTextArea txtSpectrum;
    private JSpinner spnProminence;
    private JSpinner spnDistance;
    private JSpinner spnTopK;
    private DefaultTableModel pointTableModel;
    private JTable tblPoints;
    private JButton btnAddRow;
    private JButton btnRemoveRow;
    private JButton btnOpenFile;
    private JButton btnSetDark;
    private JButton btnPlotSpectrum;
    private JButton btnDetectPeaks;
    private JButton btnCalibrate;
    private JButton btnSave;
    private JLabel lblEquation;
    private JLabel lblRange;
    private JLabel lblDark;
    private ChartPanel chartPanel;

    public CalibrationDialog(Frame owner, AnalysisSettings settings) {
        super(owner, "Wellenlängenkalibrierung", false);
        initComponents(settings);
        layoutComponents();
        setDefaultCloseOperation(HIDE_ON_CLOSE);
        pack();
        setLocationRelativeTo(owner);
    }

    private void initComponents(AnalysisSettings settings) {
        txtSpectrum = new JTextArea(14, 16);
        txtSpectrum.setFont(new Font(Font.MONOSPACED, Font.PLAIN, 11));
        spnProminence = new JSpinner(new SpinnerNumberModel(settings.peakProminence(), 0.0, 1.0e9, 10.0));
        spnDistance = new JSpinner(new SpinnerNumberModel(settings.peakDistance(), 1, 10_000, 10));
        spnTopK = new JSpinner(new SpinnerNumberModel(settings.peakTopK(), 0, 100, 1));
        spnTopK.setToolTipText("0 = alle Peaks");
        pointTableModel = new DefaultTableModel(new Object[]{"Kanal", "λ / nm"}, INITIAL_ROWS) {
            @Override
            public Class<?> getColumnClass(int columnIndex) { return Double.class; }
        };
        tblPoints = new JTable(pointTableModel);
        tblPoints.setPreferredScrollableViewportSize(new Dimension(220, 120));
        btnAddRow = new JButton("+ Zeile");
        btnRemoveRow = new JButton("- Zeile");
        btnOpenFile = new JButton("Datei öffnen...");
        btnSetDark = new JButton("Als Dunkel setzen");
        btnSetDark.setToolTipText("Aktuellen Text als Dunkelspektrum für den Plot verwenden");
        btnPlotSpectrum = new JButton("Spektrum plotten");
        btnDetectPeaks = new JButton("Peaks finden");
        btnCalibrate = new JButton("Kalibrieren");
        btnSave = new JButton("Speichern...");
        lblEquation = new JLabel(" ");
        lblRange = new JLabel(" ");
        lblDark = new JLabel("Dunkel: -");
        chartPanel = new ChartPanel(null);
        chartPanel.setPreferredSize(new Dimension(560, 360));
        chartPanel.setMouseWheelEnabled(true);
    }

    private void layoutComponents() {
        Container contentPane = getContentPane();
        contentPane.setLayout(new BorderLayout(5, 5));

        JPanel pnlInput = new JPanel(new BorderLayout(3, 3));
        pnlInput.setBorder(BorderFactory.createTitledBorder(BorderFactory.createEtchedBorder(EtchedBorder.LOWERED), "Lampenspektrum"));
        pnlInput.add(new JScrollPane(txtSpectrum), BorderLayout.CENTER);
        JPanel pnlInputButtons = new JPanel(new GridLayout(0, 1, 2, 2));
        pnlInputButtons.add(btnOpenFile);
        pnlInputButtons.add(btnSetDark);
        pnlInputButtons.add(btnPlotSpectrum);
        pnlInputButtons.add(lblDark);
        pnlInput.add(pnlInputButtons, BorderLayout.SOUTH);
        contentPane.add(pnlInput, BorderLayout.WEST);

        contentPane.add(chartPanel, BorderLayout.CENTER);

        JPanel pnlRight = new JPanel(new GridBagLayout());
        pnlRight.setBorder(BorderFactory.createTitledBorder(BorderFactory.createEtchedBorder(EtchedBorder.LOWERED), "Peaks & Kalibrierpunkte"));
        GridBagConstraints gbc = new GridBagConstraints();
        gbc.insets = new Insets(3, 5, 3, 5);
        gbc.anchor = GridBagConstraints.WEST;
        gbc.gridx = 0; gbc.gridy = 0; pnlRight.add(new JLabel("Prominenz:"), gbc);
        gbc.gridx = 1; pnlRight.add(spnProminence, gbc);
        gbc.gridx = 0; gbc.gridy = 1; pnlRight.add(new JLabel("Min. Abstand:"), gbc);
        gbc.gridx = 1; pnlRight.add(spnDistance, gbc);
        gbc.gridx = 0; gbc.gridy = 2; pnlRight.add(new JLabel("Top K:"), gbc);
        gbc.gridx = 1; pnlRight.add(spnTopK, gbc);
        gbc.gridx = 0; gbc.gridy = 3; gbc.gridwidth = 2; pnlRight.add(btnDetectPeaks, gbc);
        gbc.gridy = 4; gbc.fill = GridBagConstraints.BOTH; gbc.weighty = 1.0; pnlRight.add(new JScrollPane(tblPoints), gbc);
        JPanel pnlRows = new JPanel(new FlowLayout(FlowLayout.LEFT, 3, 0));
        pnlRows.add(btnAddRow);
        pnlRows.add(btnRemoveRow);
        gbc.gridy = 5; gbc.fill = GridBagConstraints.NONE; gbc.weighty = 0; pnlRight.add(pnlRows, gbc);
        JPanel pnlFit = new JPanel(new FlowLayout(FlowLayout.LEFT, 3, 0));
        pnlFit.add(btnCalibrate);
        pnlFit.add(btnSave);
        gbc.gridy = 6; pnlRight.add(pnlFit, gbc);
        gbc.gridy = 7; pnlRight.add(lblEquation, gbc);
        gbc.gridy = 8; pnlRight.add(lblRange, gbc);
        contentPane.add(pnlRight, BorderLayout.EAST);
    }

    /**
     * Reads the filled table rows. Blank rows are skipped; a half-filled row becomes a point
     * with a NaN coordinate, which the calibration model drops with a warning.
     */
    public List<CalibrationPoint> getCalibrationPoints() {
        if (tblPoints.isEditing()) {
            tblPoints.getCellEditor().stopCellEditing();
        }
        List<CalibrationPoint> points = new ArrayList<>();
        for (int row = 0; row < pointTableModel.getRowCount(); row++) {
            Object ch = pointTableModel.getValueAt(row, COL_CHANNEL);
            Object wl = pointTableModel.getValueAt(row, COL_WAVELENGTH);
            if (ch == null && wl == null) continue;
            points.add(new CalibrationPoint(toDouble(ch), toDouble(wl)));
        }
        logger.debug("{} calibration point row(s) read from table.", points.size());
        return points;
    }

    /** Writes detected channels into the channel column, tallest peak first, adding rows as needed. */
    public void setDetectedChannels(List<Integer> channels) {
        while (pointTableModel.getRowCount() < channels.size()) {
            pointTableModel.addRow(new Object[]{null, null});
        }
        for (int row = 0; row < pointTableModel.getRowCount(); row++) {
            pointTableModel.setValueAt(row < channels.size() ? channels.get(row).doubleValue() : null, row, COL_CHANNEL);
        }
    }

    public void addRow() { pointTableModel.addRow(new Object[]{null, null}); }

    public void removeLastRow() {
        if (pointTableModel.getRowCount() > 0) {
            pointTableModel.removeRow(pointTableModel.getRowCount() - 1);
        }
    }

    public void showChart(JFreeChart chart) { chartPanel.setChart(chart); }

    public void setEquation(String equation, double[] range) {
        lblEquation.setText(equation);
        lblRange.setText(String.format("Bereich: %.2f - %.2f", range[0], range[1]));
    }

    public void setDarkInfo(String text) { lblDark.setText(text); }

    private static double toDouble(Object value) {
        return value instanceof Number ? ((Number) value).doubleValue() : Double.NaN;
    }

    public JTextArea getSpectrumArea() { return txtSpectrum; }
    public double getProminence() { return ((Number) spnProminence.getValue()).doubleValue(); }
    public int getDistance() { return ((Number) spnDistance.getValue()).intValue(); }
    public int getTopK() { return ((Number) spnTopK.getValue()).intValue(); }
    public DefaultTableModel getPointTableModel() { return pointTableModel; }
    public JButton getAddRowButton() { return btnAddRow; }
    public JButton getRemoveRowButton() { return btnRemoveRow; }
    public JButton getOpenFileButton() { return btnOpenFile; }
    public JButton getSetDarkButton() { return btnSetDark; }
    public JButton getPlotSpectrumButton() { return btnPlotSpectrum; }
    public JButton getDetectPeaksButton() { return btnDetectPeaks; }
    public JButton getCalibrateButton() { return btnCalibrate; }
    public JButton getSaveButton() { return btnSave; }
}
