package de.anton.tas.analyser.tas_analyzer.view;

import de.anton.tas.analyser.tas_analyzer.algorithms.MovingAverageFilter;
import de.anton.tas.analyser.tas_analyzer.model.SpectrumLabel;

import javax.swing.*;
import javax.swing.border.EmptyBorder;
import javax.swing.border.EtchedBorder;
import java.awt.*;
import java.io.File;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Main window: one paste area per spectrum, the data set list and the ΔAbs actions.
 */
public class MainView extends JFrame {

    private File currentDirectory = new File(".");

    // --- UI Components ---
    private final Map<SpectrumLabel, JTextArea> spectrumAreas = new EnumMap<>(SpectrumLabel.class);
    private JTextField txtDataSetName;
    private JButton btnSaveDataSet;
    private DefaultListModel<String> dataSetListModel;
    private JList<String> lstDataSets;
    private JButton btnDeleteDataSet;
    private JSpinner spnSmoothingWidth;
    private JButton btnPlotDeltaAbs;
    private JButton btnPlotDifference;
    private JButton btnTasOverlay;
    private JButton btnExportExcel;
    private JButton btnLoadCalibration;
    private JButton btnCalibration;
    private JLabel lblCalibration;
    private JLabel lblStatus;
    private JFileChooser fileChooser;
    private JPanel pnlMainControls;

    public MainView() {
        initComponents();
        layoutComponents();
        setupWindow();
    }

    private void initComponents() {
        fileChooser = new JFileChooser(currentDirectory);
        fileChooser.setFileSelectionMode(JFileChooser.FILES_ONLY);
        for (SpectrumLabel label : SpectrumLabel.values()) {
            JTextArea area = new JTextArea(12, 14);
            area.setFont(new Font(Font.MONOSPACED, Font.PLAIN, 11));
            area.setToolTipText("Spektrum '" + label + "': eine Zeile pro Kanal (Intensität oder Kanal + Intensität)");
            spectrumAreas.put(label, area);
        }
        txtDataSetName = new JTextField(14);
        txtDataSetName.setToolTipText("Name des Datensatzes, z. B. Verzögerungszeit");
        btnSaveDataSet = new JButton("Datensatz speichern");
        dataSetListModel = new DefaultListModel<>();
        lstDataSets = new JList<>(dataSetListModel);
        lstDataSets.setSelectionMode(ListSelectionModel.MULTIPLE_INTERVAL_SELECTION);
        lstDataSets.setVisibleRowCount(8);
        btnDeleteDataSet = new JButton("Löschen");
        spnSmoothingWidth = new JSpinner(new SpinnerNumberModel(MovingAverageFilter.DEFAULT_WIDTH, 1, 99, 2));
        spnSmoothingWidth.setToolTipText("Fensterbreite des gleitenden Mittelwerts (ungerade)");
        btnPlotDeltaAbs = new JButton("Plot ΔAbs");
        btnPlotDifference = new JButton("Differenzspektren");
        btnTasOverlay = new JButton("TAS Overlay");
        btnTasOverlay.setToolTipText("ΔAbs der ausgewählten Datensätze überlagern");
        btnExportExcel = new JButton("Output Excel...");
        btnLoadCalibration = new JButton("Load Calib...");
        btnCalibration = new JButton("Kalibrierung...");
        lblCalibration = new JLabel("Nicht kalibriert");
        lblStatus = new JLabel("Bereit.");
    }

    private void layoutComponents() {
        Container contentPane = getContentPane();
        contentPane.setLayout(new BorderLayout(5, 5));

        JPanel pnlToolbar = new JPanel(new FlowLayout(FlowLayout.LEFT, 5, 5));
        pnlToolbar.add(btnPlotDeltaAbs);
        pnlToolbar.add(btnPlotDifference);
        pnlToolbar.add(btnTasOverlay);
        pnlToolbar.add(btnExportExcel);
        pnlToolbar.add(Box.createHorizontalStrut(15));
        pnlToolbar.add(btnLoadCalibration);
        pnlToolbar.add(btnCalibration);
        pnlToolbar.add(lblCalibration);
        contentPane.add(pnlToolbar, BorderLayout.NORTH);

        pnlMainControls = new JPanel(new BorderLayout(5, 5));
        pnlMainControls.setBorder(new EmptyBorder(5, 10, 5, 10));

        JPanel pnlSpectra = new JPanel(new GridLayout(1, SpectrumLabel.values().length, 5, 0));
        pnlSpectra.setBorder(BorderFactory.createTitledBorder(BorderFactory.createEtchedBorder(EtchedBorder.LOWERED), "Spektren"));
        for (SpectrumLabel label : SpectrumLabel.values()) {
            JPanel column = new JPanel(new BorderLayout(0, 2));
            column.add(new JLabel(label.getDisplayName(), SwingConstants.CENTER), BorderLayout.NORTH);
            column.add(new JScrollPane(spectrumAreas.get(label)), BorderLayout.CENTER);
            pnlSpectra.add(column);
        }
        pnlMainControls.add(pnlSpectra, BorderLayout.CENTER);

        JPanel pnlDataSets = new JPanel(new GridBagLayout());
        pnlDataSets.setBorder(BorderFactory.createTitledBorder(BorderFactory.createEtchedBorder(EtchedBorder.LOWERED), "Datensätze"));
        GridBagConstraints gbc = new GridBagConstraints();
        gbc.insets = new Insets(3, 5, 3, 5);
        gbc.anchor = GridBagConstraints.WEST;
        gbc.gridx = 0; gbc.gridy = 0; pnlDataSets.add(new JLabel("Name:"), gbc);
        gbc.gridx = 1; gbc.fill = GridBagConstraints.HORIZONTAL; gbc.weightx = 1.0; pnlDataSets.add(txtDataSetName, gbc);
        gbc.gridx = 0; gbc.gridy = 1; gbc.gridwidth = 2; pnlDataSets.add(btnSaveDataSet, gbc);
        gbc.gridy = 2; gbc.fill = GridBagConstraints.BOTH; gbc.weighty = 1.0; pnlDataSets.add(new JScrollPane(lstDataSets), gbc);
        gbc.gridy = 3; gbc.fill = GridBagConstraints.HORIZONTAL; gbc.weighty = 0; pnlDataSets.add(btnDeleteDataSet, gbc);
        gbc.gridy = 4; gbc.gridwidth = 1; gbc.fill = GridBagConstraints.NONE; gbc.weightx = 0; pnlDataSets.add(new JLabel("Glättung:"), gbc);
        gbc.gridx = 1; pnlDataSets.add(spnSmoothingWidth, gbc);
        pnlMainControls.add(pnlDataSets, BorderLayout.EAST);

        contentPane.add(pnlMainControls, BorderLayout.CENTER);

        JPanel pnlStatus = new JPanel(new FlowLayout(FlowLayout.LEFT));
        pnlStatus.setBorder(BorderFactory.createCompoundBorder(BorderFactory.createEtchedBorder(EtchedBorder.LOWERED), new EmptyBorder(3, 5, 3, 5)));
        pnlStatus.add(lblStatus);
        contentPane.add(pnlStatus, BorderLayout.SOUTH);
    }

    private void setupWindow() {
        setTitle("TAS Analyzer");
        setDefaultCloseOperation(JFrame.EXIT_ON_CLOSE);
        setMinimumSize(new Dimension(1000, 520));
        pack();
        setLocationRelativeTo(null);
    }

    /** Replaces the list contents, keeping the selection where the names still exist. */
    public void setDataSetNames(List<String> names) {
        List<String> selected = lstDataSets.getSelectedValuesList();
        dataSetListModel.clear();
        names.forEach(dataSetListModel::addElement);
        int[] indices = selected.stream().mapToInt(names::indexOf).filter(i -> i >= 0).toArray();
        lstDataSets.setSelectedIndices(indices);
        boolean any = !names.isEmpty();
        btnTasOverlay.setEnabled(any);
        btnExportExcel.setEnabled(any);
        btnDeleteDataSet.setEnabled(any);
    }

    public void setCalibrationText(String text) { lblCalibration.setText(text != null ? text : ""); }

    public void setStatusLabel(String text) {
        if (!SwingUtilities.isEventDispatchThread()) {
            SwingUtilities.invokeLater(() -> lblStatus.setText(text != null ? text : ""));
        } else {
            lblStatus.setText(text != null ? text : "");
        }
    }

    public void setBusyState(boolean busy) {
        setCursor(busy ? Cursor.getPredefinedCursor(Cursor.WAIT_CURSOR) : Cursor.getDefaultCursor());
        btnExportExcel.setEnabled(!busy && !dataSetListModel.isEmpty());
    }

    public JTextArea getSpectrumArea(SpectrumLabel label) { return spectrumAreas.get(label); }
    public JTextField getDataSetNameField() { return txtDataSetName; }
    public JButton getSaveDataSetButton() { return btnSaveDataSet; }
    public JList<String> getDataSetList() { return lstDataSets; }
    public JButton getDeleteDataSetButton() { return btnDeleteDataSet; }
    public JSpinner getSmoothingWidthSpinner() { return spnSmoothingWidth; }
    public int getSmoothingWidth() { return ((Number) spnSmoothingWidth.getValue()).intValue(); }
    public JButton getPlotDeltaAbsButton() { return btnPlotDeltaAbs; }
    public JButton getPlotDifferenceButton() { return btnPlotDifference; }
    public JButton getTasOverlayButton() { return btnTasOverlay; }
    public JButton getExportExcelButton() { return btnExportExcel; }
    public JButton getLoadCalibrationButton() { return btnLoadCalibration; }
    public JButton getCalibrationButton() { return btnCalibration; }
    public JFileChooser getFileChooser() { return fileChooser; }
}
