package de.anton.tas.analyser.tas_analyzer.view;

import org.jfree.chart.ChartPanel;
import org.jfree.chart.JFreeChart;

import javax.swing.*;
import java.awt.*;

/**
 * Non-modal window showing one chart. Mouse wheel zooms, the chart panel popup offers save/print.
 */
public class ChartDialog extends JDialog {

    private final ChartPanel chartPanel;

    public ChartDialog(Window owner, String title, JFreeChart chart) {
        super(owner, title, ModalityType.MODELESS);
        chartPanel = new ChartPanel(chart);
        chartPanel.setPreferredSize(new Dimension(800, 550));
        chartPanel.setMouseWheelEnabled(true);
        getContentPane().add(chartPanel, BorderLayout.CENTER);
        setDefaultCloseOperation(DISPOSE_ON_CLOSE);
        pack();
        setLocationRelativeTo(owner);
    }

    public ChartPanel getChartPanel() { return chartPanel; }
}
