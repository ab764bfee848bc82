package com.unocalc.ui;

import java.awt.BorderLayout;
import java.awt.Font;
import java.awt.GridLayout;

import javax.swing.BorderFactory;
import javax.swing.JButton;
import javax.swing.JFrame;
import javax.swing.JOptionPane;
import javax.swing.JPanel;
import javax.swing.JTextField;
import javax.swing.SwingConstants;

import com.unocalc.Calculator;
import com.unocalc.CalculatorSettings;
import com.unocalc.ErrorKind;
import com.unocalc.controller.Action;
import com.unocalc.controller.InteractionController;

/**
 * Swing front end: a display field above a five by five keypad.
 */
public class CalculatorWindow extends JFrame {

    /** Keypad rows, top to bottom. */
    static final Action[][] KEYPAD = {
        {Action.DIGIT_7, Action.DIGIT_8, Action.DIGIT_9, Action.FACTORIAL, Action.DIVIDE},
        {Action.DIGIT_4, Action.DIGIT_5, Action.DIGIT_6, Action.POWER, Action.MULTIPLY},
        {Action.DIGIT_1, Action.DIGIT_2, Action.DIGIT_3, Action.SQUARE, Action.SUBTRACT},
        {Action.SIGN_TOGGLE, Action.DIGIT_0, Action.DECIMAL_POINT, Action.NATURAL_LOG, Action.ADD},
        {Action.CLEAR, Action.DELETE, Action.SQUARE_ROOT, Action.EXP, Action.EQUALS},
    };

    private final JTextField displayField;
    private final InteractionController controller;

    public CalculatorWindow(Calculator calculator, CalculatorSettings settings) {
        super(settings.getTitle());
        this.controller = new InteractionController(calculator, settings, this::showError);

        setDefaultCloseOperation(JFrame.EXIT_ON_CLOSE);
        setResizable(false);

        displayField = new JTextField(16);
        displayField.setEditable(false);
        displayField.setHorizontalAlignment(SwingConstants.RIGHT);
        displayField.setFont(new Font(Font.MONOSPACED, Font.PLAIN, 24));

        JPanel keypad = new JPanel(new GridLayout(KEYPAD.length, KEYPAD[0].length, 5, 5));
        keypad.setBorder(BorderFactory.createEmptyBorder(10, 10, 10, 10));
        Font keyFont = new Font(Font.MONOSPACED, Font.PLAIN, 18);
        for (Action[] row : KEYPAD) {
            for (Action action : row) {
                JButton button = new JButton(action.getLabel());
                button.setFont(keyFont);
                button.addActionListener(e -> onKey(action));
                keypad.add(button);
            }
        }

        setLayout(new BorderLayout());
        add(displayField, BorderLayout.NORTH);
        add(keypad, BorderLayout.CENTER);
        pack();
        setLocationRelativeTo(null);
    }

    private void onKey(Action action) {
        controller.press(action);
        displayField.setText(controller.getDisplay());
    }

    private void showError(ErrorKind kind, String message) {
        JOptionPane.showMessageDialog(this, message, "Error", JOptionPane.ERROR_MESSAGE);
    }
}
