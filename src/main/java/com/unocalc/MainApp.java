package com.unocalc;

import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import javax.swing.SwingUtilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.unocalc.ui.CalculatorWindow;

/**
 * Starts the calculator window, or the console front end with {@code --console} or on a headless JVM.
 */
public class MainApp {

    private static final Logger log = LoggerFactory.getLogger(MainApp.class);

    public static void main(String[] args) {
        try {
            start(args);
        } catch (RuntimeException e) {
            log.error("An error occurred while starting the application", e);
            System.exit(1);
        }
    }

    private static void start(String[] args) {
        CalculatorSettings settings = CalculatorSettings.load();
        log.info("Starting with {}", settings);

        Calculator calculator = new Calculator();
        if (Arrays.asList(args).contains("--console") || GraphicsEnvironment.isHeadless()) {
            runConsole(calculator, settings);
            return;
        }

        SwingUtilities.invokeLater(() -> {
            try {
                new CalculatorWindow(calculator, settings).setVisible(true);
            } catch (RuntimeException e) {
                log.error("An error occurred while starting the application", e);
                System.exit(1);
            }
        });
    }

    private static void runConsole(Calculator calculator, CalculatorSettings settings) {
        PrintWriter out = new PrintWriter(System.out, true, StandardCharsets.UTF_8);
        out.println("=== " + settings.getTitle() + " ===");
        out.println("Keys: 0-9 . + - * / x^y ! x^2 ln sqrt e^x +/- C Del =   (quit to exit)");
        try {
            new ConsoleSession(calculator, settings, out)
                    .run(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.error("Console input failed", e);
            System.exit(1);
        }
    }
}
