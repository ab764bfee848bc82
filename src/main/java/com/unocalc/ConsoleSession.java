package com.unocalc;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.util.Optional;

import com.unocalc.controller.Action;
import com.unocalc.controller.InteractionController;

/**
 * Text front end. Each input line holds whitespace separated key labels such as
 * {@code 5 + 3 =}; runs of digits like {@code 16} or {@code 2.5} press one key per character.
 * The display is printed after every line.
 */
public class ConsoleSession {

    private final InteractionController controller;
    private final PrintWriter out;

    public ConsoleSession(Calculator calculator, CalculatorSettings settings, PrintWriter out) {
        this.out = out;
        this.controller = new InteractionController(calculator, settings,
                (kind, message) -> out.println("! " + message));
    }

    /**
     * Reads key lines until end of input or {@code quit}.
     */
    public void run(Reader in) throws IOException {
        BufferedReader reader = new BufferedReader(in);
        String line;
        while ((line = reader.readLine()) != null) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.equals("quit") || trimmed.equals("exit")) {
                break;
            }
            for (String token : trimmed.split("\\s+")) {
                if (!pressToken(token)) {
                    out.println("? unknown key: " + token);
                    break;
                }
            }
            out.println(currentDisplay());
            out.flush();
        }
        out.flush();
    }

    public String currentDisplay() {
        String display = controller.getDisplay();
        return display.isEmpty() ? "0" : display;
    }

    private boolean pressToken(String token) {
        Optional<Action> action = Action.fromLabel(token);
        if (action.isPresent()) {
            controller.press(action.get());
            return true;
        }
        if (!token.matches("[0-9.]+")) {
            return false;
        }
        for (char c : token.toCharArray()) {
            controller.press(Action.fromLabel(String.valueOf(c)).get());
        }
        return true;
    }
}
