package com.unocalc;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;

import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

public class ConsoleSessionTest {
    private StringWriter output;
    private ConsoleSession session;

    @Before
    public void setUp() {
        output = new StringWriter();
        session = new ConsoleSession(new Calculator(), CalculatorSettings.defaults(), new PrintWriter(output));
    }

    private String[] run(String input) throws IOException {
        session.run(new StringReader(input));
        return output.toString().split("\\R");
    }

    @Test
    public void testPrintsDisplayAfterEachLine() throws IOException {
        String[] lines = run("5 + 3 =\n16 sqrt\n");
        assertArrayEquals(new String[] {"8", "4"}, lines);
    }

    @Test
    public void testDigitRunsAndEmptyDisplay() throws IOException {
        String[] lines = run("2.5 x^2\nC\n");
        assertArrayEquals(new String[] {"6.25", "0"}, lines);
    }

    @Test
    public void testErrorsArePrinted() throws IOException {
        String[] lines = run("9 / 0 =\n");
        assertArrayEquals(new String[] {
            "! Error: Cannot divide by zero. Please enter a valid denominator.", "0"}, lines);
    }

    @Test
    public void testUnknownKeySkipsRestOfLine() throws IOException {
        String[] lines = run("4 sin 5\n");
        assertArrayEquals(new String[] {"? unknown key: sin", "4"}, lines);
    }

    @Test
    public void testQuitStopsReading() throws IOException {
        String[] lines = run("\n7 !\nquit\n1 +\n");
        assertArrayEquals(new String[] {"5040"}, lines);
        assertEquals("5040", session.currentDisplay());
    }
}
