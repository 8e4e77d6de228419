package org.wireroute.app;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @Test
    void testMainPrintsSampleRoute() {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(buffer));
            Main.main(new String[0]);
        } finally {
            System.setOut(originalOut);
        }

        String output = buffer.toString();
        assertTrue(output.contains("source=GRID_SEARCH"));
        assertTrue(output.contains("length=180.0"));
        assertTrue(output.contains("HORIZONTAL") || output.contains("VERTICAL"));
    }
}
