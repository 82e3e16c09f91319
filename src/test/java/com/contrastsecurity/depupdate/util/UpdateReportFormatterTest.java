package com.contrastsecurity.depupdate.util;

import com.contrastsecurity.depupdate.model.UpdateReport;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class UpdateReportFormatterTest {

    @Test
    public void testEmptyReport() {
        String output = UpdateReportFormatter.format(new UpdateReport("latest", Collections.emptyList()));

        assertEquals("We analyzed your package.json and everything seems to be in order. Good work!",
                output.trim());
    }

    @Test
    public void testReportTable() {
        UpdateReport report = new UpdateReport("latest", Arrays.asList(
                new UpdateReport.Entry("@scope/core", "8.0.0", "9.0.0", true, "depupdate @scope/core"),
                new UpdateReport.Entry("rxjs", "6.4.0", "6.5.0", false, "npm install rxjs@6.5.0")));

        String output = UpdateReportFormatter.format(report);
        String[] lines = output.split(System.lineSeparator());

        assertTrue(lines[0].startsWith("We analyzed your package.json, there are some packages to update"));
        assertTrue(output.contains("8.0.0 -> 9.0.0"));
        assertTrue(output.contains("depupdate @scope/core"));
        assertTrue(output.contains("npm install rxjs@6.5.0"));
        assertTrue(output.contains("depupdate --all"));
        // names are padded to one column
        int coreColumn = lines[4].indexOf("8.0.0");
        int rxjsColumn = lines[5].indexOf("6.4.0");
        assertEquals(coreColumn, rxjsColumn);
    }
}
