package com.contrastsecurity.depupdate.util;

import com.contrastsecurity.depupdate.model.UpdateReport;

/**
 * Formats the report of available updates as a text table.
 */
public class UpdateReportFormatter {
    private static final String NEW_LINE = System.lineSeparator();
    private static final int VERSION_COLUMN_WIDTH = 25;
    private static final int DEFAULT_NAME_WIDTH = 30;

    private UpdateReportFormatter() {
        // Utility class - prevent instantiation
    }

    /**
     * @param report The report to format
     * @return the formatted report
     */
    public static String format(UpdateReport report) {
        StringBuilder result = new StringBuilder();
        if (report.isEmpty()) {
            result.append("We analyzed your package.json and everything seems to be in order. Good work!")
                  .append(NEW_LINE);
            return result.toString();
        }

        int namePad = DEFAULT_NAME_WIDTH;
        int longest = report.getEntries().stream().mapToInt(e -> e.getName().length()).max().orElse(0);
        if (longest > 0) {
            namePad = longest + 2;
        }

        result.append("We analyzed your package.json, there are some packages to update:").append(NEW_LINE)
              .append(NEW_LINE);
        result.append("  ").append(pad("Name", namePad)).append(pad("Version", VERSION_COLUMN_WIDTH))
              .append("  Command to update").append(NEW_LINE);
        result.append(" ").append("-".repeat(namePad * 2 + 35)).append(NEW_LINE);

        for (UpdateReport.Entry entry : report.getEntries()) {
            result.append("  ").append(pad(entry.getName(), namePad))
                  .append(pad(entry.getInstalledVersion() + " -> " + entry.getAvailableVersion(), VERSION_COLUMN_WIDTH))
                  .append("  ").append(entry.getCommand()).append(NEW_LINE);
        }

        result.append(NEW_LINE)
              .append("There might be additional packages that are outdated.").append(NEW_LINE)
              .append("Or run depupdate --all to try to update all at the same time.").append(NEW_LINE);
        return result.toString();
    }

    private static String pad(String value, int width) {
        if (value.length() >= width) {
            return value;
        }
        return value + " ".repeat(width - value.length());
    }
}
