package com.contrastsecurity.depupdate.model;

import java.util.Collections;
import java.util.List;

/**
 * Read-only listing of packages that have a newer release carrying upgrade metadata.
 */
public class UpdateReport {
    private final String channel;
    private final List<Entry> entries;

    public UpdateReport(String channel, List<Entry> entries) {
        this.channel = channel;
        this.entries = entries != null ? List.copyOf(entries) : Collections.emptyList();
    }

    /**
     * @return dist-tag the report compared against ("latest" or "next")
     */
    public String getChannel() {
        return channel;
    }

    public List<Entry> getEntries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public static class Entry {
        private final String name;
        private final String installedVersion;
        private final String availableVersion;
        private final boolean hasMigrations;
        private final String command;

        public Entry(String name, String installedVersion, String availableVersion,
                     boolean hasMigrations, String command) {
            this.name = name;
            this.installedVersion = installedVersion;
            this.availableVersion = availableVersion;
            this.hasMigrations = hasMigrations;
            this.command = command;
        }

        public String getName() {
            return name;
        }

        public String getInstalledVersion() {
            return installedVersion;
        }

        public String getAvailableVersion() {
            return availableVersion;
        }

        public boolean hasMigrations() {
            return hasMigrations;
        }

        public String getCommand() {
            return command;
        }

        @Override
        public String toString() {
            return name + " " + installedVersion + " -> " + availableVersion + " (" + command + ")";
        }
    }
}
