package com.contrastsecurity.depupdate.util;

import com.contrastsecurity.depupdate.model.MigrationTask;
import com.contrastsecurity.depupdate.model.UpdatePlan;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.io.BufferedWriter;
import java.io.FileWriter;
import java.io.IOException;

/**
 * Writes an update plan as JSON for the tool that installs packages and runs migrations.
 */
public class PlanWriter {
    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    private PlanWriter() {
        // Utility class - prevent instantiation
    }

    /**
     * @return the plan as a JSON object
     */
    public static JsonObject toJson(UpdatePlan plan) {
        JsonObject json = new JsonObject();
        json.addProperty("manifestChanged", plan.isManifestChanged());
        json.addProperty("installRequired", plan.isInstallRequired());

        JsonArray tasks = new JsonArray();
        for (MigrationTask task : plan.getTasks()) {
            JsonObject taskJson = new JsonObject();
            taskJson.addProperty("package", task.getPackageName());
            taskJson.addProperty("collection", task.getCollection());
            taskJson.addProperty("from", task.getFrom());
            taskJson.addProperty("to", task.getTo());
            taskJson.addProperty("dependsOnInstall", task.isDependsOnInstall());
            tasks.add(taskJson);
        }
        json.add("tasks", tasks);
        return json;
    }

    public static String toJsonString(UpdatePlan plan) {
        return GSON.toJson(toJson(plan));
    }

    /**
     * Write the plan to a file, or to stdout when the path is null or "-".
     */
    public static void write(UpdatePlan plan, String outputFilePath) throws IOException {
        String content = toJsonString(plan);
        if (outputFilePath == null || "-".equals(outputFilePath)) {
            System.out.println(content);
            return;
        }
        try (BufferedWriter writer = new BufferedWriter(new FileWriter(outputFilePath))) {
            writer.write(content);
            writer.newLine();
        }
    }
}
