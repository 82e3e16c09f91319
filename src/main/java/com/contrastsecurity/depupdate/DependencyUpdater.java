package com.contrastsecurity.depupdate;

import com.contrastsecurity.depupdate.api.NpmRegistryClient;
import com.contrastsecurity.depupdate.exception.ConfigurationException;
import com.contrastsecurity.depupdate.exception.UpdateException;
import com.contrastsecurity.depupdate.model.MigrationTask;
import com.contrastsecurity.depupdate.model.UpdatePlan;
import com.contrastsecurity.depupdate.model.UpdateResult;
import com.contrastsecurity.depupdate.service.UpdatePipeline;
import com.contrastsecurity.depupdate.util.ManifestFile;
import com.contrastsecurity.depupdate.util.NodeModulesVersionProbe;
import com.contrastsecurity.depupdate.util.NpmrcReader;
import com.contrastsecurity.depupdate.util.PlanWriter;
import com.contrastsecurity.depupdate.util.UpdateReportFormatter;
import com.contrastsecurity.depupdate.version.SemverVersionOracle;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Main application class for planning package updates
 */
public class DependencyUpdater {

    private static UpdatePipeline pipeline;
    private static final Logger logger = LoggerFactory.getLogger(DependencyUpdater.class);

    public static void main(String[] args) {
        // Register shutdown hook for clean termination
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.debug("Shutdown hook triggered, cleaning up resources");
            cleanupResources();
        }));

        int status = run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Run depupdate with command line arguments.
     *
     * @return process exit status
     */
    static int run(String[] args) {
        UpdateOptions options;
        try {
            options = parseArguments(args);
        } catch (ConfigurationException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println("Run 'depupdate --help' for usage information");
            return 2;
        }
        if (options == null) {
            return 0;
        }

        try {
            execute(options);
            return 0;
        } catch (UpdateException e) {
            logger.error(e.getMessage());
            System.err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            logger.error("Error writing update plan: {}", e.getMessage(), e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        } finally {
            cleanupResources();
        }
    }

    /**
     * Parse command line arguments.
     *
     * @return the options, or null if only help or version was requested
     * @throws ConfigurationException on unknown or malformed options
     */
    static UpdateOptions parseArguments(String[] args) throws ConfigurationException {
        UpdateOptions.Builder builder = UpdateOptions.builder();

        for (String arg : args) {
            if (arg.equals("--help") || arg.equals("-h") || arg.equals("help")) {
                printUsage();
                return null;
            } else if (arg.equals("--version")) {
                System.out.println("depupdate " + getVersion());
                return null;
            } else if (arg.equals("--all")) {
                builder.all(true);
            } else if (arg.equals("--next")) {
                builder.next(true);
            } else if (arg.equals("--force")) {
                builder.force(true);
            } else if (arg.equals("--migrate-only")) {
                builder.migrateOnly(true);
            } else if (arg.startsWith("--from=")) {
                builder.from(arg.substring(7));
            } else if (arg.startsWith("--to=")) {
                builder.to(arg.substring(5));
            } else if (arg.startsWith("--registry=")) {
                builder.registry(arg.substring(11));
            } else if (arg.equals("--insecure")) {
                builder.insecure(true);
            } else if (arg.startsWith("--project-dir=")) {
                builder.projectDir(Paths.get(arg.substring(14)));
            } else if (arg.startsWith("--plan-output=")) {
                builder.planOutput(arg.substring(14));
            } else if (arg.equals("--dry-run")) {
                builder.dryRun(true);
            } else if (arg.equals("--verbose") || arg.equals("-v")) {
                setLoggingLevel(Level.DEBUG);
                logger.debug("Verbose mode enabled");
            } else if (arg.startsWith("--loglevel=")) {
                setLogLevel(arg.substring(11).toUpperCase());
            } else if (arg.startsWith("--packages=")) {
                builder.addPackages(arg.substring(11));
            } else if (arg.startsWith("-")) {
                throw new ConfigurationException("Unknown argument: " + arg);
            } else {
                builder.addPackages(arg);
            }
        }

        UpdateOptions options = builder.build();
        if (options.getFrom() != null && !options.isMigrateOnly()) {
            throw new ConfigurationException("--from can only be used with --migrate-only.");
        }
        if (options.getTo() != null && options.getFrom() == null) {
            throw new ConfigurationException("--to requires --from.");
        }
        logger.debug("Options: {}", options);
        return options;
    }

    private static void execute(UpdateOptions options) throws UpdateException, IOException {
        Path projectDir = options.getProjectDir();
        JsonObject manifest = ManifestFile.read(projectDir);

        String registry = NpmrcReader.resolveRegistry(options.getRegistry(),
                System.getenv(NpmrcReader.REGISTRY_ENV), projectDir);

        pipeline = new UpdatePipeline(options,
                new NpmRegistryClient(registry, options.isInsecure()),
                new SemverVersionOracle(),
                new NodeModulesVersionProbe(projectDir));
        UpdateResult result = pipeline.run(manifest);

        if (result.isReport()) {
            System.out.print(UpdateReportFormatter.format(result.getReport()));
            return;
        }

        UpdatePlan plan = result.getPlan();
        if (plan.isManifestChanged()) {
            if (options.isDryRun()) {
                logger.info("Dry run, package.json is not written");
            } else {
                ManifestFile.write(projectDir, plan.getManifestContent());
            }
        }
        for (MigrationTask task : plan.getTasks()) {
            logger.info("Scheduled migration of {} from {} to {} ({})",
                    task.getPackageName(), task.getFrom(), task.getTo(), task.getCollection());
        }
        PlanWriter.write(plan, options.getPlanOutput());
    }

    /**
     * Print usage information
     */
    private static void printUsage() {
        System.out.println("Usage: depupdate [packages...] [options]");
        System.out.println();
        System.out.println("Without packages, lists the installed packages that have updates with migrations.");
        System.out.println("Packages are given as name or name@version-or-tag, separated by spaces or commas.");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --all                     Update every package declared in package.json");
        System.out.println("  --next                    Use the \"next\" dist-tag instead of \"latest\"");
        System.out.println("  --force                   Report peer dependency problems but update anyway");
        System.out.println("  --migrate-only            Only schedule migrations, do not change package.json");
        System.out.println("  --from=<version>          Version to migrate from (with --migrate-only, one package)");
        System.out.println("  --to=<version>            Version to migrate to (default: installed version)");
        System.out.println("  --registry=<url>          Registry to use (default: .npmrc or registry.npmjs.org)");
        System.out.println("  --insecure                Do not validate the registry's SSL certificate");
        System.out.println("  --project-dir=<dir>       Directory holding package.json (default: .)");
        System.out.println("  --plan-output=<file>      Write the update plan to a file (default: stdout)");
        System.out.println("  --dry-run                 Do not write package.json");
        System.out.println("  --verbose, -v             Verbose logging");
        System.out.println("  --loglevel=<level>        Log level (TRACE, DEBUG, INFO, WARN, ERROR)");
        System.out.println("  --version                 Print the version");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  # Show available updates");
        System.out.println("  depupdate");
        System.out.println();
        System.out.println("  # Update a package and its package group");
        System.out.println("  depupdate @angular/core");
        System.out.println();
        System.out.println("  # Re-run the migrations of an installed package");
        System.out.println("  depupdate @angular/core --migrate-only --from=8");
    }

    private static void setLogLevel(String level) {
        ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
            org.slf4j.LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        Level logbackLevel;

        switch (level) {
            case "TRACE":
                logbackLevel = Level.TRACE;
                break;
            case "DEBUG":
                logbackLevel = Level.DEBUG;
                break;
            case "INFO":
                logbackLevel = Level.INFO;
                break;
            case "WARN":
                logbackLevel = Level.WARN;
                break;
            case "ERROR":
                logbackLevel = Level.ERROR;
                break;
            default:
                System.err.println("Unknown log level: " + level + ". Using WARN.");
                logbackLevel = Level.WARN;
        }

        root.setLevel(logbackLevel);
        logger.info("Log level set to: {}", level);
    }

    /**
     * Get the version from pom.xml properties file
     */
    private static String getVersion() {
        try {
            Properties props = new Properties();
            try (InputStream is = DependencyUpdater.class.getResourceAsStream("/META-INF/maven/com.contrastsecurity/depupdate/pom.properties")) {
                if (is != null) {
                    props.load(is);
                    return props.getProperty("version", "1.0.0");
                }
            }
        } catch (Exception e) {
            logger.debug("Could not read version from pom.properties: {}", e.getMessage());
        }
        // Fallback to hardcoded version
        return "1.0.0";
    }

    /**
     * Set the logging level for the application
     *
     * @param level The logging level to set
     */
    private static void setLoggingLevel(Level level) {
        LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        loggerContext.getLogger("com.contrastsecurity.depupdate").setLevel(level);
    }

    /**
     * Clean up resources and close any open connections
     */
    private static void cleanupResources() {
        if (pipeline != null) {
            try {
                pipeline.close();
                logger.debug("Successfully closed resources");
            } catch (Exception e) {
                logger.warn("Error cleaning up resources: {}", e.getMessage());
            } finally {
                pipeline = null;
            }
        }
    }
}
