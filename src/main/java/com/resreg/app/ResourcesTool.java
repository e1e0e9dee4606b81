package com.resreg.app;

import com.resreg.errors.ResourcesException;
import com.resreg.locale.SystemLocale;
import com.resreg.model.ExportResult;
import com.resreg.model.ImportResult;
import com.resreg.resources.Backend;
import com.resreg.resources.PropertyResources;
import com.resreg.resources.Resources;
import com.resreg.resources.ResourcesFactory;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command line access to a resource-set: look up values, list keys, export and import tables.
 */
public final class ResourcesTool {
    private static final Logger log = LogManager.getLogger(ResourcesTool.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final PrintStream out;
    private final PrintStream err;

    public ResourcesTool(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exit = new ResourcesTool(System.out, System.err).run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            printHelp(options);
            err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help")) {
            printHelp(options);
            return EXIT_OK;
        }
        if (!cmd.hasOption("config")) {
            printHelp(options);
            err.println("ERROR: --config is required.");
            return EXIT_USAGE;
        }
        if (!cmd.hasOption("find") && !cmd.hasOption("keys") && !cmd.hasOption("export") && !cmd.hasOption("import")) {
            printHelp(options);
            err.println("ERROR: one of --find, --keys, --export or --import is required.");
            return EXIT_USAGE;
        }

        Backend backend;
        SystemLocale locale;
        Map<String, String> params;
        try {
            backend = Backend.fromName(cmd.getOptionValue("backend", "property"));
            locale = cmd.hasOption("locale") ? SystemLocale.parse(cmd.getOptionValue("locale")) : null;
            params = parseParams(cmd.getOptionValues("param"));
        } catch (IllegalArgumentException | ResourcesException e) {
            err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }
        if ((cmd.hasOption("export") || cmd.hasOption("import")) && backend != Backend.PROPERTY) {
            err.println("ERROR: --export and --import require the property backend.");
            return EXIT_USAGE;
        }

        ResourcesFactory factory = backend.newFactory();
        factory.setReturnNull(!cmd.hasOption("strict"));
        factory.setDefaultSystemLocale(locale);
        try {
            Resources resources = factory.getResources(
                    cmd.getOptionValue("name", "resources"),
                    cmd.getOptionValue("config")
            );
            if (cmd.hasOption("import")) {
                PropertyResources propertyResources = (PropertyResources) resources;
                ImportResult result = propertyResources.importFrom(Path.of(cmd.getOptionValue("import")));
                propertyResources.save();
                out.println("imported rows=" + result.rows + ", cells=" + result.cells
                        + ", locales=" + String.join(",", result.locales));
            }
            if (cmd.hasOption("find")) {
                out.println(resources.find(cmd.getOptionValue("find"), locale, params));
            }
            if (cmd.hasOption("keys")) {
                resources.getBundle(locale);
                for (String key : resources.getKeys()) {
                    out.println(key);
                }
            }
            if (cmd.hasOption("export")) {
                ExportResult result = ((PropertyResources) resources).export(Path.of(cmd.getOptionValue("export")));
                out.println("exported keys=" + result.keys + ", locales=" + String.join(",", result.locales)
                        + ", target=" + result.target);
            }
            return EXIT_OK;
        } catch (ResourcesException e) {
            log.error("resources command failed", e);
            err.println("ERROR: " + e.getMessage());
            return EXIT_FAILURE;
        } finally {
            factory.release();
        }
    }

    private Map<String, String> parseParams(String[] raw) {
        Map<String, String> params = new LinkedHashMap<>();
        if (raw == null) {
            return params;
        }
        for (String pair : raw) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("--param expects name=value, got: " + pair);
            }
            params.put(pair.substring(0, eq), pair.substring(eq + 1));
        }
        return params;
    }

    private void printHelp(Options options) {
        PrintWriter writer = new PrintWriter(out);
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, "resreg", null, options,
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null, true);
        writer.flush();
    }

    private static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("backend").hasArg().argName("type").desc("property (default) or db").build());
        options.addOption(Option.builder().longOpt("config").hasArg().argName("locator")
                .desc("property base path, or database configuration path without .properties").build());
        options.addOption(Option.builder().longOpt("name").hasArg().argName("name").desc("resource-set name").build());
        options.addOption(Option.builder().longOpt("locale").hasArg().argName("token").desc("locale such as en_US; defaults to the JVM locale").build());
        options.addOption(Option.builder().longOpt("find").hasArg().argName("key").desc("print the value of a key").build());
        options.addOption(Option.builder().longOpt("param").hasArg().argName("name=value").desc("placeholder value, repeatable").build());
        options.addOption(Option.builder().longOpt("keys").desc("print the keys of the locale").build());
        options.addOption(Option.builder().longOpt("export").hasArg().argName("path").desc("write a .csv or .xlsx table of the loaded locales").build());
        options.addOption(Option.builder().longOpt("import").hasArg().argName("path").desc("replay a .csv or .xlsx table and save").build());
        options.addOption(Option.builder().longOpt("strict").desc("fail when the key has no value").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
