package com.mimecast.sendeml;

import com.mimecast.sendeml.config.SettingsLoader;
import com.mimecast.sendeml.main.SettingsProcessor;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.help.HelpFormatter;
import org.apache.commons.cli.help.TextHelpAppendable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;

/**
 * Main runnable.
 *
 * <p>Sends the EML files listed in each given settings file.
 * <p>Settings files are processed in order and independently of each other.
 *
 * @see SettingsProcessor
 */
public class Main {

    /**
     * Application name.
     */
    public static final String NAME = "SendEML";

    /**
     * Application version.
     */
    public static final String VERSION = "1.5";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "Usage: {self} json_file ...";

    private final String[] args;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        new Main(args).run();
    }

    /**
     * Constructs a new Main instance.
     *
     * @param args String array.
     */
    Main(String[] args) {
        this.args = args;
    }

    /**
     * Runs the command line.
     *
     * @return Number of settings files that had errors.
     */
    int run() {
        Optional<CommandLine> opt = parseArgs(options());
        if (opt.isEmpty()) {
            return 0;
        }

        CommandLine cmd = opt.get();
        if (cmd.hasOption("version")) {
            log(NAME + " / Version: " + VERSION);
            return 0;
        }

        List<String> jsonFiles = cmd.getArgList();
        if (cmd.hasOption("help") || jsonFiles.isEmpty()) {
            usage(options());
            return 0;
        }

        return new SettingsProcessor().processAll(jsonFiles);
    }

    /**
     * CLI options.
     *
     * @return Options instance.
     */
    private Options options() {
        Options options = new Options();
        options.addOption(null, "version", false, "Show version");
        options.addOption("h", "help", false, "Show usage");
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options Options instance.
     */
    void usage(Options options) {
        log(USAGE);
        log("---");

        StringBuilder help = new StringBuilder();
        try {
            HelpFormatter formatter = HelpFormatter.builder()
                    .setShowSince(false)
                    .setHelpAppendable(new TextHelpAppendable(help))
                    .get();
            formatter.printHelp("json_file ...", "", options, "", true);
        } catch (IOException e) {
            // Should not happen with StringBuilder.
            throw new UncheckedIOException(e);
        }
        log(help.toString());

        log("json_file sample:");
        log(SettingsLoader.sample());
    }

    /**
     * Parser for CLI arguments.
     *
     * @param options Options instance.
     * @return Optional of CommandLine.
     */
    Optional<CommandLine> parseArgs(Options options) {
        CommandLine cmd = null;

        try {
            cmd = new DefaultParser().parse(options, args, true);
        } catch (Exception e) {
            log("Options error: " + e.getMessage());
            log("");
            usage(options);
        }

        return Optional.ofNullable(cmd);
    }

    /**
     * Logging wrapper.
     *
     * @param string String.
     */
    void log(String string) {
        System.out.println(string);
    }
}
