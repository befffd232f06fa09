package com.mimecast.phishguard;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.mimecast.phishguard.email.EmailVerdict;
import com.mimecast.phishguard.main.Engines;
import com.mimecast.phishguard.signals.SignalResult;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.help.HelpFormatter;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.config.Configurator;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Main runnable.
 *
 * <p>Analyzes a single input given on the command line and prints the verdict as JSON:
 * <ul>
 *     <li><b>--text</b> - free text, combined with <b>--sender</b> when given.</li>
 *     <li><b>--sender</b> - sender identity alone.</li>
 *     <li><b>--image</b> - data URI, URL or file path.</li>
 *     <li><b>--url</b> - a single URL.</li>
 *     <li><b>--email</b> - <b>--subject</b>, <b>--body</b>, <b>--sender</b> and <b>--attachments</b>.</li>
 *     <li><b>--health</b> - engine health checks.</li>
 * </ul>
 */
public class Main {

    /**
     * Application jar name.
     */
    private static final String NAME = "phishguard.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME;

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "Heuristic phishing risk analyzer";

    private static final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private final String[] args;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        new Main(args);
    }

    /**
     * Constructs a new Main instance.
     *
     * @param args String array.
     */
    Main(String[] args) {
        this.args = args;

        Optional<CommandLine> opt = parseArgs(options());
        if (opt.isEmpty()) {
            return;
        }

        CommandLine cmd = opt.get();

        // Disable logging unless asked for.
        if (!cmd.hasOption("verbose")) {
            Configurator.setAllLevels(LogManager.getRootLogger().getName(), Level.OFF);
        }

        if (!cmd.hasOption("text") && !cmd.hasOption("sender") && !cmd.hasOption("image") &&
                !cmd.hasOption("url") && !cmd.hasOption("email") && !cmd.hasOption("health")) {
            optionsUsage(options());
            return;
        }

        try (Engines engines = Engines.load(Paths.get(cmd.getOptionValue("config", Engines.DEFAULT_DIR)))) {
            log(gson.toJson(run(cmd, engines)));
        } catch (IOException e) {
            log("Configuration error: " + e.getMessage());
        } catch (NumberFormatException e) {
            log("Options error: " + e.getMessage());
        }
    }

    /**
     * Runs the requested analysis.
     *
     * @param cmd     CommandLine instance.
     * @param engines Engines instance.
     * @return JSON ready map.
     */
    Map<String, Object> run(CommandLine cmd, Engines engines) {
        if (cmd.hasOption("health")) {
            return new LinkedHashMap<>(engines.health());
        }

        if (cmd.hasOption("email")) {
            int attachments = Integer.parseInt(cmd.getOptionValue("attachments", "0"));
            EmailVerdict verdict = engines.getEmailEngine().analyze(
                    cmd.getOptionValue("subject"), cmd.getOptionValue("body"), cmd.getOptionValue("sender"), attachments);
            return toMap(verdict);
        }

        if (cmd.hasOption("text")) {
            EmailVerdict verdict = engines.getEmailEngine().analyze(cmd.getOptionValue("text"), cmd.getOptionValue("sender"));
            return verdict.getSenderResult().isPresent() ? toMap(verdict) : toMap(verdict.getCombined());
        }

        if (cmd.hasOption("image")) {
            return toMap(engines.getImageEngine().analyze(cmd.getOptionValue("image")));
        }

        if (cmd.hasOption("url")) {
            return toMap(engines.getUrlEngine().analyze(cmd.getOptionValue("url")));
        }

        return toMap(engines.getSenderAnalyzer().analyzeSender(cmd.getOptionValue("sender")));
    }

    /**
     * Converts a result to a JSON ready map.
     *
     * @param result SignalResult instance.
     * @return Map instance.
     */
    static Map<String, Object> toMap(SignalResult result) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("risk_level", result.getRiskLevel().getLabel());
        map.put("risk_score", result.getRiskScore());
        map.put("confidence", result.getConfidence());
        map.put("indicators", new ArrayList<>(result.getIndicators()));
        result.getError().ifPresent(error -> map.put("error", error));
        result.getNote().ifPresent(note -> map.put("note", note));
        return map;
    }

    /**
     * Converts an email verdict to a JSON ready map.
     *
     * @param verdict EmailVerdict instance.
     * @return Map instance.
     */
    static Map<String, Object> toMap(EmailVerdict verdict) {
        Map<String, Object> map = toMap(verdict.getCombined());
        map.put("text_analysis", toMap(verdict.getTextResult()));
        map.put("sender_analysis", verdict.getSenderResult().map(Main::toMap).orElse(null));
        map.put("attachment_warning", verdict.isAttachmentWarning());
        return map;
    }

    /**
     * CLI options.
     * <i>Listing order will be alphabetical</i>.
     *
     * @return Options instance.
     */
    private Options options() {
        Options options = new Options();
        options.addOption(null, "text", true, "Text to analyze");
        options.addOption(null, "sender", true, "Sender, e.g. \"Name <user@example.com>\"");
        options.addOption(null, "image", true, "Image data URI, URL or file path");
        options.addOption(null, "url", true, "URL to analyze");
        options.addOption(null, "email", false, "Analyze an email from --subject, --body, --sender and --attachments");
        options.addOption(null, "subject", true, "Email subject");
        options.addOption(null, "body", true, "Email body");
        options.addOption(Option.builder().longOpt("attachments").hasArg().argName("count").desc("Email attachment count").build());
        options.addOption(Option.builder().longOpt("config").hasArg().argName("dir").desc("Directory holding signals.json5 and services.json5, default cfg/").build());
        options.addOption(null, "health", false, "Run engine health checks");
        options.addOption("v", "verbose", false, "Enable logging");
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options Options instance.
     */
    public void optionsUsage(Options options) {
        log(USAGE);
        log(" " + DESCRIPTION);
        log("");

        // Capture System.out to get help output.
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PrintStream ps = new PrintStream(baos);
        PrintStream oldOut = System.out;
        System.setOut(ps);

        try {
            HelpFormatter formatter = HelpFormatter.builder()
                .setShowSince(false)
                .get();
            formatter.printHelp(" ", "", options, "", true);
            System.out.flush();
        } catch (IOException e) {
            // Should not happen with ByteArrayOutputStream.
            throw new RuntimeException(e);
        } finally {
            System.setOut(oldOut);
        }

        log(baos.toString());
        log("");
    }

    /**
     * Parser for CLI arguments.
     *
     * @param options Options instance.
     * @return Optional of CommandLine.
     */
    public Optional<CommandLine> parseArgs(Options options) {
        CommandLine cmd = null;

        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (Exception e) {
            log("Options error: " + e.getMessage());
            log("");
            optionsUsage(options);
        }

        return Optional.ofNullable(cmd);
    }

    /**
     * Logging wrapper.
     *
     * @param string String.
     */
    public void log(String string) {
        System.out.println(string);
    }
}
