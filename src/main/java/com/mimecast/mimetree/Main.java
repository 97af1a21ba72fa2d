package com.mimecast.mimetree;

import com.google.gson.GsonBuilder;
import com.mimecast.mimetree.main.Config;
import com.mimecast.mimetree.mime.MimeParser;
import com.mimecast.mimetree.mime.MimePart;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.help.HelpFormatter;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.config.Configurator;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Main runnable.
 *
 * <p>Parses a MIME file and prints its part tree, one line per part indented by depth,
 * <br>or as JSON with {@code --json}.
 */
public class Main {

    /**
     * Application jar name.
     */
    private static final String NAME = "mimetree.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME;

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "MIME part tree parser";

    /**
     * Longest content preview printed per part.
     */
    private static final int PREVIEW_LENGTH = 60;

    private final String[] args;
    private final PrintStream out;

    /**
     * Exit status, 0 on success.
     */
    private int status = 0;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        Main main = new Main(args, System.out);
        if (main.getStatus() != 0) {
            System.exit(main.getStatus());
        }
    }

    /**
     * Constructs a new Main instance and runs it.
     *
     * @param args String array.
     * @param out  Output stream.
     */
    Main(String[] args, PrintStream out) {
        this.args = args;
        this.out = out;

        // Disable logging.
        Configurator.setAllLevels(LogManager.getRootLogger().getName(), Level.OFF);

        Optional<CommandLine> opt = parseArgs(options());
        if (opt.isEmpty()) {
            status = 2;
            return;
        }

        CommandLine cmd = opt.get();
        if (cmd.hasOption("help") || !cmd.hasOption("file")) {
            optionsUsage(options());
            status = cmd.hasOption("help") ? 0 : 2;
            return;
        }

        try {
            if (cmd.hasOption("conf")) {
                Config.initParser(cmd.getOptionValue("conf"));
            }

            MimePart root = new MimeParser().parse(cmd.getOptionValue("file"));

            if (cmd.hasOption("json")) {
                log(new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create()
                        .toJson(toMap(root, cmd.hasOption("content"))));
            } else {
                print(root, cmd.hasOption("content"));
            }

        } catch (IOException e) {
            log("Parse error: " + e.getMessage());
            status = 1;
        }
    }

    /**
     * CLI options.
     * <i>Listing order will be alphabetical</i>.
     *
     * @return Options instance.
     */
    private Options options() {
        Options options = new Options();
        options.addOption("c", "conf", true, "Path to parser configuration JSON5 file");
        options.addOption("f", "file", true, "MIME file to parse");
        options.addOption("h", "help", false, "Show usage help");
        options.addOption("j", "json", false, "Print tree as JSON");
        options.addOption("x", "content", false, "Include decoded text content");
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
            throw new IllegalStateException(e);
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
            cmd = new DefaultParser().parse(options, args, true);
        } catch (Exception e) {
            log("Options error: " + e.getMessage());
            log("");
            optionsUsage(options);
        }

        return Optional.ofNullable(cmd);
    }

    /**
     * Prints one line per part, depth first.
     *
     * @param part    MimePart instance.
     * @param content Include content preview.
     */
    private void print(MimePart part, boolean content) {
        StringBuilder line = new StringBuilder(StringUtils.repeat("  ", part.getDepth()))
                .append(part.getContentType());

        if (!part.getDisposition().isEmpty()) {
            line.append(" [").append(part.getDisposition()).append("]");
        }
        if (!part.getFileName().isEmpty()) {
            line.append(" \"").append(part.getFileName()).append("\"");
        }
        if (!part.isMultipart()) {
            line.append(" ").append(part.getSize()).append(" bytes");
            if (content && part.getContentType().startsWith("text/")) {
                line.append(": ").append(StringUtils.abbreviate(
                        StringUtils.normalizeSpace(part.getContentAsString()), PREVIEW_LENGTH));
            }
        }
        log(line.toString());

        for (MimePart child : part.getChildren()) {
            print(child, content);
        }
    }

    /**
     * Builds a JSON friendly map of a part and its children.
     *
     * @param part    MimePart instance.
     * @param content Include decoded text content.
     * @return Map of String, Object.
     */
    private Map<String, Object> toMap(MimePart part, boolean content) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("contentType", part.getContentType());
        map.put("disposition", part.getDisposition());
        map.put("fileName", part.getFileName());
        map.put("size", part.getSize());
        if (content && part.getContentType().startsWith("text/")) {
            map.put("content", new String(part.getContent(), StandardCharsets.UTF_8));
        }

        List<Map<String, Object>> children = new ArrayList<>();
        part.getChildren().forEach(child -> children.add(toMap(child, content)));
        if (!children.isEmpty()) {
            map.put("children", children);
        }
        return map;
    }

    /**
     * Gets exit status.
     *
     * @return 0 on success, 1 on parse error, 2 on usage error.
     */
    public int getStatus() {
        return status;
    }

    /**
     * Logging wrapper.
     *
     * @param string String.
     */
    public void log(String string) {
        out.println(string);
    }
}
