package com.stencil.core.output.impl;

import com.stencil.core.output.GeneratedFile;
import com.stencil.core.output.GeneratedOutput;
import com.stencil.core.output.OutputContext;
import com.stencil.core.output.OutputWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Writer that prints generated Gleam modules to standard output, for previews and piping.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - Enable/disable ANSI colors ("true"/"false", default: "true")</li>
 *   <li>{@code console.separator} - Pattern repeated to form the rule between modules
 *       (default: "---"; an empty value falls back to the default)</li>
 *   <li>{@code console.showHeaders} - Show module path and template name ("true"/"false", default: "true")</li>
 * </ul>
 */
public class ConsoleWriter implements OutputWriter {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleWriter.class);

    static final String COLORS_SETTING = "console.colors";
    static final String SEPARATOR_SETTING = "console.separator";
    static final String HEADERS_SETTING = "console.showHeaders";

    private static final String DEFAULT_SEPARATOR = "---";
    private static final int RULE_WIDTH = 80;

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public String getDescription() {
        return "Prints generated sources to standard output";
    }

    @Override
    public void write(GeneratedOutput output, OutputContext context) {
        Palette palette = Boolean.parseBoolean(context.getSettingOrDefault(COLORS_SETTING, "true"))
            ? Palette.ANSI
            : Palette.PLAIN;
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault(HEADERS_SETTING, "true"));
        String rule = palette.rule(rule(context.getSettingOrDefault(SEPARATOR_SETTING, DEFAULT_SEPARATOR)));

        int total = output.files().size();
        logger.debug("Printing {} modules to console (palette: {}, headers: {})", total, palette, showHeaders);

        PrintStream out = System.out;
        out.println(palette.summary("Generated " + total + " file(s)"));

        int index = 0;
        for (GeneratedFile file : output.files()) {
            index++;
            out.println();
            out.println(rule);
            out.println();
            if (showHeaders) {
                out.println(palette.path("File " + index + "/" + total + ": " + file.relativePath()));
                if (file.sourceFileName() != null && !file.sourceFileName().isEmpty()) {
                    out.println(palette.meta("Source: " + file.sourceFileName()));
                }
                out.println();
            }
            out.print(file.content());
        }

        out.println();
        out.println(rule);
    }

    /**
     * Repeats {@code pattern} to roughly {@link #RULE_WIDTH} characters, never less than once.
     */
    static String rule(String pattern) {
        String unit = pattern == null || pattern.isEmpty() ? DEFAULT_SEPARATOR : pattern;
        return unit.repeat(Math.max(1, RULE_WIDTH / unit.length()));
    }

    /**
     * Color scheme for the printed sections.
     */
    private enum Palette {
        PLAIN("", "", "", ""),
        ANSI("\u001B[1m\u001B[32m", "\u001B[1m\u001B[36m", "\u001B[33m", "\u001B[0m");

        private final String summary;
        private final String path;
        private final String meta;
        private final String reset;

        Palette(String summary, String path, String meta, String reset) {
            this.summary = summary;
            this.path = path;
            this.meta = meta;
            this.reset = reset;
        }

        String summary(String text) {
            return summary + text + reset;
        }

        String path(String text) {
            return path + text + reset;
        }

        String meta(String text) {
            return meta + text + reset;
        }

        String rule(String text) {
            return meta + text + reset;
        }
    }
}
