package com.metamodel.generator.codegen.override;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses override files.
 *
 * <pre>
 * # comment
 * header
 * literal header text
 * %%
 * override Class.member: declared_type
 * literal text
 * %%
 * </pre>
 */
public class OverrideParser {
    private static final Logger log = LoggerFactory.getLogger(OverrideParser.class);

    private static final Pattern OVERRIDE_PATTERN = Pattern.compile(
            "^override\\s+([^\\s:]+)\\s*(?::\\s*(.*?))?\\s*$"
    );

    private static final String HEADER_DIRECTIVE = "header";
    private static final String END_OF_BLOCK = "%%";

    public OverrideTable parse(Path overridesFile) {
        try {
            List<String> lines = Files.readAllLines(overridesFile, StandardCharsets.UTF_8);
            return parse(lines);
        } catch (IOException e) {
            OverrideTable table = new OverrideTable();
            table.addError("Failed to read overrides file: " + overridesFile + " (" + e.getMessage() + ")");
            return table;
        }
    }

    public OverrideTable parse(List<String> lines) {
        OverrideTable table = new OverrideTable();

        String key = null;
        String declaredType = null;
        boolean inHeader = false;
        int blockStart = 0;
        StringBuilder text = null;

        int lineNum = 0;
        for (String rawLine : lines) {
            lineNum++;

            if (text != null) {
                if (rawLine.trim().equals(END_OF_BLOCK)) {
                    String body = stripTrailingNewline(text);
                    if (inHeader) {
                        table.setHeader(body);
                    } else {
                        table.addEntry(OverrideEntry.builder()
                                .key(key)
                                .declaredType(declaredType)
                                .text(body)
                                .sourceLine(blockStart)
                                .build());
                        log.debug("Parsed override: {} ({})", key, declaredType);
                    }
                    text = null;
                    continue;
                }
                text.append(rawLine).append('\n');
                continue;
            }

            String trimmed = rawLine.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }

            if (trimmed.equals(HEADER_DIRECTIVE)) {
                inHeader = true;
                key = null;
                declaredType = null;
                blockStart = lineNum;
                text = new StringBuilder();
                continue;
            }

            Matcher matcher = OVERRIDE_PATTERN.matcher(trimmed);
            if (matcher.matches()) {
                inHeader = false;
                key = matcher.group(1);
                String type = matcher.group(2);
                declaredType = (type == null || type.isBlank()) ? null : type;
                blockStart = lineNum;
                text = new StringBuilder();
                continue;
            }

            table.addError("Line " + lineNum + ": expected 'override <name>[: <type>]' or 'header' | '" + trimmed + "'");
        }

        if (text != null) {
            table.addError("Line " + blockStart + ": block for '" + (inHeader ? HEADER_DIRECTIVE : key)
                    + "' is not terminated by '" + END_OF_BLOCK + "'");
        }

        if (table.hasErrors()) {
            log.warn("Overrides parsed with {} errors", table.getErrors().size());
        }

        return table;
    }

    private static String stripTrailingNewline(StringBuilder text) {
        int length = text.length();
        if (length > 0 && text.charAt(length - 1) == '\n') {
            return text.substring(0, length - 1);
        }
        return text.toString();
    }
}
