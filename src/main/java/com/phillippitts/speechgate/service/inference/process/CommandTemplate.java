package com.phillippitts.speechgate.service.inference.process;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Command line with {@code {name}} placeholders, e.g.
 * {@code [python3, synth.py, --text, {text}, --out, {output}]}.
 *
 * <p>Placeholders may appear anywhere inside an argument ({@code --out={output}}). Each rendered
 * value stays a single argument, so no shell quoting is involved. Unknown placeholders render
 * as empty strings.
 */
public final class CommandTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_]+)}");

    private final List<String> arguments;

    public CommandTemplate(List<String> arguments) {
        this.arguments = arguments == null ? List.of() : arguments.stream()
                .filter(a -> a != null && !a.isBlank())
                .map(String::trim)
                .toList();
    }

    public boolean isEmpty() {
        return arguments.isEmpty();
    }

    /**
     * Substitutes placeholders in every argument.
     */
    public List<String> render(Map<String, String> values) {
        List<String> rendered = new ArrayList<>(arguments.size());
        for (String arg : arguments) {
            Matcher m = PLACEHOLDER.matcher(arg);
            StringBuilder sb = new StringBuilder();
            while (m.find()) {
                String value = values.getOrDefault(m.group(1), "");
                m.appendReplacement(sb, Matcher.quoteReplacement(value));
            }
            m.appendTail(sb);
            rendered.add(sb.toString());
        }
        return rendered;
    }

    /**
     * Checks that the executable (first argument) exists and is executable, searching
     * {@code PATH} for bare command names.
     */
    public boolean isExecutableResolvable() {
        if (arguments.isEmpty()) {
            return false;
        }
        String executable = arguments.get(0);
        if (executable.contains("/") || executable.contains(File.separator)) {
            return Files.isExecutable(Path.of(executable));
        }
        String path = System.getenv("PATH");
        if (path == null) {
            return false;
        }
        for (String dir : path.split(Pattern.quote(File.pathSeparator))) {
            if (!dir.isBlank() && Files.isExecutable(Path.of(dir, executable))) {
                return true;
            }
        }
        return false;
    }

    public String executable() {
        return arguments.isEmpty() ? "" : arguments.get(0);
    }

    @Override
    public String toString() {
        return String.join(" ", arguments);
    }
}
