package io.github.simbo1905.tryharness;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/// Writes rendered test arguments to a diagnostic stream.
final class ArgumentLogger {

    static final String NEWLINE = "\n";

    private final ValueRenderer renderer;

    ArgumentLogger(ValueRenderer renderer) {
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
    }

    /// Writes one line per argument, in order, then one empty line.
    /// An empty list writes only the terminating newline.
    void log(PrintStream out, List<?> args) {
        out.print(format(args));
    }

    /// The text [#log] writes, for callers assembling a larger report.
    String format(List<?> args) {
        final var text = new StringBuilder();
        for (final Object arg : args) {
            text.append(renderer.render(arg)).append(NEWLINE);
        }
        return text.append(NEWLINE).toString();
    }
}
