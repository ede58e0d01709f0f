package io.github.simbo1905.tryharness;

import java.util.Optional;

/// The file and line of an assertion, used only to label failure reports.
///
/// Use [#here()] at the call site, usually through a static import, so that
/// callers never write locations by hand.
///
/// @param file the source file name, stored as given
/// @param line the line number, stored as given
public record SourceContext(String file, long line) {

    static final String UNKNOWN_FILE = "<unknown>";

    /// Creates a context from an explicit file name and line number.
    /// Neither value is validated.
    /// @param file the source file name
    /// @param line the line number
    /// @return the context
    public static SourceContext of(String file, long line) {
        return new SourceContext(file, line);
    }

    /// Captures the file and line of the code that calls this method.
    /// @return the caller's context, or `<unknown>, line 0` when the stack has no usable frame
    public static SourceContext here() {
        final Optional<StackWalker.StackFrame> caller = StackWalker.getInstance().walk(frames -> frames
                .filter(f -> !f.getClassName().equals(SourceContext.class.getName()))
                .findFirst());
        return caller.map(SourceContext::fromFrame).orElseGet(() -> new SourceContext(UNKNOWN_FILE, 0));
    }

    private static SourceContext fromFrame(StackWalker.StackFrame frame) {
        final String file = frame.getFileName() != null ? frame.getFileName() : frame.getClassName();
        // negative when the class was compiled without line tables
        final int line = Math.max(frame.getLineNumber(), 0);
        return new SourceContext(file, line);
    }

    @Override
    public String toString() {
        return file + ", line " + line;
    }
}
