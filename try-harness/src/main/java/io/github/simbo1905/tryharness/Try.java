package io.github.simbo1905.tryharness;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Runs test cases and keeps the pass/fail tally.
///
/// A test body fails by throwing anything at all. `run` contains every throwable,
/// writes a failure report to the sink and returns `false`, so a loop over many
/// independent cases always reaches the end:
/// ```
/// Test failed: <file>, line <line>
/// Message: "<message>"          or (no message)
/// Arguments:                    or (no arguments)
/// "<rendered a1>" (<type1>)
///
/// ```
///
/// `successCount() + failureCount()` always equals the number of tests run.
/// Instances are not thread-safe; confine each one to a single thread.
public final class Try {

    private static final Logger LOG = Logger.getLogger(Try.class.getName());

    static final String NOT_EQUAL = "Arguments are not equal!";
    static final String EQUAL = "Arguments are equal!";
    static final String NOT_LESS = "The first argument is not less than the second!";
    static final String NOT_LESS_OR_EQUAL = "The first argument is not less than or equal to the second!";
    static final String DID_NOT_THROW = "Test did not throw!";
    static final String WRONG_NON_EXCEPTION = "Test throws a wrong non-exception!";

    private static final String NEWLINE = ArgumentLogger.NEWLINE;

    private final PrintStream sink;
    private final ArgumentLogger argumentLogger;
    private long successCount;
    private long failureCount;

    /// Creates a runner reporting to `System.out`.
    public Try() {
        this(System.out);
    }

    /// Creates a runner reporting to the given stream. The runner does not close it.
    /// @param sink the diagnostic stream
    public Try(PrintStream sink) {
        this(sink, new ValueRenderer());
    }

    /// Creates a runner with an explicit renderer for argument values.
    /// @param sink the diagnostic stream
    /// @param renderer renders arguments of failed tests
    public Try(PrintStream sink, ValueRenderer renderer) {
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.argumentLogger = new ArgumentLogger(renderer);
    }

    /// Fails the current test body with a message.
    ///
    /// Declared to return the exception so bodies can write `throw Try.fail("...")`
    /// where the compiler needs a terminating statement.
    /// @param message the failure message
    /// @return never returns normally
    public static AssertionFailedException fail(String message) {
        throw new AssertionFailedException(message);
    }

    // ========== Running test bodies ==========

    /// Runs a body that takes no arguments.
    /// @param sc where the test was written
    /// @param body the test body
    /// @return true if the body completed, false if it threw
    public boolean run(SourceContext sc, TestBody.NoArgs body) {
        Objects.requireNonNull(body, "body must not be null");
        return execute(sc, args -> body.run(), Collections.emptyList());
    }

    /// Runs a body with one argument, which is reported if the body fails.
    /// @param sc where the test was written
    /// @param body the test body
    /// @param a the argument
    /// @return true if the body completed, false if it threw
    public <A> boolean run(SourceContext sc, TestBody.Unary<A> body, A a) {
        Objects.requireNonNull(body, "body must not be null");
        return execute(sc, args -> body.run(a), Collections.singletonList(a));
    }

    /// Runs a body with two arguments, which are reported if the body fails.
    /// @param sc where the test was written
    /// @param body the test body
    /// @param a the first argument
    /// @param b the second argument
    /// @return true if the body completed, false if it threw
    public <A, B> boolean run(SourceContext sc, TestBody.Binary<A, B> body, A a, B b) {
        Objects.requireNonNull(body, "body must not be null");
        return execute(sc, args -> body.run(a, b), Arrays.<Object>asList(a, b));
    }

    /// Runs a body with three arguments, which are reported if the body fails.
    /// @param sc where the test was written
    /// @param body the test body
    /// @param a the first argument
    /// @param b the second argument
    /// @param c the third argument
    /// @return true if the body completed, false if it threw
    public <A, B, C> boolean run(SourceContext sc, TestBody.Ternary<A, B, C> body, A a, B b, C c) {
        Objects.requireNonNull(body, "body must not be null");
        return execute(sc, args -> body.run(a, b, c), Arrays.<Object>asList(a, b, c));
    }

    /// Runs a body with any number of arguments, passed to it as a list in the given order.
    /// @param sc where the test was written
    /// @param body the test body
    /// @param args the arguments, reported in order if the body fails
    /// @return true if the body completed, false if it threw
    public boolean runVariadic(SourceContext sc, TestBody.Variadic body, Object... args) {
        Objects.requireNonNull(body, "body must not be null");
        Objects.requireNonNull(args, "args must not be null");
        return execute(sc, body, Collections.unmodifiableList(Arrays.asList(args.clone())));
    }

    // ========== Comparisons ==========

    /// Passes when `Objects.equals(a, b)`.
    ///
    /// This is value equality on the boxed operands, so `equal(sc, 1L, 1)` fails:
    /// a `Long` never equals an `Integer`. Widen both operands to the same type first.
    /// @return true if the test passed
    public boolean equal(SourceContext sc, Object a, Object b) {
        return run(sc, (x, y) -> {
            if (!Objects.equals(x, y)) {
                throw new AssertionFailedException(NOT_EQUAL);
            }
        }, a, b);
    }

    /// Passes when `!Objects.equals(a, b)`.
    ///
    /// As with [#equal], operands of different boxed types are never equal,
    /// so `notequal(sc, 1L, 1)` passes.
    /// @return true if the test passed
    public boolean notequal(SourceContext sc, Object a, Object b) {
        return run(sc, (x, y) -> {
            if (Objects.equals(x, y)) {
                throw new AssertionFailedException(EQUAL);
            }
        }, a, b);
    }

    /// Passes when `a.compareTo(b) < 0`. A null operand fails the test.
    /// @return true if the test passed
    public <T extends Comparable<? super T>> boolean less(SourceContext sc, T a, T b) {
        return less(sc, a, b, Comparator.naturalOrder());
    }

    /// Passes when `comparator.compare(a, b) < 0`.
    /// @return true if the test passed
    public <T> boolean less(SourceContext sc, T a, T b, Comparator<? super T> comparator) {
        Objects.requireNonNull(comparator, "comparator must not be null");
        return run(sc, (x, y) -> {
            if (!(comparator.compare(x, y) < 0)) {
                throw new AssertionFailedException(NOT_LESS);
            }
        }, a, b);
    }

    /// Passes when `a.compareTo(b) <= 0`. A null operand fails the test.
    /// @return true if the test passed
    public <T extends Comparable<? super T>> boolean lequal(SourceContext sc, T a, T b) {
        return lequal(sc, a, b, Comparator.naturalOrder());
    }

    /// Passes when `comparator.compare(a, b) <= 0`.
    /// @return true if the test passed
    public <T> boolean lequal(SourceContext sc, T a, T b, Comparator<? super T> comparator) {
        Objects.requireNonNull(comparator, "comparator must not be null");
        return run(sc, (x, y) -> {
            if (!(comparator.compare(x, y) <= 0)) {
                throw new AssertionFailedException(NOT_LESS_OR_EQUAL);
            }
        }, a, b);
    }

    // ========== Exception expectations ==========

    /// Passes when the body throws an instance of `expected`, subclasses included.
    /// @return true if the test passed
    public boolean throwsA(SourceContext sc, Class<? extends Throwable> expected, TestBody.NoArgs body) {
        Objects.requireNonNull(body, "body must not be null");
        return expectThrow(sc, expected, false, args -> body.run(), Collections.emptyList());
    }

    /// Passes when the body, given `a`, throws an instance of `expected`.
    /// @return true if the test passed
    public <A> boolean throwsA(SourceContext sc, Class<? extends Throwable> expected, TestBody.Unary<A> body, A a) {
        Objects.requireNonNull(body, "body must not be null");
        return expectThrow(sc, expected, false, args -> body.run(a), Collections.singletonList(a));
    }

    /// Passes when the body, given `a` and `b`, throws an instance of `expected`.
    /// @return true if the test passed
    public <A, B> boolean throwsA(SourceContext sc, Class<? extends Throwable> expected,
            TestBody.Binary<A, B> body, A a, B b) {
        Objects.requireNonNull(body, "body must not be null");
        return expectThrow(sc, expected, false, args -> body.run(a, b), Arrays.<Object>asList(a, b));
    }

    /// Passes when the body throws exactly `expected`; a subclass is a wrong exception.
    /// @return true if the test passed
    public boolean throwsExactly(SourceContext sc, Class<? extends Throwable> expected, TestBody.NoArgs body) {
        Objects.requireNonNull(body, "body must not be null");
        return expectThrow(sc, expected, true, args -> body.run(), Collections.emptyList());
    }

    /// Passes when the body, given `a`, throws exactly `expected`.
    /// @return true if the test passed
    public <A> boolean throwsExactly(SourceContext sc, Class<? extends Throwable> expected,
            TestBody.Unary<A> body, A a) {
        Objects.requireNonNull(body, "body must not be null");
        return expectThrow(sc, expected, true, args -> body.run(a), Collections.singletonList(a));
    }

    /// Passes when the body, given `a` and `b`, throws exactly `expected`.
    /// @return true if the test passed
    public <A, B> boolean throwsExactly(SourceContext sc, Class<? extends Throwable> expected,
            TestBody.Binary<A, B> body, A a, B b) {
        Objects.requireNonNull(body, "body must not be null");
        return expectThrow(sc, expected, true, args -> body.run(a, b), Arrays.<Object>asList(a, b));
    }

    private boolean expectThrow(SourceContext sc, Class<? extends Throwable> expected, boolean exact,
            TestBody.Variadic body, List<Object> args) {
        Objects.requireNonNull(expected, "expected must not be null");
        return execute(sc, list -> {
            try {
                body.run(list);
            } catch (Throwable thrown) {
                final boolean matches = exact ? thrown.getClass() == expected : expected.isInstance(thrown);
                if (matches) {
                    // an expected interrupt was consumed by the body, so the flag stays clear
                    LOG.finer(() -> "Expected " + expected.getName() + " was thrown");
                    return;
                }
                restoreInterrupt(thrown);
                final Failure failure = Failure.of(thrown);
                if (failure instanceof Failure.Described described) {
                    throw new AssertionFailedException("Test throws a wrong exception ("
                            + described.kind().getName() + "): " + described.message(), thrown);
                }
                throw new AssertionFailedException(WRONG_NON_EXCEPTION, thrown);
            }
            throw new AssertionFailedException(DID_NOT_THROW);
        }, args);
    }

    // ========== Core ==========

    private boolean execute(SourceContext sc, TestBody.Variadic body, List<Object> args) {
        Objects.requireNonNull(sc, "sc must not be null");
        LOG.fine(() -> "Running test at " + sc);
        try {
            body.run(args);
        } catch (Throwable thrown) {
            restoreInterrupt(thrown);
            final Failure failure = Failure.of(thrown);
            LOG.fine(() -> "Test at " + sc + " failed with " + failure.kind().getName());
            failureCount++;
            report(sc, failure, args);
            return false;
        }
        successCount++;
        LOG.fine(() -> "Test at " + sc + " passed");
        return true;
    }

    private void report(SourceContext sc, Failure failure, List<Object> args) {
        final var header = new StringBuilder();
        header.append("Test failed: ").append(sc).append(NEWLINE);
        if (failure instanceof Failure.Described described) {
            header.append("Message: \"").append(described.message()).append('"').append(NEWLINE);
        } else {
            header.append("(no message)").append(NEWLINE);
        }
        if (args.isEmpty()) {
            header.append("(no arguments)").append(NEWLINE).append(NEWLINE);
        } else {
            header.append("Arguments:").append(NEWLINE).append(argumentLogger.format(args));
        }
        // written in one piece so the sink never holds half a report
        sink.print(header);
        sink.flush();
    }

    private static void restoreInterrupt(Throwable thrown) {
        if (thrown instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
    }

    // ========== Tally ==========

    /// @return the number of tests that passed
    public long successCount() {
        return successCount;
    }

    /// @return the number of tests that failed
    public long failureCount() {
        return failureCount;
    }

    /// @return the number of tests run through this instance
    public long testCount() {
        return successCount + failureCount;
    }

    /// @return true when no test has failed
    public boolean allPassed() {
        return failureCount == 0;
    }

    /// The diagnostic stream, for callers that want to write extra text around a test.
    /// @return the sink given at construction
    public PrintStream sink() {
        return sink;
    }

    /// @return `<n> tests run, <s> passed, <f> failed`
    public String summary() {
        return testCount() + " tests run, " + successCount + " passed, " + failureCount + " failed";
    }

    /// Writes [#summary()] and a newline to the sink.
    public void printSummary() {
        sink.print(summary() + NEWLINE);
        sink.flush();
    }

    /// @return 0 when every test passed, otherwise 1; suitable for `System.exit`
    public int exitStatus() {
        return allPassed() ? 0 : 1;
    }
}
