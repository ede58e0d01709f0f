/// A small harness for running test cases without an external test framework.
///
/// ## Running tests
/// A [Try] instance runs test bodies, counts passes and failures, and writes a
/// report for every failure to its diagnostic sink:
/// ```java
/// import static io.github.simbo1905.tryharness.SourceContext.here;
///
/// final var t = new Try();
/// t.equal(here(), 2 + 2, 4);
/// t.less(here(), "abc", "abd");
/// t.throwsA(here(), IllegalArgumentException.class, () -> Integer.parseInt("x"));
/// t.run(here(), (a, b) -> {
///     if (a.length() != b) throw Try.fail("wrong length");
/// }, "four", 4);
/// t.printSummary();
/// System.exit(t.exitStatus());
/// ```
///
/// ## Failure reports
/// A body fails by throwing anything. The report names the call site, the
/// message of the throwable (or `(no message)`) and each argument rendered by
/// [ValueRenderer]:
/// ```
/// Test failed: Example.java, line 12
/// Message: "Arguments are not equal!"
/// Arguments:
/// "4" (java.lang.Integer)
/// "5" (java.lang.Integer)
/// ```
package io.github.simbo1905.tryharness;
