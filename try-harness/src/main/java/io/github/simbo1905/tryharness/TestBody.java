package io.github.simbo1905.tryharness;

import java.util.List;

/// Shapes of test body accepted by [Try].
///
/// Every body may throw anything; throwing is how a body fails. A value
/// returned by a method reference or expression lambda is discarded.
public interface TestBody {

    /// A body that takes no arguments.
    @FunctionalInterface
    interface NoArgs {
        void run() throws Throwable;
    }

    /// A body that takes one argument.
    @FunctionalInterface
    interface Unary<A> {
        void run(A a) throws Throwable;
    }

    /// A body that takes two arguments.
    @FunctionalInterface
    interface Binary<A, B> {
        void run(A a, B b) throws Throwable;
    }

    /// A body that takes three arguments.
    @FunctionalInterface
    interface Ternary<A, B, C> {
        void run(A a, B b, C c) throws Throwable;
    }

    /// A body that takes the arguments in the order they were passed to the runner.
    @FunctionalInterface
    interface Variadic {
        void run(List<Object> args) throws Throwable;
    }
}
