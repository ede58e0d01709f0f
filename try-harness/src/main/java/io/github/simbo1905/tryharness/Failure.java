package io.github.simbo1905.tryharness;

import java.util.Objects;
import java.util.logging.Logger;

/// What a failing test body threw, classified by whether it can describe itself.
///
/// The runner only distinguishes the two cases when writing the `Message:` line;
/// [#kind()] is what the exception expectations compare.
public sealed interface Failure permits Failure.Described, Failure.Opaque {

    Logger LOG = Logger.getLogger(Failure.class.getName());

    /// @return the runtime class of the throwable
    Class<? extends Throwable> kind();

    /// @return the throwable itself
    Throwable cause();

    /// A throwable that carries a message.
    ///
    /// @param kind the runtime class of the throwable
    /// @param message the throwable's message, never null
    /// @param cause the throwable
    record Described(Class<? extends Throwable> kind, String message, Throwable cause) implements Failure {
        public Described {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(message, "message must not be null");
            Objects.requireNonNull(cause, "cause must not be null");
        }
    }

    /// A throwable without a message.
    ///
    /// @param kind the runtime class of the throwable
    /// @param cause the throwable
    record Opaque(Class<? extends Throwable> kind, Throwable cause) implements Failure {
        public Opaque {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(cause, "cause must not be null");
        }
    }

    /// Classifies a throwable.
    /// @param thrown what the test body threw
    /// @return [Described] when the throwable has a message, otherwise [Opaque];
    ///     also [Opaque] when `getMessage()` itself throws
    static Failure of(Throwable thrown) {
        Objects.requireNonNull(thrown, "thrown must not be null");
        final String message;
        try {
            message = thrown.getMessage();
        } catch (Throwable broken) {
            if (broken instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            LOG.fine(() -> "getMessage() of " + thrown.getClass().getName() + " threw "
                    + broken.getClass().getName() + ", treating it as opaque");
            return new Opaque(thrown.getClass(), thrown);
        }
        return message != null
                ? new Described(thrown.getClass(), message, thrown)
                : new Opaque(thrown.getClass(), thrown);
    }
}
