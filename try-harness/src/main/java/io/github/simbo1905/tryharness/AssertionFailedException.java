package io.github.simbo1905.tryharness;

/// Thrown by the assertion helpers of [Try] when the checked condition does not hold.
///
/// Any throwable fails a test; this one is simply the type the harness itself uses.
public final class AssertionFailedException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    /// Creates a new AssertionFailedException with the given message.
    /// @param message the error message
    public AssertionFailedException(String message) {
        super(message);
    }

    /// Creates a new AssertionFailedException with the given message and cause.
    /// @param message the error message
    /// @param cause what the test body actually threw
    public AssertionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
