package express.mvp.cipherlink.transport.error;

import express.mvp.cipherlink.transport.ConfigurationException;
import express.mvp.cipherlink.transport.TransportException;
import express.mvp.cipherlink.transport.crypto.CryptoException;
import express.mvp.cipherlink.transport.framing.FramingException;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.security.GeneralSecurityException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Classifies exceptions into error categories.
 *
 * <h2>Classification Strategy</h2>
 *
 * <ol>
 *   <li>Custom classifiers registered for the exception's type
 *   <li>JVM errors are {@link ErrorCategory#FATAL}
 *   <li>This library's exceptions by type: {@link ConfigurationException},
 *       {@link CryptoException}, {@link FramingException}
 *   <li>Timeouts before other I/O errors, since {@link SocketTimeoutException} is an
 *       {@link IOException}
 *   <li>{@link TransportException} by its cause, NETWORK if it has none
 *   <li>The cause chain
 *   <li>{@link ErrorCategory#UNKNOWN}
 * </ol>
 *
 * <p>Types are checked, never messages.
 *
 * @see ErrorCategory
 */
public final class ErrorClassifier {

    /** Custom classifiers keyed by exception class. */
    private static final Map<Class<? extends Throwable>, Function<Throwable, ErrorCategory>>
            CUSTOM_CLASSIFIERS = new ConcurrentHashMap<>();

    private ErrorClassifier() {
        // Utility class
    }

    /**
     * Classifies an exception into an error category.
     *
     * @param throwable the exception to classify
     * @return the error category
     */
    public static ErrorCategory classify(Throwable throwable) {
        if (throwable == null) {
            return ErrorCategory.UNKNOWN;
        }

        for (Map.Entry<Class<? extends Throwable>, Function<Throwable, ErrorCategory>> entry :
                CUSTOM_CLASSIFIERS.entrySet()) {
            if (entry.getKey().isInstance(throwable)) {
                ErrorCategory custom = entry.getValue().apply(throwable);
                if (custom != null) {
                    return custom;
                }
            }
        }

        if (throwable instanceof VirtualMachineError || throwable instanceof LinkageError) {
            return ErrorCategory.FATAL;
        }
        if (throwable instanceof ConfigurationException) {
            return ErrorCategory.CONFIGURATION;
        }
        if (throwable instanceof CryptoException
                || throwable instanceof GeneralSecurityException
                || throwable instanceof SecurityException) {
            return ErrorCategory.SECURITY;
        }
        if (throwable instanceof FramingException) {
            return ErrorCategory.PROTOCOL;
        }
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof TimeoutException
                || throwable instanceof InterruptedException) {
            return ErrorCategory.TRANSIENT;
        }
        if (isNetworkError(throwable)) {
            return ErrorCategory.NETWORK;
        }
        if (throwable instanceof TransportException) {
            Throwable cause = throwable.getCause();
            return cause == null || cause == throwable ? ErrorCategory.NETWORK : classify(cause);
        }

        Throwable cause = throwable.getCause();
        if (cause != null && cause != throwable) {
            return classify(cause);
        }
        return ErrorCategory.UNKNOWN;
    }

    private static boolean isNetworkError(Throwable t) {
        // ConnectException, SocketException, EOFException, ClosedChannelException and friends.
        return t instanceof IOException;
    }

    /**
     * Registers a custom classifier for a specific exception type.
     *
     * <p>Custom classifiers are checked before built-in classification. Returning null from the
     * function falls through to the built-in rules.
     *
     * @param exceptionType the exception class to match
     * @param classifier maps a matching exception to its category, or null
     * @param <T> the exception type
     */
    public static <T extends Throwable> void registerClassifier(
            Class<T> exceptionType, Function<Throwable, ErrorCategory> classifier) {
        CUSTOM_CLASSIFIERS.put(exceptionType, classifier);
    }

    /**
     * Removes a previously registered custom classifier.
     *
     * @param exceptionType the exception class
     */
    public static void removeClassifier(Class<? extends Throwable> exceptionType) {
        CUSTOM_CLASSIFIERS.remove(exceptionType);
    }

    /** Clears all custom classifiers. */
    public static void clearCustomClassifiers() {
        CUSTOM_CLASSIFIERS.clear();
    }

    /**
     * Returns a one-line description of the classification result for log messages.
     *
     * @param throwable the exception to describe
     * @return category, exception type and message
     */
    public static String describeError(Throwable throwable) {
        if (throwable == null) {
            return "null exception";
        }
        ErrorCategory category = classify(throwable);
        StringBuilder sb = new StringBuilder();
        sb.append(category.name())
                .append(": ")
                .append(throwable.getClass().getSimpleName())
                .append(" - ")
                .append(throwable.getMessage());
        Throwable cause = throwable.getCause();
        if (cause != null) {
            sb.append(" (cause: ")
                    .append(cause.getClass().getSimpleName())
                    .append(" - ")
                    .append(cause.getMessage())
                    .append(')');
        }
        return sb.toString();
    }
}
