/**
 * Error classification.
 *
 * <p>{@link express.mvp.cipherlink.transport.error.ErrorClassifier} maps exceptions to an
 * {@link express.mvp.cipherlink.transport.error.ErrorCategory}. The server uses the category to
 * pick a log level and to decide whether to keep accepting; callers may use it for their own
 * retry policy.
 */
package express.mvp.cipherlink.transport.error;
