package com.mimecast.leveler.processor;

import com.mimecast.leveler.queue.MessageFormatException;
import org.apache.commons.lang3.StringUtils;

/**
 * Sorts handler failures into permanent and transient.
 */
public final class FailureClassifier {

    /**
     * Private constructor for utility class.
     */
    private FailureClassifier() {
    }

    /**
     * Is permanent.
     * <p>Argument, unsupported operation and message format errors are permanent, as is
     * {@link PermanentMessageException}. Everything else is transient.
     *
     * @param failure Failure.
     * @return true if retrying cannot help.
     */
    public static boolean isPermanent(Throwable failure) {
        return failure instanceof IllegalArgumentException
                || failure instanceof UnsupportedOperationException
                || failure instanceof MessageFormatException
                || failure instanceof PermanentMessageException;
    }

    /**
     * Dead-letter reason for a permanent failure.
     *
     * @param failure Failure.
     * @return Reason.
     */
    public static String reason(Throwable failure) {
        String reason = "permanent failure: " + failure.getClass().getSimpleName();
        return StringUtils.isNotBlank(failure.getMessage()) ? reason + ": " + failure.getMessage() : reason;
    }
}
