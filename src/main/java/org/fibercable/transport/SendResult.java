package org.fibercable.transport;

/**
 * Outcome of writing one frame to a transport.
 */
public class SendResult {

    public static final SendResult SUCCESS = new SendResult(Type.Success);
    public static final SendResult Closed = new SendResult(Type.Closed);

    private final Type type;

    public SendResult(Type type) {
        this.type = type;
    }

    public Type getType() {
        return type;
    }

    public enum Type {
        Success, FailedOnError, Closed;
    }

    public static class FailedWithError extends SendResult {
        private final Exception failed;

        public FailedWithError(Exception failed) {
            super(Type.FailedOnError);
            this.failed = failed;
        }

        public Exception getFailed() {
            return failed;
        }
    }

    @Override
    public String toString() {
        return "SendResult{" + type + '}';
    }
}
