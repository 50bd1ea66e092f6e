package com.bella.script.interpreter;

/**
 * Base type of every Bella evaluation error. All of them are fatal: the language has no
 * catch construct, so they unwind straight to the host.
 *
 * {@link #kind()} is the taxonomy name shown to users, {@link #subject()} the offending
 * name or operator.
 */
public abstract class BellaError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String subject;

    protected BellaError(String subject, String message) {
        super(message);
        this.subject = subject;
    }

    public abstract String kind();

    public String subject() {
        return subject;
    }

    /** One-line diagnostic, e.g. {@code UnboundVariableError: Unknown variable: x}. */
    public String diagnostic() {
        return kind() + ": " + getMessage();
    }

    public static final class RedeclarationError extends BellaError {
        private static final long serialVersionUID = 1L;

        public RedeclarationError(String name) {
            super(name, "Variable already declared: " + name);
        }

        @Override
        public String kind() { return "RedeclarationError"; }
    }

    public static final class UnboundVariableError extends BellaError {
        private static final long serialVersionUID = 1L;

        public UnboundVariableError(String name) {
            super(name, "Unknown variable: " + name);
        }

        @Override
        public String kind() { return "UnboundVariableError"; }
    }

    public static final class TypeError extends BellaError {
        private static final long serialVersionUID = 1L;

        public TypeError(String subject, String message) {
            super(subject, message);
        }

        @Override
        public String kind() { return "TypeError"; }
    }

    public static final class UnknownOperatorError extends BellaError {
        private static final long serialVersionUID = 1L;

        public UnknownOperatorError(String operator) {
            super(operator, "Unknown operator: " + operator);
        }

        @Override
        public String kind() { return "UnknownOperatorError"; }
    }

    public static final class NotCallableError extends BellaError {
        private static final long serialVersionUID = 1L;

        public NotCallableError(String name, Value.Type actual) {
            super(name, "Not a function: " + name + " (" + actual + ")");
        }

        @Override
        public String kind() { return "NotCallableError"; }
    }

    public static final class ArityMismatchError extends BellaError {
        private static final long serialVersionUID = 1L;

        public ArityMismatchError(String name, int expected, int actual) {
            super(name, name + " expects " + expected + " argument(s), got " + actual);
        }

        @Override
        public String kind() { return "ArityMismatchError"; }
    }

    public static final class IndexOutOfRangeError extends BellaError {
        private static final long serialVersionUID = 1L;

        public IndexOutOfRangeError(int index, int length) {
            super(Integer.toString(index), "Array index out of range: " + index + " (length " + length + ")");
        }

        @Override
        public String kind() { return "IndexOutOfRangeError"; }
    }
}
