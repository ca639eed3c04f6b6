package io.parley.core.session;

public final class MissingSessionContextException extends IllegalStateException {

    public MissingSessionContextException(String message) {
        super(message);
    }
}
