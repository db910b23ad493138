package io.enumeris.core;

public class EnumerisException extends RuntimeException {

    public EnumerisException(Throwable cause) {
        super(cause);
    }

    public EnumerisException(String message, Throwable cause) {
        super(message, cause);
    }

    public EnumerisException(String message) {
        super(message);
    }

}
