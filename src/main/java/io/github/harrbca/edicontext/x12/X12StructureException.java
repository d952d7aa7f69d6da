package io.github.harrbca.edicontext.x12;

public class X12StructureException extends RuntimeException {

    public X12StructureException(String message) {
        super(message);
    }

    public X12StructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
