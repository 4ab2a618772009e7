package ru.yandex.devtools.cases;

/**
 * A case source was found but could not be instantiated, read or enumerated
 */
public class CaseSourceException extends RuntimeException {

    public CaseSourceException(String message) {
        super(message);
    }

    public CaseSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
