package ed.inf.adbs.querysync.predicate;

/**
 * Signals a predicate shape outside what the visual builder can represent.
 */
public class UnsupportedPredicateException extends RuntimeException {

    public UnsupportedPredicateException(String message) {
        super(message);
    }
}
