package photorestore;

public class RestorationException extends RuntimeException {

    public RestorationException(String message, Throwable cause) {
        super(message, cause);
    }
}
