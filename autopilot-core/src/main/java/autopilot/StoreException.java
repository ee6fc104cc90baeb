package autopilot;

/**
 * Unchecked exception wrapping datastore failures raised by store implementations,
 * the connection pool and the transaction helpers.
 *
 * @see TransientStoreException
 */
public class StoreException extends RuntimeException {
  public StoreException(String message) {
    super(message);
  }

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
