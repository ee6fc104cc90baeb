package autopilot;

/**
 * A datastore failure that is expected to clear on its own (lost connection, lock
 * timeout, deadlock victim). Retried automatically by the batch coordinator and
 * the unit-of-work helpers.
 */
public class TransientStoreException extends StoreException {
  public TransientStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
