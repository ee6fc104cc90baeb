package autopilot;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;

import static org.junit.jupiter.api.Assertions.*;

class StoreErrorsTest {

  @Test
  void connectionAndRollbackStatesAreTransient() {
    assertInstanceOf(TransientStoreException.class, StoreErrors.translate("x", new SQLException("gone", "08006")));
    assertInstanceOf(TransientStoreException.class, StoreErrors.translate("x", new SQLException("deadlock", "40001")));
    assertInstanceOf(TransientStoreException.class, StoreErrors.translate("x", new SQLException("lock", "HYT00")));
    assertInstanceOf(TransientStoreException.class,
        StoreErrors.translate("x", new SQLTransientConnectionException("reset")));
  }

  @Test
  void constraintViolationIsPermanent() {
    StoreException e = StoreErrors.translate("insert failed", new SQLException("duplicate", "23505"));

    assertFalse(e instanceof TransientStoreException);
    assertEquals("insert failed", e.getMessage());
  }

  @Test
  void chainedTransientCauseIsFound() {
    SQLException outer = new SQLException("wrapper", "HY000");
    outer.setNextException(new SQLException("timeout", "40P01"));

    assertTrue(StoreErrors.isTransient(outer));
    assertFalse(StoreErrors.isTransient(new SQLException("syntax", "42000")));
  }
}
