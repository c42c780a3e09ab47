package uk.gegc.frontdesk.shared.persistence;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import uk.gegc.frontdesk.shared.exception.StorageFailureException;

import java.util.function.Supplier;

/**
 * Wraps calls into Spring Data repositories so that any {@link DataAccessException}
 * leaves the store as a {@link StorageFailureException}.
 */
@Slf4j
public final class StorageCalls {

    private StorageCalls() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException ex) {
            log.warn("Storage call '{}' failed: {}", operation, ex.getMostSpecificCause().getMessage());
            throw new StorageFailureException("Storage call failed: " + operation, ex);
        }
    }

    public static void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }
}
