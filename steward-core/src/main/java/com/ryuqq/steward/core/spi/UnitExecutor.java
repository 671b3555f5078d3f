package com.ryuqq.steward.core.spi;

import com.ryuqq.steward.core.error.RemoteCommandException;
import com.ryuqq.steward.core.model.UnitId;
import com.ryuqq.steward.core.unit.UnitOperation;

/**
 * Remote unit executor SPI.
 *
 * <p>Runs one operation on one unit (node) and blocks until it finishes.
 * Timeout enforcement belongs to the implementation.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: called concurrently for different units of the same resource</li>
 *   <li>Failures are reported by throwing {@link RemoteCommandException}</li>
 * </ul>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public interface UnitExecutor {

    /**
     * Runs the operation on the unit.
     *
     * @param unit the target unit
     * @param operation the operation to run
     * @throws RemoteCommandException if the remote command failed on this unit
     */
    void run(UnitId unit, UnitOperation operation);
}
