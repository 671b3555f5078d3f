package com.ryuqq.steward.testkit.contract;

import com.ryuqq.steward.core.error.RemoteCommandException;
import com.ryuqq.steward.core.model.UnitId;
import com.ryuqq.steward.core.spi.UnitExecutor;
import com.ryuqq.steward.core.unit.UnitOperation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * UnitExecutor test double with scripted failures.
 *
 * <p>Every invocation is recorded. Units registered with {@link #failOn(UnitId...)} throw
 * {@link RemoteCommandException}; all other units succeed immediately.</p>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public class ScriptedUnitExecutor implements UnitExecutor {

    /**
     * A single recorded invocation.
     *
     * @param unit the target unit
     * @param operation the requested operation
     */
    public record Call(UnitId unit, UnitOperation operation) {
    }

    private final Set<UnitId> failing = ConcurrentHashMap.newKeySet();
    private final List<Call> calls = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void run(UnitId unit, UnitOperation operation) {
        calls.add(new Call(unit, operation));
        if (failing.contains(unit)) {
            throw new RemoteCommandException(unit, operation.verb() + " exited with status 1 on " + unit.getValue());
        }
    }

    /**
     * Makes the given units fail on every subsequent invocation.
     *
     * @param units the units to fail
     * @return this executor
     */
    public ScriptedUnitExecutor failOn(UnitId... units) {
        Collections.addAll(failing, units);
        return this;
    }

    /**
     * Returns a snapshot of all recorded invocations.
     *
     * @return recorded calls in invocation order
     */
    public List<Call> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    public Set<UnitId> calledUnits() {
        synchronized (calls) {
            return calls.stream().map(Call::unit).collect(Collectors.toUnmodifiableSet());
        }
    }

    public int callCount() {
        return calls.size();
    }

    public void clear() {
        failing.clear();
        calls.clear();
    }
}
