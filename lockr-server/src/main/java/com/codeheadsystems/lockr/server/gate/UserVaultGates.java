package com.codeheadsystems.lockr.server.gate;

import com.codeheadsystems.lockr.server.error.VaultException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Per-user coordination of vault operations.
 * <p>
 * Each user has one small monitor guarding:
 * <ul>
 *   <li>an <em>epoch</em>, bumped whenever the active key changes (rotation, reset);</li>
 *   <li>whether an exclusive operation (rotation or reset) is running;</li>
 *   <li>how many entry writes are in flight;</li>
 *   <li>whether a lock was requested while the exclusive operation ran.</li>
 * </ul>
 * The monitor is only ever held for in-memory read-decide-mutate steps. Store I/O and cipher work
 * happen outside it, so one user's slow rotation never blocks another user.
 */
public class UserVaultGates {

  private final ConcurrentHashMap<String, Gate> gates = new ConcurrentHashMap<>();

  private Gate gate(String userId) {
    return gates.computeIfAbsent(userId, k -> new Gate());
  }

  /**
   * Current key epoch for the user.
   *
   * @param userId the user id
   * @return the epoch
   */
  public long epoch(String userId) {
    Gate gate = gate(userId);
    synchronized (gate) {
      return gate.epoch;
    }
  }

  /**
   * Is a rotation or reset running for the user.
   *
   * @param userId the user id
   * @return true if so
   */
  public boolean isExclusiveActive(String userId) {
    Gate gate = gate(userId);
    synchronized (gate) {
      return gate.exclusive;
    }
  }

  /**
   * Runs the action under the user's monitor if no exclusive operation is running and the epoch
   * still equals {@code expectedEpoch}.
   *
   * @param userId        the user id
   * @param expectedEpoch epoch observed before the caller's unlocked work began
   * @param action        short in-memory action
   * @param <T>           result type
   * @return the action's result, or null if the epoch moved or an exclusive operation is running
   */
  public <T> T ifEpochUnchanged(String userId, long expectedEpoch, Supplier<T> action) {
    Gate gate = gate(userId);
    synchronized (gate) {
      if (gate.exclusive || gate.epoch != expectedEpoch) {
        return null;
      }
      return action.get();
    }
  }

  /**
   * Runs a lock under the user's monitor. If an exclusive operation is running it is told not to
   * install its new session when it finishes.
   *
   * @param userId the user id
   * @param action clears the session
   */
  public void lock(String userId, Runnable action) {
    Gate gate = gate(userId);
    synchronized (gate) {
      if (gate.exclusive) {
        gate.lockRequested = true;
      }
      action.run();
    }
  }

  /**
   * Starts a rotation or reset.
   *
   * @param userId the user id
   * @return a handle that must be closed
   * @throws VaultException VAULT_BUSY if another exclusive operation or any entry write is running
   */
  public Exclusive beginExclusive(String userId) {
    Gate gate = gate(userId);
    synchronized (gate) {
      if (gate.exclusive || gate.writers > 0) {
        throw VaultException.busy();
      }
      gate.exclusive = true;
      gate.lockRequested = false;
    }
    return new Exclusive(gate);
  }

  /**
   * Starts an entry write.
   *
   * @param userId the user id
   * @return a handle that must be closed
   * @throws VaultException VAULT_BUSY if a rotation or reset is running
   */
  public Writer beginWrite(String userId) {
    Gate gate = gate(userId);
    synchronized (gate) {
      if (gate.exclusive) {
        throw VaultException.busy();
      }
      gate.writers++;
    }
    return new Writer(gate);
  }

  private static final class Gate {
    private long epoch;
    private boolean exclusive;
    private boolean lockRequested;
    private int writers;
  }

  /**
   * Handle for a running rotation or reset.
   */
  public static final class Exclusive implements AutoCloseable {

    private final Gate gate;
    private boolean closed;

    private Exclusive(Gate gate) {
      this.gate = gate;
    }

    /**
     * Bumps the epoch and, unless a lock arrived while this operation ran, runs {@code onCommit}
     * under the user's monitor.
     *
     * @param onCommit installs the new session
     * @return true if {@code onCommit} ran; false if the vault was locked meanwhile
     */
    public boolean commitKeyChange(Runnable onCommit) {
      synchronized (gate) {
        gate.epoch++;
        if (gate.lockRequested) {
          return false;
        }
        onCommit.run();
        return true;
      }
    }

    /**
     * Bumps the epoch and runs the action under the user's monitor regardless of lock requests.
     *
     * @param action in-memory action
     */
    public void commitAndRun(Runnable action) {
      synchronized (gate) {
        gate.epoch++;
        action.run();
      }
    }

    @Override
    public void close() {
      synchronized (gate) {
        if (!closed) {
          closed = true;
          gate.exclusive = false;
          gate.lockRequested = false;
        }
      }
    }
  }

  /**
   * Handle for an in-flight entry write.
   */
  public static final class Writer implements AutoCloseable {

    private final Gate gate;
    private boolean closed;

    private Writer(Gate gate) {
      this.gate = gate;
    }

    @Override
    public void close() {
      synchronized (gate) {
        if (!closed) {
          closed = true;
          gate.writers--;
        }
      }
    }
  }
}
