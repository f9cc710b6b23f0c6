package com.tribrid.studio.telemetry;

import com.tribrid.studio.control.model.MetricEvent;
import com.tribrid.studio.control.model.RunStatus;
import lombok.extern.slf4j.Slf4j;

/**
 * Authoritative lifecycle status of the selected run.
 *
 * Status only moves on events from the backend. Terminal states
 * (completed, failed, cancelled) are entered only from an event carrying
 * that status and are never left; queued and running may change freely
 * until then. Invoking cancel does not move the machine.
 */
@Slf4j
public class RunStateMachine {

    private RunStatus status = RunStatus.UNKNOWN;
    private String terminalAt;
    private int transitionCount;

    /**
     * Applies the status carried by an event, if any.
     *
     * @return true if the status changed
     */
    public boolean apply(MetricEvent event) {
        if (event.getStatus() == null) {
            return false;
        }
        return transitionTo(RunStatus.fromWire(event.getStatus()), event.getTs());
    }

    /**
     * Applies the status reported by the run-detail fetch, under the same rules.
     */
    public boolean seed(RunStatus reported) {
        if (reported == null) {
            return false;
        }
        return transitionTo(reported, null);
    }

    public RunStatus getStatus() {
        return status;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Timestamp of the event that made the run terminal, if known.
     */
    public String getTerminalAt() {
        return terminalAt;
    }

    public int getTransitionCount() {
        return transitionCount;
    }

    public boolean canCancel() {
        return !status.isTerminal();
    }

    public boolean canPromote() {
        return status == RunStatus.COMPLETED;
    }

    /**
     * @throws RunActionException if the run already reached a terminal state
     */
    public void requireCancellable(String runId) {
        if (!canCancel()) {
            throw new RunActionException(
                    "Run " + runId + " cannot be cancelled in status " + status.getWireName(),
                    runId,
                    RunActionException.RUN_NOT_CANCELLABLE
            );
        }
    }

    /**
     * @throws RunActionException unless the run completed
     */
    public void requirePromotable(String runId) {
        if (!canPromote()) {
            throw new RunActionException(
                    "Run " + runId + " is not finished (status=" + status.getWireName() + ")",
                    runId,
                    RunActionException.RUN_NOT_PROMOTABLE
            );
        }
    }

    public void reset() {
        status = RunStatus.UNKNOWN;
        terminalAt = null;
        transitionCount = 0;
    }

    private boolean transitionTo(RunStatus next, String ts) {
        if (status.isTerminal()) {
            if (next != status) {
                log.debug("Ignoring status {} after terminal status {}", next.getWireName(), status.getWireName());
            }
            return false;
        }
        if (next == status) {
            return false;
        }
        log.debug("Run status {} -> {}", status.getWireName(), next.getWireName());
        status = next;
        transitionCount++;
        if (next.isTerminal()) {
            terminalAt = ts;
        }
        return true;
    }
}
