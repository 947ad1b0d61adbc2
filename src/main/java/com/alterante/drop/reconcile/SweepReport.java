package com.alterante.drop.reconcile;

/**
 * Counters for one reconciler sweep.
 *
 * @param visited  READY records seen at the start of the sweep
 * @param notified side effects completed during this sweep
 * @param failed   side effects that threw
 * @param skipped  records that left READY before their side effect ran
 */
public record SweepReport(int visited, int notified, int failed, int skipped) {
}
