package org.miniworker.worker;

/**
 * Cycle counters owned by one {@link WorkerLoop}. Only the loop thread mutates them.
 * Timestamps are epoch seconds, durations seconds.
 */
public class CycleStats {

    private long totalWorkCycles;
    private double totalProcessingTime;
    private double lastWorkCycleTime;
    private double lastWorkCycleStart;
    private double lastWorkCycleEnd;
    private Double startTime;
    private volatile WorkerPhase phase = WorkerPhase.INITIALIZING;

    void recordCycle(double start, double end) {
        double processingTime = end - start;
        totalWorkCycles++;
        totalProcessingTime += processingTime;
        lastWorkCycleTime = processingTime;
        lastWorkCycleStart = start;
        lastWorkCycleEnd = end;
        if (startTime == null) {
            startTime = start;
        }
    }

    void transitionTo(WorkerPhase next) {
        if (phase == WorkerPhase.STOPPED) {
            throw new IllegalStateException("Worker already stopped, cannot move to " + next);
        }
        phase = next;
    }

    public long totalWorkCycles() { return totalWorkCycles; }
    public double totalProcessingTime() { return totalProcessingTime; }
    public double lastWorkCycleTime() { return lastWorkCycleTime; }
    public double lastWorkCycleStart() { return lastWorkCycleStart; }
    public double lastWorkCycleEnd() { return lastWorkCycleEnd; }
    public Double startTime() { return startTime; }
    public WorkerPhase phase() { return phase; }
}
