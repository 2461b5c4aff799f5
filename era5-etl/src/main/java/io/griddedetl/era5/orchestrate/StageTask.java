package io.griddedetl.era5.orchestrate;

/** A unit of work handed to one of the stage pools. */
public interface StageTask {
    /** Unique within a run; also names the task's log file. */
    String id();
}
