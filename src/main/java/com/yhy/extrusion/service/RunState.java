package com.yhy.extrusion.service;

/**
 * Lifecycle of one optimization run.
 */
public enum RunState {
    VALIDATING,
    RUNNING,
    AGGREGATING,
    DONE,
    FAILED
}
