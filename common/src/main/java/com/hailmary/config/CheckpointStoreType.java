package com.hailmary.config;

/**
 * Available checkpoint store backends.
 */
public enum CheckpointStoreType {

    /** One row per source in a bookkeeping table of the relational store. */
    JDBC,

    /** One JSON file per source on local disk. */
    FILE,

    /** Process memory only; every restart resyncs from epoch. */
    MEMORY
}
