package com.cape.sandbox;

/**
 * Lifecycle of a sandbox session. States only move forward, except for the
 * READY/BUSY cycle around each execution.
 */
public enum SessionState {
    UNINITIALIZED,
    READY,
    BUSY,
    TORN_DOWN
}
