package com.questrail.archon.emulator;

/**
 * Lifecycle of the emulated exposure sequencer.
 *
 * <pre>
 *   IDLE ──start──▶ EXPOSING ──done──▶ IDLE
 *                       │
 *                       └──abort──▶ ABORTED ──start──▶ EXPOSING
 * </pre>
 */
public enum ExposureState
{
    IDLE,
    EXPOSING,
    ABORTED
}
