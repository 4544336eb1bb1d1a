package com.example.orchestrator;

public enum CancelReason {
    KEYBOARD_INPUT,
    TEST_FAILURE,
    CONFIG_CHANGE,
    SHUTDOWN
}
