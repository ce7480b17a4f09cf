package org.buildlens.controller;

public enum ControllerState {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED
}
