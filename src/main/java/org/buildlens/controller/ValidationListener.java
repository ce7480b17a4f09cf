package org.buildlens.controller;

@FunctionalInterface
public interface ValidationListener {
    void onEvent(ValidationEvent event);
}
