package org.buildlens.report;

import java.util.Locale;

public enum CardStatus {
    SUCCESS,
    WARNING,
    ERROR;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Higher-is-better classification: at least {@code success} is SUCCESS, at least
     * {@code warning} is WARNING.
     */
    static CardStatus of(double value, double success, double warning) {
        if (value >= success) {
            return SUCCESS;
        }
        if (value >= warning) {
            return WARNING;
        }
        return ERROR;
    }
}
