package com.ukdataalerts.coronavirus.output;

public interface AlertDispatcher {

    /**
     * Sends the alert to every configured recipient. Failures propagate:
     * an alert that silently goes nowhere is worse than a failed run.
     */
    void sendAlert(String subject, String bodyHtml);
}
