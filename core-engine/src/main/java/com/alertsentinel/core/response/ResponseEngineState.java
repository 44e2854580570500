package com.alertsentinel.core.response;

import com.alertsentinel.core.model.ResponseRecord;
import com.alertsentinel.core.model.ResponseRule;

import java.util.ArrayList;
import java.util.List;

/**
 * Serializable copy of the response rules, their enabled flags, every
 * response record and the notification counters.
 *
 * @since 1.0.0
 */
public class ResponseEngineState {

    private List<ResponseRule> rules = new ArrayList<>();
    private List<ResponseRecord> records = new ArrayList<>();
    private long notificationsSent;
    private long notificationFailures;

    public List<ResponseRule> getRules() {
        return rules;
    }

    public void setRules(List<ResponseRule> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    public List<ResponseRecord> getRecords() {
        return records;
    }

    public void setRecords(List<ResponseRecord> records) {
        this.records = records != null ? new ArrayList<>(records) : new ArrayList<>();
    }

    public long getNotificationsSent() {
        return notificationsSent;
    }

    public void setNotificationsSent(long notificationsSent) {
        this.notificationsSent = notificationsSent;
    }

    public long getNotificationFailures() {
        return notificationFailures;
    }

    public void setNotificationFailures(long notificationFailures) {
        this.notificationFailures = notificationFailures;
    }
}
