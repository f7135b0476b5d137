package io.marketsync.schedule;

public enum TriggerType { SCHEDULED, MANUAL, RETRY }
