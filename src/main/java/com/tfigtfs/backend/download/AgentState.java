package com.tfigtfs.backend.download;

public enum AgentState {
    IDLE,
    FETCHING,
    BACKING_OFF,
    WAITING_FOR_SCHEDULE,
    /** The loop has exited: a manual fetch completed, or the agent was stopped. */
    STOPPED
}
