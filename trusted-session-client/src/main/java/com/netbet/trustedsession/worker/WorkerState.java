package com.netbet.trustedsession.worker;

/** Point-in-time view of one pool worker. */
public record WorkerState(int id, WorkerStatus status, String assignedSessionId) {}
