package com.netbet.trustedsession.worker;

/**
 * Command sent down to a worker's inbox.
 */
record WorkerCommand(Action action, String sessionId) {

    enum Action { START, STOP }

    static WorkerCommand start(String sessionId) {
        return new WorkerCommand(Action.START, sessionId);
    }

    static WorkerCommand stop() {
        return new WorkerCommand(Action.STOP, null);
    }
}
