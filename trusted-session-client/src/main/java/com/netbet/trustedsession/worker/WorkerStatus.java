package com.netbet.trustedsession.worker;

public enum WorkerStatus { IDLE, RUNNING, STOPPED }
