package com.imagefan.app;

public enum Isolation {
    THREAD,     // own thread, immutable payload in, outcome out
    PROCESS     // own JVM, JSON over stdin/stdout
}
