package com.imagefan.engine;

public enum Stage {
    PREPARE,    // output namespace could not be created
    DECODE,
    TRANSFORM,
    WRITE,
    WORKER,     // worker ended without reporting, or could not run the item
    TIMEOUT
}
