package com.imagefan.engine;

import java.util.concurrent.atomic.LongAccumulator;
import java.util.concurrent.atomic.LongAdder;

public class BatchStats {
    public final LongAdder started = new LongAdder();
    public final LongAdder succeeded = new LongAdder();
    public final LongAdder failed = new LongAdder();
    public final LongAdder timedOut = new LongAdder();
    public final LongAccumulator peakActive = new LongAccumulator(Math::max, 0L);
}
