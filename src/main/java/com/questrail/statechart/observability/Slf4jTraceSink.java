package com.questrail.statechart.observability;

import com.questrail.statechart.api.Fault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Trace sink that emits logs via SLF4J: configuration changes at info, every
 * step at debug, faults at error (fatal) or warn.
 */
public final class Slf4jTraceSink implements TraceSink
{
    private static final Logger log = LoggerFactory.getLogger(Slf4jTraceSink.class);

    @Override
    public void onStep(TraceRecord record) {
        if (!record.before().equals(record.after())) {
            log.info("{} #{} {}: {} -> {}",
                    record.machine(), record.sequence(), record.event(), record.before(), record.after());
        }
        log.debug("{} step {}", record.machine(), record);
    }

    @Override
    public void onFault(String machine, Fault fault) {
        if (fault.fatal()) {
            log.error("{} fatal fault: {}", machine, fault);
        } else {
            log.warn("{} fault: {}", machine, fault);
        }
    }
}
