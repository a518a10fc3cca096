package org.ilvm.runtime.services;

import org.ilvm.runtime.isa.Instruction;
import org.ilvm.runtime.spi.IExecutionObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes every executed step with the resulting register table to the log at DEBUG level.
 * Installed by the VirtualMachine when {@code ilvm.runtime.trace} is enabled.
 */
public class LoggingExecutionObserver implements IExecutionObserver {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingExecutionObserver.class);

    @Override
    public void afterStep(int programCounter, Instruction instruction, Map<String, Long> registers) {
        if (LOG.isDebugEnabled()) {
            // The table is live and appenders may format the message later.
            LOG.debug("pc={} {} -> Registers: {}", programCounter, instruction, new LinkedHashMap<>(registers));
        }
    }
}
