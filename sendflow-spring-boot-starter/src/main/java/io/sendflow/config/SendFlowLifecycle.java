package io.sendflow.config;

import io.sendflow.SendFlow;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges SendFlow start/stop lifecycle with the Spring container lifecycle.
 */
public class SendFlowLifecycle implements SmartLifecycle {
    private final SendFlow sendFlow;
    private volatile boolean running = false;

    public SendFlowLifecycle(SendFlow sendFlow) {
        this.sendFlow = sendFlow;
    }

    @Override
    public void start() {
        sendFlow.start();
        running = true;
    }

    @Override
    public void stop() {
        sendFlow.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
