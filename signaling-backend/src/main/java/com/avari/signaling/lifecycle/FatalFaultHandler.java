package com.avari.signaling.lifecycle;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Turns an exception that escapes any thread into an orderly application exit,
 * so clients get the shutdown notice instead of a dropped socket.
 */
@Component
@ConditionalOnProperty(name = "app.relay.exit-on-fatal-fault", havingValue = "true", matchIfMissing = true)
public class FatalFaultHandler implements Thread.UncaughtExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(FatalFaultHandler.class);

    private final ConfigurableApplicationContext context;
    private final AtomicBoolean exiting = new AtomicBoolean(false);

    public FatalFaultHandler(ConfigurableApplicationContext context) {
        this.context = context;
    }

    @PostConstruct
    public void install() {
        Thread.setDefaultUncaughtExceptionHandler(this);
    }

    @Override
    public void uncaughtException(Thread thread, Throwable error) {
        log.error("Uncaught exception in thread {}", thread.getName(), error);
        if (!exiting.compareAndSet(false, true)) {
            return;
        }
        Thread exit = new Thread(() -> System.exit(SpringApplication.exit(context, () -> 1)), "fatal-shutdown");
        exit.start();
    }
}
