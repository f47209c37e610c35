package com.tradecopier.session;

import com.tradecopier.event.SessionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Terminates the process with a non-zero exit code when the session becomes unrecoverable
 * (authorization refused, or reconnect attempts exhausted).
 *
 * <p>Exit runs on its own thread: the event is published from the session connector thread, which
 * context shutdown has to stop.
 */
@Component
public class FatalErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(FatalErrorHandler.class);

    static final int FATAL_EXIT_CODE = 2;

    private final ApplicationContext applicationContext;

    public FatalErrorHandler(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    @EventListener
    public void onSessionEvent(SessionEvent event) {
        if (!event.isFatal()) {
            return;
        }
        log.error("Fatal session failure, shutting down: {}", event.getMessage());
        Thread exitThread = new Thread(this::exit, "fatal-exit");
        exitThread.start();
    }

    void exit() {
        int code = SpringApplication.exit(applicationContext, () -> FATAL_EXIT_CODE);
        System.exit(code);
    }
}
