package com.phoenix.worker.runtime;

import java.util.Map;
import java.util.concurrent.Executor;
import org.slf4j.MDC;

/**
 * Carries the submitting thread's MDC (instance id, workflow kind) into tasks run by the delegate.
 * The running thread's own context is restored afterwards, since a caller-runs policy may execute the
 * task on the submitting thread itself.
 */
public class MdcAwareExecutor implements Executor {

    private final Executor delegate;

    public MdcAwareExecutor(Executor delegate) {
        this.delegate = delegate;
    }

    @Override
    public void execute(Runnable command) {
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        delegate.execute(() -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            apply(parentMdc);
            try {
                command.run();
            } finally {
                apply(previous);
            }
        });
    }

    private static void apply(Map<String, String> context) {
        if (context == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(context);
        }
    }
}
