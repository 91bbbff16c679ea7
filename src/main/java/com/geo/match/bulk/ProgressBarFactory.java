package com.geo.match.bulk;

import me.tongfei.progressbar.ProgressBar;
import me.tongfei.progressbar.ProgressBarBuilder;
import me.tongfei.progressbar.ProgressBarStyle;

/**
 * Creates console progress bars for fetch and merge runs, and adapts them to
 * {@link ProgressCallback}.
 */
public class ProgressBarFactory {
    private final boolean enabled;

    public ProgressBarFactory(boolean enabled) {
        this.enabled = enabled;
    }

    public ProgressBar create(String taskName, long maxValue) {
        ProgressBarBuilder builder = new ProgressBarBuilder()
                .setTaskName(taskName)
                .setInitialMax(maxValue)
                .setStyle(ProgressBarStyle.ASCII);
        if (!enabled) {
            builder.setConsumer(new NoOpProgressBarConsumer());
        }
        return builder.build();
    }

    /**
     * Returns a callback that moves the bar to the reported count. Safe to call
     * from worker threads; the bar only ever moves forward.
     */
    public static ProgressCallback callbackFor(ProgressBar bar) {
        return (processed, total, message) -> {
            synchronized (bar) {
                if (total > 0 && bar.getMax() != total) {
                    bar.maxHint(total);
                }
                if (processed > bar.getCurrent()) {
                    bar.stepTo(processed);
                }
            }
        };
    }
}
