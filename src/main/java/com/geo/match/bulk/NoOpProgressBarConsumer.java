package com.geo.match.bulk;

import me.tongfei.progressbar.ProgressBarConsumer;

/**
 * Progress bar consumer that renders nothing. Used when progress output is
 * disabled, such as in tests or when verbose logging would interleave with the bar.
 */
public class NoOpProgressBarConsumer implements ProgressBarConsumer {

    @Override
    public int getMaxRenderedLength() {
        return 0;
    }

    @Override
    public void accept(String rendered) {
        // nothing to render
    }

    @Override
    public void close() {
        // nothing to release
    }
}
