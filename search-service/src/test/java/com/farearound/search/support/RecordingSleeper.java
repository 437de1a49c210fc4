package com.farearound.search.support;

import com.farearound.search.retry.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records requested delays instead of sleeping.
 */
public class RecordingSleeper implements Sleeper {

    private final List<Duration> delays = new CopyOnWriteArrayList<>();

    @Override
    public void sleep(Duration delay) {
        delays.add(delay);
    }

    public List<Duration> delays() {
        return List.copyOf(delays);
    }
}
