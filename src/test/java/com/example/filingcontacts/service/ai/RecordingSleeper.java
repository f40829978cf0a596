package com.example.filingcontacts.service.ai;

import com.example.filingcontacts.service.Sleeper;

import java.util.ArrayList;
import java.util.List;

/**
 * Records requested pauses instead of waiting.
 */
public class RecordingSleeper implements Sleeper {

    private final List<Long> delays = new ArrayList<>();

    @Override
    public void sleep(long millis) {
        delays.add(millis);
    }

    public List<Long> getDelays() {
        return delays;
    }
}
