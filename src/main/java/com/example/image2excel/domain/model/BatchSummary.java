package com.example.image2excel.domain.model;

import java.time.Duration;
import java.util.List;

/**
 * Aggregate counters of one command line run.
 */
public record BatchSummary(int filesSeen, int filesProcessed, Duration elapsed, List<ConversionOutcome> outcomes) {

    public BatchSummary {
        outcomes = List.copyOf(outcomes);
    }

	/**
	 * Formats the elapsed time as minutes and seconds, omitting minutes below one minute.
	 *
	 * @return e.g. {@code "2 minutes, 5 seconds"} or {@code "40 seconds"}
	 */
    public String elapsedDescription() {
        long minutes = elapsed.toMinutes();
        long seconds = elapsed.toSecondsPart();
        return minutes > 0
                ? minutes + " minutes, " + seconds + " seconds"
                : seconds + " seconds";
    }
}
