/* (C)2026 */
package com.ammann.trend.model;

import java.util.List;

/**
 * Observations that share one season key. Pairs are only ever formed inside a group.
 *
 * @param key          season key produced by the season function
 * @param observations time-sorted members of the season
 */
public record SeasonGroup(int key, List<Observation> observations) {

    public SeasonGroup {
        observations = List.copyOf(observations);
    }

    public int size() {
        return observations.size();
    }
}
