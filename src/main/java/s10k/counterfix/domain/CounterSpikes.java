package s10k.counterfix.domain;

import java.util.List;

/**
 * The resets found on one counter.
 * 
 * @param counterId the counter ID
 * @param spikes    the resets
 */
public record CounterSpikes(String counterId, List<SpikeDetail> spikes) {

}
