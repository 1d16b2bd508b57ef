package com.specscout.common.consensus;

import com.specscout.common.model.Recommendation;
import com.specscout.common.model.Verdict;

import java.util.List;

/**
 * Strategy contract for reducing the verdicts of one analysis call into a single
 * {@link Recommendation}.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: no mutable state; safe to call concurrently</li>
 *   <li><b>Deterministic</b>: the same ordered verdict list always yields an equal recommendation;
 *       no randomness and no clock reads</li>
 *   <li><b>Non-null</b>: must always return a valid {@link Recommendation}, including for
 *       {@code null} or empty input</li>
 * </ul>
 *
 * <p>Current implementation: {@link QuorumConsensusStrategy}.
 */
public interface ConsensusEngine {

    /**
     * @param specLocation location of the analyzed example, copied to the recommendation
     * @param verdicts     agent verdicts in canonical order (may be null or empty)
     * @return a {@link Recommendation}: never {@code null}
     */
    Recommendation compute(String specLocation, List<Verdict> verdicts);
}
