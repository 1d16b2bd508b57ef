package com.specscout.common.model;

/**
 * Direction a verdict pushes the "optimize persistence" decision.
 *
 * <ul>
 *   <li>{@link #SUPPORT}: evidence that the example can avoid persistence</li>
 *   <li>{@link #OPPOSE}: evidence that persistence or the current strategy must stay</li>
 *   <li>{@link #ABSTAIN}: no opinion; ignored by the quorum</li>
 *   <li>{@link #VETO}: a detected behavioural risk; overrides everything else</li>
 * </ul>
 */
public enum Stance {
    SUPPORT,
    OPPOSE,
    ABSTAIN,
    VETO
}
