package com.openforge.actionmind.history;

/**
 * How one action has fared within one situation.
 *
 * @param action      action identifier
 * @param frequency   number of recorded attempts
 * @param successRate fraction of attempts that succeeded
 */
public record ActionSuccessRate(String action, long frequency, double successRate) {}
