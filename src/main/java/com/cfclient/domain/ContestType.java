package com.cfclient.domain;

/**
 * Scoring system of a contest.
 */
public enum ContestType {
    CF,
    IOI,
    ICPC
}
