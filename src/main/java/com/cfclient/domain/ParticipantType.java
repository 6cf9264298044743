package com.cfclient.domain;

public enum ParticipantType {
    CONTESTANT,
    PRACTICE,
    VIRTUAL,
    MANAGER,
    OUT_OF_COMPETITION
}
