package com.cfclient.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.Map;

/**
 * Hack attempt. judgeProtocol is keyed manual, protocol and verdict.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode
@ToString
public class Hack {

    private Long id;
    private Long creationTimeSeconds;
    private Party hacker;
    private Party defender;
    private String verdict;
    private Problem problem;
    private String test;
    private Map<String, String> judgeProtocol;
}
