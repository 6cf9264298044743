package com.cfclient.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.List;

/**
 * Result of problemset.problems. problemStatistics is index-aligned with problems.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode
@ToString
public class ProblemSetProblems {

    private List<Problem> problems;
    private List<ProblemStatistics> problemStatistics;
}
