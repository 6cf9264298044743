package com.cfclient.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.List;

/**
 * One row of contest standings.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode
@ToString
public class RanklistRow {

    private Party party;
    private Integer rank;
    private Double points;
    private Integer penalty;
    private Integer successfulHackCount;
    private Integer unsuccessfulHackCount;
    private List<ProblemResult> problemResults;
    private Long lastSubmissionTimeSeconds;
}
