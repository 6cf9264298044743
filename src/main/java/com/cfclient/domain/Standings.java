package com.cfclient.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.List;

/**
 * Result of contest.standings: the contest, its problems and the requested ranklist rows.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode
@ToString
public class Standings {

    private Contest contest;
    private List<Problem> problems;
    private List<RanklistRow> rows;
}
