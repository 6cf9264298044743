package com.cfclient.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Single submission.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode
@ToString
public class Submission {

    private Long id;
    private Integer contestId;
    private Long creationTimeSeconds;
    private Long relativeTimeSeconds;
    private Problem problem;
    private Party author;
    private String programmingLanguage;
    private Verdict verdict;
    private String testset;
    private Integer passedTestCount;
    private Long timeConsumedMillis;
    private Long memoryConsumedBytes;
    private Double points;
}
