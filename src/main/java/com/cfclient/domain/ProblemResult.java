package com.cfclient.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Party result on one problem inside a ranklist row.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode
@ToString
public class ProblemResult {

    private Double points;
    private Integer penalty;
    private Integer rejectedAttemptCount;
    /** PRELIMINARY or FINAL. */
    private String type;
    private Long bestSubmissionTimeSeconds;
}
