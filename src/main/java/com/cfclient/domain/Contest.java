package com.cfclient.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Contest or gym contest.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode
@ToString
public class Contest {

    private Integer id;
    private String name;
    private ContestType type;
    private ContestPhase phase;
    private Boolean frozen;
    private Long durationSeconds;
    private Long startTimeSeconds;
    /** Negative before the contest starts. */
    private Long relativeTimeSeconds;
    private String preparedBy;
    private String websiteUrl;
    private String description;
    /** 1..5, gym only. */
    private Integer difficulty;
    private String kind;
    private String icpcRegion;
    private String country;
    private String city;
    private String season;
}
