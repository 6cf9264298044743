package com.cfclient.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.List;

/**
 * Problem statement metadata.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode
@ToString
public class Problem {

    private Integer contestId;
    private String problemsetName;
    /** Letter or letter+digit, e.g. "A" or "B1". */
    private String index;
    private String name;
    private String type;
    private Double points;
    private Integer rating;
    private List<String> tags;
}
