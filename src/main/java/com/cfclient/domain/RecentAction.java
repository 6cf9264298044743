package com.cfclient.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Recent platform action. Exactly one of blogEntry or comment is usually set.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode
@ToString
public class RecentAction {

    private Long timeSeconds;
    private BlogEntry blogEntry;
    private Comment comment;
}
