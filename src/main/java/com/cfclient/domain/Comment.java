package com.cfclient.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode
@ToString
public class Comment {

    private Long id;
    private Long creationTimeSeconds;
    private String commentatorHandle;
    private String locale;
    private String text;
    private Long parentCommentId;
    private Integer rating;
}
