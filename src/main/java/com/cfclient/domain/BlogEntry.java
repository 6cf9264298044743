package com.cfclient.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.List;

/**
 * Blog entry. content is only filled by blogEntry.view.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode
@ToString
public class BlogEntry {

    private Long id;
    private String originalLocale;
    private Long creationTimeSeconds;
    private String authorHandle;
    private String title;
    private String content;
    private String locale;
    private Long modificationTimeSeconds;
    private Boolean allowViewHistory;
    private List<String> tags;
    private Integer rating;
}
