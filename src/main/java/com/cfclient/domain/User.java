package com.cfclient.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Codeforces user profile as returned by user.info and user.ratedList. Every field may be absent.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode
@ToString
public class User {

    private String handle;
    private String vkId;
    private String openId;
    private String firstName;
    private String lastName;
    private String country;
    private String city;
    private String organization;
    private Integer contribution;
    /** e.g. "legendary grandmaster". */
    private String rank;
    private Integer rating;
    private String maxRank;
    private Integer maxRating;
    private Long lastOnlineTimeSeconds;
    private Long registrationTimeSeconds;
    private Integer friendOfCount;
    private String avatar;
    private String titlePhoto;
    /** Only present when the user shares contact info with the authorized caller. */
    private String email;
}
