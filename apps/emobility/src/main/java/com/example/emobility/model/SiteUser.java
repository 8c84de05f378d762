package com.example.emobility.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;

/**
 * Assignment of a user to a site, with the user's site-level roles.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SiteUser {

    @Id
    private String id;
    private String userID;
    private String siteID;
    private boolean siteAdmin;
    private boolean siteOwner;
}
