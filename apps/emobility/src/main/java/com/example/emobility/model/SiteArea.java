package com.example.emobility.model;

import com.example.emobility.authz.model.AuthorizableEntity;
import com.example.emobility.authz.model.AuthorizationActions;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SiteArea implements AuthorizableEntity {

    @Id
    private String id;
    private String name;
    private String siteID;
    @Builder.Default
    private boolean issuer = true;
    private boolean accessControl;
    private Double maximumPower;

    @Transient
    private AuthorizationActions authorizations;
}
