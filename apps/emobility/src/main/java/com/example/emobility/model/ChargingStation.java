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
public class ChargingStation implements AuthorizableEntity {

    @Id
    private String id;
    private String siteID;
    private String siteAreaID;
    private String companyID;
    private String chargePointVendor;
    @Builder.Default
    private boolean issuer = true;
    private boolean deleted;

    @Transient
    private AuthorizationActions authorizations;
}
