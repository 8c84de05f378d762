package com.example.emobility.model;

import com.example.emobility.authz.model.AuthorizableEntity;
import com.example.emobility.authz.model.AuthorizationActions;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;

/**
 * Vehicle model shared by all tenants, identified by a numeric ID.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CarCatalog implements AuthorizableEntity {

    @Id
    private Integer id;
    private String vehicleMake;
    private String vehicleModel;
    private String vehicleModelVersion;

    @Transient
    private AuthorizationActions authorizations;
}
