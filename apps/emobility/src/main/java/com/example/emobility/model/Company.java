package com.example.emobility.model;

import com.example.emobility.authz.model.AuthorizableEntity;
import com.example.emobility.authz.model.AuthorizationActions;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Company implements AuthorizableEntity {

    @Id
    private String id;
    private String name;
    private String address;
    private String logo;
    @Builder.Default
    private boolean issuer = true;
    private Instant createdOn;

    @Transient
    private AuthorizationActions authorizations;
}
