package com.example.emobility.model;

import com.example.emobility.authz.model.AuthorizableEntity;
import com.example.emobility.authz.model.AuthorizationActions;
import com.example.emobility.authz.model.Role;
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
public class User implements AuthorizableEntity {

    @Id
    private String id;
    private String name;
    private String firstName;
    private String email;
    private Role role;
    private String status;
    private String locale;
    @Builder.Default
    private boolean issuer = true;

    @Transient
    private AuthorizationActions authorizations;

    @Override
    public String ownerId() {
        return id;
    }
}
