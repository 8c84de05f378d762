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
 * RFID badge. {@link #visualID} is the number printed on the card.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Tag implements AuthorizableEntity {

    @Id
    private String id;
    private String visualID;
    private String userID;
    private String description;
    private boolean active;
    @Builder.Default
    private boolean issuer = true;

    @Transient
    private AuthorizationActions authorizations;

    @Override
    public String ownerId() {
        return userID;
    }
}
