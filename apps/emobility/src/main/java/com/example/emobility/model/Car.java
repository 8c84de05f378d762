package com.example.emobility.model;

import com.example.emobility.authz.model.AuthorizableEntity;
import com.example.emobility.authz.model.AuthorizationActions;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;

import java.util.List;

/**
 * A user's car. Pool cars are shared by everyone assigned to one of {@link #siteIDs}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Car implements AuthorizableEntity {

    @Id
    private String id;
    private String vin;
    private String licensePlate;
    private Integer carCatalogID;
    private String userID;
    private CarType type;
    private List<String> siteIDs;

    @Transient
    private AuthorizationActions authorizations;

    @Override
    public String ownerId() {
        return userID;
    }
}
