package com.example.emobility.user.service;

import com.example.emobility.authz.gate.AccessOptions;
import com.example.emobility.authz.gate.EntityAccessGate;
import com.example.emobility.authz.model.Action;
import com.example.emobility.model.Car;
import com.example.emobility.model.Tag;
import com.example.emobility.model.User;
import com.example.emobility.security.context.CallerContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Service
@RequiredArgsConstructor
public class UserService {

    private final EntityAccessGate accessGate;

    public Mono<User> getUser(CallerContext caller, String userId) {
        return accessGate.checkAndGetUserAuthorization(caller.tenant(), caller.user(), userId, Action.READ,
                AccessOptions.defaults().withProjectFields());
    }

    public Mono<Tag> getTag(CallerContext caller, String tagId) {
        return accessGate.checkAndGetTagAuthorization(caller.tenant(), caller.user(), tagId, Action.READ,
                AccessOptions.defaults().withProjectFields());
    }

    public Mono<Tag> getTagByVisualId(CallerContext caller, String visualId) {
        return accessGate.checkAndGetTagByVisualIdAuthorization(caller.tenant(), caller.user(), visualId, Action.READ,
                AccessOptions.defaults().withProjectFields());
    }

    // Cars carry no issuer, the gate skips that check for them.
    public Mono<Car> getCar(CallerContext caller, String carId) {
        return accessGate.checkAndGetCarAuthorization(caller.tenant(), caller.user(), carId, Action.READ,
                AccessOptions.defaults());
    }
}
