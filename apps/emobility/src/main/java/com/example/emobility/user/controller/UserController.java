package com.example.emobility.user.controller;

import com.example.emobility.model.Car;
import com.example.emobility.model.Tag;
import com.example.emobility.model.User;
import com.example.emobility.security.annotation.ResolvedCaller;
import com.example.emobility.security.context.CallerContext;
import com.example.emobility.user.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;

    @GetMapping("/users/{userId}")
    public Mono<User> getUser(@ResolvedCaller CallerContext caller, @PathVariable String userId) {
        log.debug("GET /users/{} - user: {}", userId, caller.user().id());
        return userService.getUser(caller, userId);
    }

    @GetMapping("/tags/{tagId}")
    public Mono<Tag> getTag(@ResolvedCaller CallerContext caller, @PathVariable String tagId) {
        log.debug("GET /tags/{} - user: {}", tagId, caller.user().id());
        return userService.getTag(caller, tagId);
    }

    @GetMapping("/tags/visual/{visualId}")
    public Mono<Tag> getTagByVisualId(@ResolvedCaller CallerContext caller, @PathVariable String visualId) {
        log.debug("GET /tags/visual/{} - user: {}", visualId, caller.user().id());
        return userService.getTagByVisualId(caller, visualId);
    }

    @GetMapping("/cars/{carId}")
    public Mono<Car> getCar(@ResolvedCaller CallerContext caller, @PathVariable String carId) {
        log.debug("GET /cars/{} - user: {}", carId, caller.user().id());
        return userService.getCar(caller, carId);
    }
}
