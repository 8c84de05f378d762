package com.example.emobility.security.annotation;

import java.lang.annotation.*;

// Inject the resolved CallerContext into a controller method parameter
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ResolvedCaller {
}
