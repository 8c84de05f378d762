package com.example.emobility.exception;

import com.example.emobility.common.util.StringSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.web.WebProperties;
import org.springframework.boot.autoconfigure.web.reactive.error.AbstractErrorWebExceptionHandler;
import org.springframework.boot.web.error.ErrorAttributeOptions;
import org.springframework.boot.web.reactive.error.ErrorAttributes;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.server.RequestPredicates;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Component
@Order(-2)  // Higher priority than DefaultErrorWebExceptionHandler
public class GlobalErrorWebExceptionHandler extends AbstractErrorWebExceptionHandler {

    public GlobalErrorWebExceptionHandler(
            ErrorAttributes errorAttributes,
            WebProperties webProperties,
            ApplicationContext applicationContext,
            ServerCodecConfigurer serverCodecConfigurer) {
        super(errorAttributes, webProperties.getResources(), applicationContext);
        this.setMessageWriters(serverCodecConfigurer.getWriters());
    }

    @Override
    protected RouterFunction<ServerResponse> getRoutingFunction(ErrorAttributes errorAttributes) {
        return RouterFunctions.route(RequestPredicates.all(), this::renderErrorResponse);
    }

    private Mono<ServerResponse> renderErrorResponse(ServerRequest request) {
        Throwable error = getError(request);
        String path = request.path();

        if (error instanceof AccessException accessError) {
            HttpStatus status = statusOf(accessError);
            log.warn("Access refused: status={}, entity={}, id={}, action={}, user={}, path={}, error={}",
                    status.value(),
                    accessError.getEntity(),
                    StringSanitizer.forLog(accessError.getEntityId()),
                    accessError.getAction(),
                    StringSanitizer.forLog(accessError.getUserId()),
                    path,
                    StringSanitizer.forLog(accessError.getMessage(), 256));

            return createErrorResponse(status, accessError.getErrorCode(), clientMessage(accessError), path);
        }

        // Storage failures -> 503, never reported as a denial
        if (error instanceof SystemException systemError) {
            log.error("System error: component={}, path={}, error={}",
                    systemError.getComponent(), path, systemError.getMessage(), systemError);

            return createErrorResponse(HttpStatus.SERVICE_UNAVAILABLE, "system_error",
                    "Service temporarily unavailable", path);
        }

        if (error instanceof WebExchangeBindException bindException) {
            String fieldErrors = bindException.getFieldErrors().stream()
                    .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                    .collect(Collectors.joining(", "));

            log.warn("Validation failed: path={}, errors={}", path, fieldErrors);

            return createErrorResponse(HttpStatus.BAD_REQUEST, "validation_error",
                    "Validation failed: " + fieldErrors, path);
        }

        if (error instanceof ResponseStatusException statusException) {
            HttpStatus status = HttpStatus.resolve(statusException.getStatusCode().value());
            if (status == null) {
                status = HttpStatus.INTERNAL_SERVER_ERROR;
            }

            log.warn("Response status exception: path={}, status={}, reason={}",
                    path, status, statusException.getReason());

            return createErrorResponse(status, "request_error",
                    statusException.getReason() != null ? statusException.getReason() : status.getReasonPhrase(),
                    path);
        }

        if (error instanceof IllegalArgumentException) {
            log.warn("Invalid argument: path={}, error={}", path, error.getMessage());
            return createErrorResponse(HttpStatus.BAD_REQUEST, "invalid_argument",
                    "Invalid request parameter", path);
        }

        Map<String, Object> errorAttributes = getErrorAttributes(request, ErrorAttributeOptions.defaults());
        int status = (int) errorAttributes.getOrDefault("status", 500);

        log.error("Unhandled error: path={}, status={}, error={}",
                path, status, error.getMessage(), error);

        return createErrorResponse(
                HttpStatus.valueOf(status),
                "server_error",
                "An unexpected error occurred",
                path
        );
    }

    static HttpStatus statusOf(AccessException error) {
        if (error instanceof ValidationException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (error instanceof NotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (error instanceof ExternalEntityException) {
            return HttpStatus.CONFLICT;
        }
        return HttpStatus.FORBIDDEN;
    }

    // Forbidden responses never say whether the entity exists.
    private static String clientMessage(AccessException error) {
        return error instanceof ForbiddenException ? "Access denied" : error.getMessage();
    }

    private Mono<ServerResponse> createErrorResponse(HttpStatus status, String error, String message, String path) {
        ErrorResponse body = ErrorResponse.of(status.value(), error, message, path);

        return ServerResponse.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromValue(body));
    }
}
