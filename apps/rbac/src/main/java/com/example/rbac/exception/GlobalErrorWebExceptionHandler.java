package com.example.rbac.exception;

import com.example.rbac.authz.exception.RbacConfigurationException;
import com.example.rbac.observability.filter.CorrelationIdFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.web.WebProperties;
import org.springframework.boot.autoconfigure.web.reactive.error.AbstractErrorWebExceptionHandler;
import org.springframework.boot.web.reactive.error.ErrorAttributes;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.server.RequestPredicates;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Renders every unhandled error as an {@link ErrorResponse}.
 * Capability checks never raise errors for unknown input, so this mostly sees
 * malformed requests and startup-time configuration problems surfacing late.
 */
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

        // Missing or unconvertible request parameters -> 400
        if (error instanceof ServerWebInputException inputException) {
            log.warn("Invalid request input: path={}, reason={}", path, inputException.getReason());
            return createErrorResponse(request, HttpStatus.BAD_REQUEST, "invalid_request",
                    inputException.getReason() != null ? inputException.getReason() : "Invalid request", path);
        }

        // ResponseStatusException -> use its status
        if (error instanceof ResponseStatusException statusException) {
            HttpStatus status = HttpStatus.resolve(statusException.getStatusCode().value());
            if (status == null) {
                status = HttpStatus.INTERNAL_SERVER_ERROR;
            }

            log.warn("Response status exception: path={}, status={}, reason={}",
                    path, status, statusException.getReason());

            return createErrorResponse(request, status, "request_error",
                    statusException.getReason() != null ? statusException.getReason() : status.getReasonPhrase(),
                    path);
        }

        // Configuration errors reaching a request are a deployment bug -> 500
        if (error instanceof RbacConfigurationException configError) {
            log.error("Access-control configuration error: path={}, problems={}",
                    path, configError.getProblems(), configError);
            return createErrorResponse(request, HttpStatus.INTERNAL_SERVER_ERROR, "configuration_error",
                    "Access-control configuration is invalid", path, configError.getProblems());
        }

        // IllegalArgumentException -> 400
        if (error instanceof IllegalArgumentException) {
            log.warn("Invalid argument: path={}, error={}", path, error.getMessage());
            return createErrorResponse(request, HttpStatus.BAD_REQUEST, "invalid_argument",
                    "Invalid request parameter", path);
        }

        log.error("Unhandled error: path={}, error={}", path, error.getMessage(), error);

        return createErrorResponse(
                request,
                HttpStatus.INTERNAL_SERVER_ERROR,
                "server_error",
                "An unexpected error occurred",
                path
        );
    }

    private Mono<ServerResponse> createErrorResponse(ServerRequest request, HttpStatus status, String error,
                                                     String message, String path) {
        return createErrorResponse(request, status, error, message, path, List.of());
    }

    private Mono<ServerResponse> createErrorResponse(ServerRequest request, HttpStatus status, String error,
                                                     String message, String path, List<String> problems) {
        String correlationId = request.exchange().getResponse().getHeaders()
                .getFirst(CorrelationIdFilter.CORRELATION_ID_HEADER);
        ErrorResponse body = ErrorResponse.of(status.value(), error, message, path, correlationId)
                .withProblems(problems);

        return ServerResponse.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromValue(body));
    }
}
