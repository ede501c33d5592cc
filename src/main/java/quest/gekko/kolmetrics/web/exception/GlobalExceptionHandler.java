package quest.gekko.kolmetrics.web.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import quest.gekko.kolmetrics.service.core.ProviderUnavailableException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(TenantAccessException.class)
    public ResponseEntity<Map<String, Object>> handleTenantAccess(TenantAccessException ex, HttpServletRequest request) {
        final HttpStatus status = ex.isAuthenticated() ? HttpStatus.FORBIDDEN : HttpStatus.UNAUTHORIZED;
        log.warn("{} for URL: {}", status.getReasonPhrase(), request.getRequestURI());
        return body(status, ex.getMessage());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ResourceNotFoundException ex, HttpServletRequest request) {
        log.warn("Not found: {} for URL: {}", ex.getMessage(), request.getRequestURI());
        return body(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(CooldownActiveException.class)
    public ResponseEntity<Map<String, Object>> handleCooldown(CooldownActiveException ex) {
        final ResponseEntity<Map<String, Object>> response = body(HttpStatus.TOO_MANY_REQUESTS, ex.getMessage());
        response.getBody().put("minutesRemaining", ex.getMinutesRemaining());
        return response;
    }

    @ExceptionHandler(ProviderUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleProviderUnavailable(ProviderUnavailableException ex,
                                                                         HttpServletRequest request) {
        log.warn("No provider could serve {}: {}", request.getRequestURI(), ex.getMessage());
        return body(HttpStatus.BAD_GATEWAY, "Failed to fetch metrics: " + ex.getMessage());
    }

    @ExceptionHandler(CronSecretMisconfiguredException.class)
    public ResponseEntity<Map<String, Object>> handleCronMisconfigured(CronSecretMisconfiguredException ex) {
        log.error("Scheduled refresh rejected: kol.cron.secret is not set in production");
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Server misconfigured");
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("Bad request: {} for URL: {}", ex.getMessage(), request.getRequestURI());
        return body(HttpStatus.BAD_REQUEST, "Invalid request: " + ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneralException(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error for URL: {}", request.getRequestURI(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
    }

    private static ResponseEntity<Map<String, Object>> body(final HttpStatus status, final String error) {
        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("status", status.value());
        return ResponseEntity.status(status).body(body);
    }
}
