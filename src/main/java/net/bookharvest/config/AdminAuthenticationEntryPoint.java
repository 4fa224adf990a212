package net.bookharvest.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.authentication.www.BasicAuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * Answers unauthenticated admin calls with an RFC 9457 problem body that tells the operator which
 * credentials are expected.
 */
@Component
public class AdminAuthenticationEntryPoint extends BasicAuthenticationEntryPoint {

    static final String REALM = "BookHarvestAdmin";

    private final ObjectMapper objectMapper;

    public AdminAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authEx) throws IOException {
        response.addHeader("WWW-Authenticate", "Basic realm=\"" + getRealmName() + "\"");
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());

        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(
            HttpStatus.UNAUTHORIZED,
            "HTTP Basic Authentication required for backfill admin endpoints."
        );
        problemDetail.setInstance(URI.create(request.getRequestURI()));
        problemDetail.setProperty("expectedHeader", "Authorization: Basic <base64_encoded_username:password>");
        problemDetail.setProperty("passwordEnvironmentVariable", "APP_SECURITY_ADMIN_PASSWORD");

        response.getWriter().write(objectMapper.writeValueAsString(problemDetail));
    }

    @Override
    public void afterPropertiesSet() {
        setRealmName(REALM);
        super.afterPropertiesSet();
    }
}
