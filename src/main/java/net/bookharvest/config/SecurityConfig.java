/**
 * Security settings for the operator surface
 *
 * Features:
 * - HTTP Basic authentication for /admin/** with the ADMIN role
 * - Stateless sessions, so CSRF protection is not needed
 * - In-memory admin account from app.security.admin.* (disabled when no password is set)
 * - Health endpoint left open for orchestrators
 */
package net.bookharvest.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.util.StringUtils;

@Configuration
@EnableWebSecurity
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    private final AdminAuthenticationEntryPoint adminAuthenticationEntryPoint;

    public SecurityConfig(AdminAuthenticationEntryPoint adminAuthenticationEntryPoint) {
        this.adminAuthenticationEntryPoint = adminAuthenticationEntryPoint;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            .securityMatcher("/**")
            .authorizeHttpRequests(authorizeRequests ->
                authorizeRequests
                    .requestMatchers("/admin/**").hasRole("ADMIN")
                    .requestMatchers("/actuator/health", "/actuator/health/**").permitAll()
                    .anyRequest().authenticated()
            )
            .httpBasic(httpBasic -> httpBasic.authenticationEntryPoint(adminAuthenticationEntryPoint))
            // Credentials travel with every request; no session cookie is ever issued
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .csrf(csrf -> csrf.disable());
        return http.build();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public UserDetailsService userDetailsService(PasswordEncoder passwordEncoder,
                                                 @Value("${app.security.admin.username:admin}") String adminUsername,
                                                 @Value("${app.security.admin.password:}") String adminPassword) {
        InMemoryUserDetailsManager userDetailsManager = new InMemoryUserDetailsManager();
        if (StringUtils.hasText(adminPassword)) {
            userDetailsManager.createUser(User.builder()
                .username(StringUtils.hasText(adminUsername) ? adminUsername.trim() : "admin")
                .password(passwordEncoder.encode(adminPassword.trim()))
                .roles("ADMIN")
                .build());
        } else {
            log.error("Admin endpoints disabled: missing app.security.admin.password. Set APP_SECURITY_ADMIN_PASSWORD to enable /admin/**.");
        }
        return userDetailsManager;
    }
}
