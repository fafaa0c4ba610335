package com.tasklens.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tasklens.observability.OperationInterceptor;
import com.tasklens.observability.RequestContext;
import com.tasklens.security.TokenService;
import com.tasklens.user.User;
import com.tasklens.user.UserService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {

    static final String TOKEN_TYPE = "bearer";

    private final UserService userService;
    private final TokenService tokenService;
    private final OperationInterceptor operations;

    public AuthController(UserService userService, TokenService tokenService, OperationInterceptor operations) {
        this.userService = userService;
        this.tokenService = tokenService;
        this.operations = operations;
    }

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    public UserResponse register(@Valid @RequestBody RegisterRequest request, RequestContext context) {
        User user = operations.call(context, "user_registration", () -> userService.register(
                context, request.email(), request.username(), request.password(), request.fullName()));
        return UserResponse.from(user);
    }

    @PostMapping("/login")
    public TokenResponse login(@Valid @RequestBody LoginRequest request, RequestContext context) {
        return operations.call(context, "user_login", () -> {
            User user = userService.authenticate(context, request.email(), request.password());
            TokenService.IssuedToken token = tokenService.issue(user);
            return new TokenResponse(token.value(), TOKEN_TYPE, token.expiresInSeconds());
        });
    }

    @GetMapping("/me")
    public UserResponse me(@AuthenticationPrincipal Jwt jwt, RequestContext context) {
        return UserResponse.from(userService.currentUser(context, jwt.getSubject()));
    }

    public record RegisterRequest(
            @NotBlank @Email String email,
            @NotBlank @Size(max = 100) String username,
            @NotBlank @Size(min = 8, max = 128) String password,
            @Size(max = 255) String fullName
    ) {}

    public record LoginRequest(
            @NotBlank @Email String email,
            @NotBlank String password
    ) {}

    public record TokenResponse(
            String accessToken,
            String tokenType,
            long expiresIn
    ) {}

    public record UserResponse(
            Long id,
            String email,
            String username,
            String fullName,
            @JsonProperty("is_active") boolean isActive,
            @JsonProperty("is_superuser") boolean isSuperuser,
            Instant createdAt,
            Instant lastLogin
    ) {
        static UserResponse from(User user) {
            return new UserResponse(user.getId(), user.getEmail(), user.getUsername(), user.getFullName(),
                    user.isActive(), user.isSuperuser(), user.getCreatedAt(), user.getLastLogin());
        }
    }
}
