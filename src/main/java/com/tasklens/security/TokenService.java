package com.tasklens.security;

import com.tasklens.config.TasklensProperties;
import com.tasklens.user.User;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Issues signed access tokens. The subject is the user id; scopes come from
 * {@link RbacService#scopesFor(User)}.
 */
@Service
public class TokenService {

    static final String ISSUER = "tasklens";

    private final JwtEncoder jwtEncoder;
    private final RbacService rbacService;
    private final Duration lifetime;
    private final Clock clock;

    @Autowired
    public TokenService(JwtEncoder jwtEncoder, RbacService rbacService, TasklensProperties properties) {
        this(jwtEncoder, rbacService, properties, Clock.systemUTC());
    }

    TokenService(JwtEncoder jwtEncoder, RbacService rbacService, TasklensProperties properties, Clock clock) {
        this.jwtEncoder = jwtEncoder;
        this.rbacService = rbacService;
        this.lifetime = Duration.ofMinutes(properties.getSecurity().getAccessTokenExpireMinutes());
        this.clock = clock;
    }

    public IssuedToken issue(User user) {
        Instant now = clock.instant();
        JwtClaimsSet claims = JwtClaimsSet.builder()
                .issuer(ISSUER)
                .subject(String.valueOf(user.getId()))
                .issuedAt(now)
                .expiresAt(now.plus(lifetime))
                .claim("username", user.getUsername())
                .claim("scope", String.join(" ", rbacService.scopesFor(user)))
                .build();
        JwsHeader header = JwsHeader.with(JwtConfig.ALGORITHM).build();
        String value = jwtEncoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();
        return new IssuedToken(value, lifetime.toSeconds());
    }

    public record IssuedToken(String value, long expiresInSeconds) {}
}
