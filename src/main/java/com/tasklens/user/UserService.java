package com.tasklens.user;

import com.tasklens.audit.AuditLog;
import com.tasklens.audit.AuditService;
import com.tasklens.exception.ApiException;
import com.tasklens.observability.EventLog;
import com.tasklens.observability.RequestContext;
import com.tasklens.observability.TasklensMetrics;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Account registration, credential checks and resolution of the token subject to a user.
 */
@Service
public class UserService {

    private static final EventLog events = EventLog.getLogger(UserService.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final AuditService auditService;
    private final TasklensMetrics metrics;

    public UserService(UserRepository userRepository,
                       PasswordEncoder passwordEncoder,
                       AuditService auditService,
                       TasklensMetrics metrics) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.auditService = auditService;
        this.metrics = metrics;
    }

    @Transactional
    public User register(RequestContext context, String email, String username, String password, String fullName) {
        events.info(context, "User registration attempt", "email", email, "username", username);

        if (userRepository.existsByEmailOrUsername(email, username)) {
            throw alreadyRegistered(context, email, username);
        }

        User user;
        try {
            user = userRepository.save(new User(email, username, passwordEncoder.encode(password), fullName));
        } catch (DataIntegrityViolationException e) {
            // A concurrent registration won the unique constraint after the existence check
            throw alreadyRegistered(context, email, username);
        }
        context.bindUser(user.getId());
        auditService.record(context, AuditLog.ACTION_USER_REGISTRATION, user.getId(), "user", user.getId(),
                Map.of("username", username));
        metrics.recordUserRegistration();

        events.info(context, "User registered", "email", email);
        return user;
    }

    /**
     * Checks credentials and stamps the last login. Unknown, inactive and wrong-password
     * cases fail identically so the response does not reveal which accounts exist.
     */
    @Transactional
    public User authenticate(RequestContext context, String email, String password) {
        events.info(context, "Login attempt", "email", email);

        User user = userRepository.findByEmail(email)
                .filter(User::isActive)
                .orElse(null);
        if (user == null) {
            events.warn(context, "Authentication failed, user not found", "email", email);
            throw loginFailed();
        }
        if (!passwordEncoder.matches(password, user.getHashedPassword())) {
            events.warn(context, "Authentication failed, invalid password", "email", email, "user_id", user.getId());
            throw loginFailed();
        }

        user.recordLogin();
        context.bindUser(user.getId());
        auditService.record(context, AuditLog.ACTION_USER_LOGIN, user.getId(), "user", user.getId(), Map.of());
        metrics.recordLoginAttempt(true);

        events.info(context, "User logged in", "email", email);
        return user;
    }

    /**
     * Resolves the subject of a verified access token to an active user and binds it to
     * the request context.
     */
    @Transactional(readOnly = true)
    public User currentUser(RequestContext context, String subject) {
        long userId;
        try {
            userId = Long.parseLong(subject);
        } catch (NumberFormatException e) {
            events.warn(context, "Invalid user ID in token", "subject", subject);
            throw ApiException.unauthorized("INVALID_TOKEN", "Invalid user ID");
        }

        User user = userRepository.findById(userId).orElseThrow(() -> {
            events.warn(context, "User not found for valid token", "subject", subject);
            return ApiException.unauthorized("INVALID_TOKEN", "User not found");
        });
        if (!user.isActive()) {
            throw ApiException.badRequest("INACTIVE_USER", "Inactive user");
        }
        context.bindUser(user.getId());
        return user;
    }

    private ApiException loginFailed() {
        metrics.recordLoginAttempt(false);
        return ApiException.unauthorized("INVALID_CREDENTIALS", "Incorrect email or password");
    }

    private static ApiException alreadyRegistered(RequestContext context, String email, String username) {
        events.warn(context, "Registration failed, user already exists", "email", email, "username", username);
        return ApiException.badRequest("EMAIL_OR_USERNAME_TAKEN", "Email or username already registered");
    }
}
